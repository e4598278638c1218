package com.tracker.sync.mapping;

import com.tracker.sync.core.model.CanonicalField;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default mappings and the way user mappings override them.
 */
public final class FieldMappingRules {

    public static final List<String> DEFAULT_SPECS = List.of(
            "Estimate:Size:Scale",
            "Priority:Priority",
            "Pipeline:Status",
            "Linked Issues:Text",
            "Epic:Text",
            "Blocked By:Text",
            "Sprint:Iteration",
            "Position:Position"
    );

    private FieldMappingRules() {
    }

    public static List<FieldMappingRule> defaults() {
        return parseAll(DEFAULT_SPECS);
    }

    public static List<FieldMappingRule> parseAll(List<String> specs) {
        List<FieldMappingRule> rules = new ArrayList<>();
        for (String spec : specs) {
            rules.add(FieldMappingRule.parse(spec));
        }
        return rules;
    }

    /**
     * Overlays user rules on the defaults. Any user rule for a source field replaces every default
     * rule of that field; several user rules for one field fan out. Disabled rules are dropped.
     */
    public static List<FieldMappingRule> overlay(List<FieldMappingRule> defaults, List<FieldMappingRule> user) {
        Map<CanonicalField, List<FieldMappingRule>> bySource = new LinkedHashMap<>();
        for (FieldMappingRule rule : defaults) {
            bySource.computeIfAbsent(rule.sourceField(), f -> new ArrayList<>()).add(rule);
        }
        Map<CanonicalField, List<FieldMappingRule>> overrides = new EnumMap<>(CanonicalField.class);
        for (FieldMappingRule rule : user) {
            overrides.computeIfAbsent(rule.sourceField(), f -> new ArrayList<>()).add(rule);
        }
        for (Map.Entry<CanonicalField, List<FieldMappingRule>> e : overrides.entrySet()) {
            bySource.remove(e.getKey());
            bySource.put(e.getKey(), e.getValue());
        }

        List<FieldMappingRule> result = new ArrayList<>();
        for (List<FieldMappingRule> rules : bySource.values()) {
            for (FieldMappingRule rule : rules) {
                if (!rule.isDisabled()) {
                    result.add(rule);
                }
            }
        }
        return result;
    }
}
