package com.tracker.sync.normalize;

import com.tracker.sync.core.model.CanonicalField;

import java.util.List;

/**
 * Field name aliases understood out of the box.
 * Covers ZenHub's GraphQL names and the labels used on the command line.
 */
public final class DefaultFieldAliases {

    private DefaultFieldAliases() {
    }

    public static List<FieldAliasRule> getAllRules() {
        return List.of(
                alias("estimate", "estimate|estimate[ _.]?value|story[ _]?points?|points", CanonicalField.ESTIMATE, 10),
                alias("priority", "priority|priority[ _.]?name", CanonicalField.PRIORITY, 10),
                alias("pipeline", "pipeline|column|status", CanonicalField.PIPELINE, 10),
                alias("epic", "epic|epic[ _]?children|child[ _]?issues", CanonicalField.EPIC, 20),
                alias("blocking", "blocked[ _]?by|blocking|blockers|dependencies", CanonicalField.BLOCKING, 20),
                alias("linked-pr", "linked[ _]?issues|connections|pr|fixes", CanonicalField.LINKED_PR, 20),
                alias("sprint", "sprints?|iteration", CanonicalField.SPRINT, 30),
                alias("position", "position|order|rank", CanonicalField.POSITION, 30),
                alias("workspace", "workspace", CanonicalField.WORKSPACE, 30)
        );
    }

    public static SourceNormalizer createDefaultNormalizer() {
        return new SourceNormalizer(getAllRules());
    }

    private static FieldAliasRule alias(String name, String pattern, CanonicalField field, int priority) {
        return FieldAliasRule.builder()
                .name(name)
                .pattern(pattern)
                .field(field)
                .priority(priority)
                .build();
    }
}
