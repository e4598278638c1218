package com.tracker.sync.mapping;

import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.core.model.FieldValue;
import com.tracker.sync.core.model.MergedIssue;
import com.tracker.sync.core.model.OptionSet;
import com.tracker.sync.core.model.RelationKind;
import com.tracker.sync.core.model.TargetField;
import com.tracker.sync.core.model.TargetFieldType;
import com.tracker.sync.core.model.TargetPayload;
import com.tracker.sync.core.model.TargetSchema;
import com.tracker.sync.matching.MatchStatus;
import com.tracker.sync.matching.MatchStrategy;
import com.tracker.sync.matching.OptionMatch;
import com.tracker.sync.matching.OptionMatcher;
import com.tracker.sync.metrics.NoOpSyncMetrics;
import com.tracker.sync.metrics.SyncMetrics;
import com.tracker.sync.relation.EncodedRelations;
import com.tracker.sync.relation.RelationEncoder;
import com.tracker.sync.relation.TextSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Projects a merged issue onto the target schema.
 *
 * <p>Rules are evaluated in order. A source field may fan out to several destinations; when
 * several rules feed one destination, the first rule with a value wins.</p>
 */
public class FieldMapper {
    private static final Logger log = LoggerFactory.getLogger(FieldMapper.class);

    private final TargetSchema schema;
    private final ScaleProvider scaleProvider;
    private final OptionMatcher optionMatcher;
    private final RelationEncoder relationEncoder;
    private final String targetOrganization;
    private final ConfigurationIssues issues;
    private final TranslationStats stats;
    private final SyncMetrics metrics;

    private FieldMapper(Builder builder) {
        this.schema = Objects.requireNonNull(builder.schema, "schema is required");
        this.targetOrganization = Objects.requireNonNull(builder.targetOrganization, "targetOrganization is required")
                .toLowerCase(Locale.ROOT);
        this.scaleProvider = builder.scaleProvider;
        this.optionMatcher = builder.optionMatcher;
        this.relationEncoder = builder.relationEncoder != null
                ? builder.relationEncoder : new RelationEncoder(targetOrganization);
        this.issues = builder.issues;
        this.stats = builder.stats;
        this.metrics = builder.metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Maps one merged issue.
     */
    public TargetPayload map(MergedIssue issue, List<FieldMappingRule> rules) {
        TargetPayload.Builder payload = TargetPayload.builder(issue.key()).pullRequest(issue.pullRequest());

        Set<RelationKind> textKinds = EnumSet.noneOf(RelationKind.class);
        Set<RelationKind> directiveKinds = EnumSet.noneOf(RelationKind.class);
        List<TextSection> textSections = new ArrayList<>();
        boolean bodyMapped = false;

        for (FieldMappingRule rule : rules) {
            if (rule.isDisabled()) {
                continue;
            }
            CanonicalField field = rule.sourceField();
            if (rule.isText()) {
                bodyMapped = true;
                if (field.isRelation()) {
                    textKinds.add(field.getRelationKind());
                } else {
                    FieldValue value = issue.get(field);
                    if (!value.isEmpty()) {
                        textSections.add(TextSection.of(field.getLabel(), value.text()));
                    }
                }
            } else if (rule.isLinkedPullRequests()) {
                if (field.getRelationKind() == RelationKind.LINKED_PR) {
                    directiveKinds.add(RelationKind.LINKED_PR);
                } else {
                    issues.report("Only '" + CanonicalField.LINKED_PR.getLabel() + "' can map to '"
                            + FieldMappingRule.LINKED_PULL_REQUESTS + "', ignoring " + rule);
                }
            } else if (rule.isPosition()) {
                mapPosition(issue, rule, payload);
            } else {
                mapField(issue, rule, payload);
            }
        }

        if (bodyMapped || !directiveKinds.isEmpty()) {
            EncodedRelations encoded = relationEncoder.encode(issue.key(), issue.relations(),
                    textKinds, directiveKinds, textSections);
            if (bodyMapped) {
                if (targetOrganization.equals(issue.key().owner())) {
                    payload.bodyBlock(encoded.checklistBlock());
                } else {
                    log.debug("mapping.body.unmanaged issue={} reason=other-organization", issue.key());
                }
            }
            if (targetOrganization.equals(issue.key().owner())) {
                encoded.prLinkDirectives().forEach(payload::directive);
            }
        }
        return payload.build();
    }

    private void mapPosition(MergedIssue issue, FieldMappingRule rule, TargetPayload.Builder payload) {
        if (rule.sourceField().isRelation()) {
            issues.report("Relation field '" + rule.sourceField().getLabel() + "' cannot map to '"
                    + FieldMappingRule.POSITION + "'");
            return;
        }
        Optional<Double> ordinal = issue.get(rule.sourceField()).asNumber();
        if (ordinal.isPresent()) {
            payload.position((int) Math.round(ordinal.get()));
        }
    }

    private void mapField(MergedIssue issue, FieldMappingRule rule, TargetPayload.Builder payload) {
        String destination = rule.destination();
        Optional<TargetField> target = schema.field(destination);
        if (target.isEmpty()) {
            issues.report("Unknown destination field '" + destination + "'");
            return;
        }
        CanonicalField field = rule.sourceField();
        if (field.isRelation()) {
            issues.report("Relation field '" + field.getLabel() + "' can only map to '"
                    + FieldMappingRule.TEXT + "' or '" + FieldMappingRule.LINKED_PULL_REQUESTS
                    + "', not '" + destination + "'");
            return;
        }
        FieldValue value = issue.get(field);
        if (value.isEmpty() || payload.hasField(destination)) {
            return;
        }

        TargetField targetField = target.get();
        if (targetField.hasOptions()) {
            MatchStrategy strategy = rule.effectiveStrategy();
            OptionSet sourceScale = strategy == MatchStrategy.SCALE
                    ? scaleProvider.scaleFor(field).orElse(null) : null;
            OptionMatch match = optionMatcher.match(value.text(), targetField.options(), strategy, sourceScale);
            if (match.status() == MatchStatus.NO_OPTIONS) {
                issues.report("No destination options configured for '" + destination + "'");
                return;
            }
            stats.record(destination, value.text(), match.chosen());
            metrics.recordTranslation(match.status());
            if (match.isMatched()) {
                payload.field(destination, match.chosen());
            } else {
                log.debug("mapping.translation.miss issue={} field={} value='{}'",
                        issue.key(), destination, value.text());
            }
        } else if (targetField.type() == TargetFieldType.NUMBER) {
            BigDecimal number = parseDecimal(value.text());
            if (number != null) {
                payload.field(destination, FieldValue.of(number).text());
            } else {
                log.debug("mapping.number.unparseable issue={} field={} value='{}'",
                        issue.key(), destination, value.text());
            }
        } else {
            payload.field(destination, value.text());
        }
    }

    private static BigDecimal parseDecimal(String text) {
        try {
            return new BigDecimal(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public ConfigurationIssues getIssues() {
        return issues;
    }

    public TranslationStats getStats() {
        return stats;
    }

    public static class Builder {
        private TargetSchema schema;
        private ScaleProvider scaleProvider = ScaleProvider.NONE;
        private OptionMatcher optionMatcher = new OptionMatcher();
        private RelationEncoder relationEncoder;
        private String targetOrganization;
        private ConfigurationIssues issues = new ConfigurationIssues();
        private TranslationStats stats = new TranslationStats();
        private SyncMetrics metrics = NoOpSyncMetrics.INSTANCE;

        public Builder schema(TargetSchema schema) {
            this.schema = schema;
            return this;
        }

        public Builder scaleProvider(ScaleProvider scaleProvider) {
            this.scaleProvider = scaleProvider;
            return this;
        }

        public Builder optionMatcher(OptionMatcher optionMatcher) {
            this.optionMatcher = optionMatcher;
            return this;
        }

        public Builder relationEncoder(RelationEncoder relationEncoder) {
            this.relationEncoder = relationEncoder;
            return this;
        }

        public Builder targetOrganization(String targetOrganization) {
            this.targetOrganization = targetOrganization;
            return this;
        }

        public Builder issues(ConfigurationIssues issues) {
            this.issues = issues;
            return this;
        }

        public Builder stats(TranslationStats stats) {
            this.stats = stats;
            return this;
        }

        public Builder metrics(SyncMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public FieldMapper build() {
            return new FieldMapper(this);
        }
    }
}
