package com.tracker.sync.reconcile;

import com.tracker.sync.core.model.Action;
import com.tracker.sync.merge.IdentityConflict;
import com.tracker.sync.mapping.TranslationStats;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * What one pass planned and did.
 */
public final class ReconciliationReport {

    private final String passId;
    private final boolean dryRun;
    private final List<String> sources;
    private final List<Action> plannedActions;
    private final ApplyResult applied;
    private final List<Notice> notices;
    private final List<String> configurationErrors;
    private final List<IdentityConflict> identityConflicts;
    private final Map<String, Map<TranslationStats.Translation, Long>> translations;
    private final Duration duration;

    private ReconciliationReport(Builder builder) {
        this.passId = Objects.requireNonNull(builder.passId, "passId is required");
        this.dryRun = builder.dryRun;
        this.sources = List.copyOf(builder.sources);
        this.plannedActions = List.copyOf(builder.plannedActions);
        this.applied = builder.applied != null ? builder.applied : ApplyResult.empty();
        this.notices = List.copyOf(builder.notices);
        this.configurationErrors = List.copyOf(builder.configurationErrors);
        this.identityConflicts = List.copyOf(builder.identityConflicts);
        this.translations = builder.translations != null
                ? Collections.unmodifiableMap(new TreeMap<>(builder.translations)) : Map.of();
        this.duration = builder.duration != null ? builder.duration : Duration.ZERO;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getPassId() {
        return passId;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public List<String> getSources() {
        return sources;
    }

    public List<Action> getPlannedActions() {
        return plannedActions;
    }

    public int getAdded() {
        return applied.created();
    }

    public int getUpdated() {
        return applied.updated();
    }

    public int getRemoved() {
        return applied.removed();
    }

    public int getTextChanges() {
        return applied.bodyChanges();
    }

    public int getMoved() {
        return applied.moved();
    }

    public int getPullRequestsLinked() {
        return applied.pullRequestsLinked();
    }

    public List<FailedAction> getFailedActions() {
        return applied.failures();
    }

    public List<Notice> getNotices() {
        return notices;
    }

    public List<String> getConfigurationErrors() {
        return configurationErrors;
    }

    public List<IdentityConflict> getIdentityConflicts() {
        return identityConflicts;
    }

    public Map<String, Map<TranslationStats.Translation, Long>> getTranslations() {
        return translations;
    }

    public Duration getDuration() {
        return duration;
    }

    public boolean hasFailures() {
        return applied.hasFailures();
    }

    /**
     * Human readable summary, closing with the translation table per field.
     */
    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Summary").append('\n');
        sb.append("=======").append('\n');
        if (dryRun) {
            sb.append("Dry run, ").append(plannedActions.size()).append(" planned actions:").append('\n');
            for (Action action : plannedActions) {
                sb.append("- ").append(action.describe()).append('\n');
            }
        }
        sb.append("Added: ").append(getAdded())
                .append(", Removed: ").append(getRemoved())
                .append(", Text Changes: ").append(getTextChanges())
                .append('\n');
        sb.append("Updated: ").append(getUpdated())
                .append(", Moved: ").append(getMoved())
                .append(", Linked pull requests: ").append(getPullRequestsLinked())
                .append('\n');
        appendSection(sb, "Not removed", notices);
        appendSection(sb, "Failed", applied.failures());
        appendSection(sb, "Configuration errors", configurationErrors);
        appendSection(sb, "Identity conflicts", identityConflicts);
        if (!translations.isEmpty()) {
            sb.append('\n');
            translations.forEach((field, values) -> {
                sb.append(field).append('\n');
                values.forEach((translation, count) ->
                        sb.append('\t').append(translation).append(": ").append(count).append('\n'));
            });
        }
        return sb.toString();
    }

    private static void appendSection(StringBuilder sb, String title, List<?> entries) {
        if (entries.isEmpty()) {
            return;
        }
        sb.append('\n').append(title).append('\n');
        for (Object entry : entries) {
            sb.append("- ").append(entry).append('\n');
        }
    }

    public static class Builder {
        private String passId;
        private boolean dryRun;
        private final List<String> sources = new ArrayList<>();
        private final List<Action> plannedActions = new ArrayList<>();
        private ApplyResult applied;
        private final List<Notice> notices = new ArrayList<>();
        private final List<String> configurationErrors = new ArrayList<>();
        private final List<IdentityConflict> identityConflicts = new ArrayList<>();
        private Map<String, Map<TranslationStats.Translation, Long>> translations;
        private Duration duration;

        public Builder passId(String passId) {
            this.passId = passId;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder sources(List<String> sources) {
            this.sources.addAll(sources);
            return this;
        }

        public Builder plannedActions(List<Action> actions) {
            this.plannedActions.addAll(actions);
            return this;
        }

        public Builder applied(ApplyResult applied) {
            this.applied = applied;
            return this;
        }

        public Builder notices(List<Notice> notices) {
            this.notices.addAll(notices);
            return this;
        }

        public Builder configurationErrors(List<String> errors) {
            this.configurationErrors.addAll(errors);
            return this;
        }

        public Builder identityConflicts(List<IdentityConflict> conflicts) {
            this.identityConflicts.addAll(conflicts);
            return this;
        }

        public Builder translations(Map<String, Map<TranslationStats.Translation, Long>> translations) {
            this.translations = translations;
            return this;
        }

        public Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        public ReconciliationReport build() {
            return new ReconciliationReport(this);
        }
    }
}
