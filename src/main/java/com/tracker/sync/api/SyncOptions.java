package com.tracker.sync.api;

import com.tracker.sync.mapping.FieldMappingRule;
import com.tracker.sync.mapping.FieldMappingRules;
import com.tracker.sync.merge.ExclusionRule;
import com.tracker.sync.reconcile.TargetReconciler;
import com.tracker.sync.retry.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Options for one reconciliation pass.
 * Names the target project, the source workspaces in priority order and how fields are carried over.
 */
public class SyncOptions {

    private static final Pattern PROJECT_URL = Pattern.compile(
            "^https?://[^/]+/orgs/([^/]+)/projects/(\\d+)(?:/.*)?$");

    private static final int DEFAULT_CONCURRENCY = 4;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(180);

    private final String projectUrl;
    private final String organization;
    private final int projectNumber;
    private final List<String> workspaces;
    private final List<FieldMappingRule> fieldMappings;
    private final List<ExclusionRule> exclusions;
    private final boolean removeDisabled;
    private final boolean skipLinkedPullRequests;
    private final boolean dryRun;
    private final String statusField;
    private final int fetchConcurrency;
    private final int applyConcurrency;
    private final RetryPolicy retryPolicy;
    private final Duration timeout;

    private SyncOptions(Builder builder, String organization, int projectNumber) {
        this.projectUrl = builder.projectUrl;
        this.organization = organization;
        this.projectNumber = projectNumber;
        this.workspaces = List.copyOf(builder.workspaces);
        this.fieldMappings = FieldMappingRules.overlay(FieldMappingRules.defaults(), builder.fieldMappings);
        this.exclusions = List.copyOf(builder.exclusions);
        this.removeDisabled = builder.removeDisabled;
        this.skipLinkedPullRequests = builder.skipLinkedPullRequests;
        this.dryRun = builder.dryRun;
        this.statusField = builder.statusField;
        this.fetchConcurrency = builder.fetchConcurrency;
        this.applyConcurrency = builder.applyConcurrency;
        this.retryPolicy = builder.retryPolicy;
        this.timeout = builder.timeout;
    }

    public String getProjectUrl() {
        return projectUrl;
    }

    /**
     * Login of the organization owning the target project, lower case.
     */
    public String getOrganization() {
        return organization;
    }

    public int getProjectNumber() {
        return projectNumber;
    }

    /**
     * Workspaces in priority order. Empty means every visible workspace.
     */
    public List<String> getWorkspaces() {
        return workspaces;
    }

    /**
     * Effective mapping rules: defaults with user rules laid over them.
     */
    public List<FieldMappingRule> getFieldMappings() {
        return fieldMappings;
    }

    public List<ExclusionRule> getExclusions() {
        return exclusions;
    }

    public boolean isRemoveDisabled() {
        return removeDisabled;
    }

    public boolean isSkipLinkedPullRequests() {
        return skipLinkedPullRequests;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public String getStatusField() {
        return statusField;
    }

    public int getFetchConcurrency() {
        return fetchConcurrency;
    }

    public int getApplyConcurrency() {
        return applyConcurrency;
    }

    public RetryPolicy getRetryPolicy() {
        return retryPolicy;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String projectUrl;
        private final List<String> workspaces = new ArrayList<>();
        private final List<FieldMappingRule> fieldMappings = new ArrayList<>();
        private final List<ExclusionRule> exclusions = new ArrayList<>();
        private boolean removeDisabled = false;
        private boolean skipLinkedPullRequests = true;
        private boolean dryRun = false;
        private String statusField = TargetReconciler.DEFAULT_STATUS_FIELD;
        private int fetchConcurrency = DEFAULT_CONCURRENCY;
        private int applyConcurrency = DEFAULT_CONCURRENCY;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private Duration timeout = DEFAULT_TIMEOUT;

        public Builder projectUrl(String projectUrl) {
            this.projectUrl = projectUrl;
            return this;
        }

        public Builder workspace(String workspace) {
            if (workspace == null || workspace.isBlank()) {
                throw new IllegalArgumentException("workspace name must not be blank");
            }
            this.workspaces.add(workspace);
            return this;
        }

        public Builder workspaces(List<String> workspaces) {
            workspaces.forEach(this::workspace);
            return this;
        }

        /**
         * Adds a mapping given as {@code SRC:DST[:CNV]}.
         */
        public Builder fieldMapping(String spec) {
            this.fieldMappings.add(FieldMappingRule.parse(spec));
            return this;
        }

        public Builder fieldMappings(List<String> specs) {
            specs.forEach(this::fieldMapping);
            return this;
        }

        /**
         * Adds an exclusion given as {@code FIELD:PATTERN}.
         */
        public Builder exclusion(String spec) {
            this.exclusions.add(ExclusionRule.parse(spec));
            return this;
        }

        public Builder exclusions(List<String> specs) {
            specs.forEach(this::exclusion);
            return this;
        }

        public Builder removeDisabled(boolean removeDisabled) {
            this.removeDisabled = removeDisabled;
            return this;
        }

        public Builder skipLinkedPullRequests(boolean skipLinkedPullRequests) {
            this.skipLinkedPullRequests = skipLinkedPullRequests;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder statusField(String statusField) {
            if (statusField == null || statusField.isBlank()) {
                throw new IllegalArgumentException("statusField must not be blank");
            }
            this.statusField = statusField;
            return this;
        }

        public Builder fetchConcurrency(int fetchConcurrency) {
            if (fetchConcurrency <= 0) {
                throw new IllegalArgumentException("fetchConcurrency must be positive");
            }
            this.fetchConcurrency = fetchConcurrency;
            return this;
        }

        public Builder applyConcurrency(int applyConcurrency) {
            if (applyConcurrency <= 0) {
                throw new IllegalArgumentException("applyConcurrency must be positive");
            }
            this.applyConcurrency = applyConcurrency;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            if (retryPolicy == null) {
                throw new IllegalArgumentException("retryPolicy is required");
            }
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder timeout(Duration timeout) {
            if (timeout == null || timeout.isZero() || timeout.isNegative()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            this.timeout = timeout;
            return this;
        }

        public SyncOptions build() {
            if (projectUrl == null || projectUrl.isBlank()) {
                throw new IllegalArgumentException("projectUrl is required");
            }
            Matcher m = PROJECT_URL.matcher(projectUrl.trim());
            if (!m.matches()) {
                throw new IllegalArgumentException(
                        "projectUrl must look like https://github.com/orgs/ORG/projects/N, got '" + projectUrl + "'");
            }
            return new SyncOptions(this, m.group(1).toLowerCase(Locale.ROOT), Integer.parseInt(m.group(2)));
        }
    }
}
