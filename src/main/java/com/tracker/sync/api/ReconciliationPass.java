package com.tracker.sync.api;

import com.tracker.sync.adapter.RawItem;
import com.tracker.sync.adapter.SourceAdapter;
import com.tracker.sync.adapter.TargetAdapter;
import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.adapter.TransientIOException;
import com.tracker.sync.audit.AuditAction;
import com.tracker.sync.audit.AuditService;
import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.MergedIssue;
import com.tracker.sync.core.model.OptionSet;
import com.tracker.sync.core.model.SourceRecord;
import com.tracker.sync.core.model.TargetItem;
import com.tracker.sync.core.model.TargetPayload;
import com.tracker.sync.core.model.TargetSchema;
import com.tracker.sync.lock.KeyedLock;
import com.tracker.sync.logging.LogContext;
import com.tracker.sync.mapping.ConfigurationIssues;
import com.tracker.sync.mapping.FieldMapper;
import com.tracker.sync.mapping.ScaleProvider;
import com.tracker.sync.mapping.TranslationStats;
import com.tracker.sync.merge.ExclusionRule;
import com.tracker.sync.merge.IdentityConflict;
import com.tracker.sync.merge.MergeOutcome;
import com.tracker.sync.merge.WorkspaceMerger;
import com.tracker.sync.metrics.NoOpSyncMetrics;
import com.tracker.sync.metrics.SyncMetrics;
import com.tracker.sync.normalize.DefaultFieldAliases;
import com.tracker.sync.normalize.SourceNormalizer;
import com.tracker.sync.reconcile.ActionApplier;
import com.tracker.sync.reconcile.ApplyResult;
import com.tracker.sync.reconcile.Notice;
import com.tracker.sync.reconcile.NoticeType;
import com.tracker.sync.reconcile.ReconciliationPlan;
import com.tracker.sync.reconcile.ReconciliationReport;
import com.tracker.sync.reconcile.TargetReconciler;
import com.tracker.sync.retry.RetryingExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs one reconciliation pass: fetch every source workspace, merge by priority, translate
 * onto the target schema, plan the changes and (unless this is a dry run) apply them.
 *
 * <pre>
 * ReconciliationPass pass = ReconciliationPass.builder()
 *     .source(new ZenHubSourceAdapter(zenhub, github::isRepositoryArchived))
 *     .target(github)
 *     .options(options)
 *     .build();
 * ReconciliationReport report = pass.run();
 * System.out.println(report.summary());
 * </pre>
 *
 * <p>A source that cannot be read fails the whole pass, since planning without it would
 * remove its items from the target. Problems with single issues are reported and skipped.</p>
 */
public class ReconciliationPass {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationPass.class);

    private final SourceAdapter source;
    private final TargetAdapter target;
    private final SyncOptions options;
    private final SourceNormalizer normalizer;
    private final WorkspaceMerger merger;
    private final AuditService auditService;
    private final SyncMetrics metrics;
    private final RetryingExecutor retrying;
    private final String actor;

    private ReconciliationPass(Builder builder) {
        this.source = Objects.requireNonNull(builder.source, "source is required");
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.options = Objects.requireNonNull(builder.options, "options is required");
        this.normalizer = builder.normalizer != null
                ? builder.normalizer : DefaultFieldAliases.createDefaultNormalizer();
        this.merger = new WorkspaceMerger();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.metrics = builder.metrics;
        this.retrying = builder.retrying != null
                ? builder.retrying
                : new RetryingExecutor(options.getRetryPolicy(), metrics, RetryingExecutor.Sleeper.THREAD);
        this.actor = builder.actor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the pass.
     *
     * @throws ConfigurationException when the target project or a named workspace cannot be used at all
     */
    public ReconciliationReport run() {
        String passId = LogContext.generatePassId();
        long start = System.nanoTime();
        try (LogContext ctx = LogContext.forPass(passId)) {
            List<String> workspaces = resolveWorkspaces();
            log.info("pass.started passId={} project={}/{} workspaces={} dryRun={}",
                    passId, options.getOrganization(), options.getProjectNumber(), workspaces, options.isDryRun());

            List<Set<SourceRecord>> records = fetchAll(passId, workspaces);
            MergeOutcome merged = merger.merge(records, options.getExclusions());
            for (IdentityConflict conflict : merged.conflicts()) {
                auditService.record(AuditAction.IDENTITY_CONFLICT, conflict.key().toString(), actor,
                        Map.of("sourceId", conflict.sourceId(), "externalIds", conflict.externalIds()));
            }

            TargetSchema schema = retrying.execute("listFieldSchema", target::listFieldSchema);
            ConfigurationIssues issues = new ConfigurationIssues();
            TranslationStats stats = new TranslationStats();
            FieldMapper mapper = FieldMapper.builder()
                    .schema(schema)
                    .scaleProvider(scaleProvider())
                    .targetOrganization(options.getOrganization())
                    .issues(issues)
                    .stats(stats)
                    .metrics(metrics)
                    .build();

            List<TargetPayload> board = new ArrayList<>();
            List<TargetPayload> offBoard = new ArrayList<>();
            for (MergedIssue issue : merged.issues()) {
                TargetPayload payload = mapper.map(issue, options.getFieldMappings());
                if (options.isSkipLinkedPullRequests() && issue.isLinkedPullRequest()) {
                    offBoard.add(payload);
                } else {
                    board.add(payload);
                }
            }

            List<TargetItem> current = retrying.execute("listItems", target::listItems);
            TargetReconciler reconciler = TargetReconciler.builder()
                    .removeDisabled(options.isRemoveDisabled())
                    .statusField(options.getStatusField())
                    .applier(ActionApplier.builder()
                            .target(target)
                            .retryingExecutor(retrying)
                            .keyedLock(new KeyedLock())
                            .auditService(auditService)
                            .metrics(metrics)
                            .concurrency(options.getApplyConcurrency())
                            .actor(actor)
                            .passId(passId)
                            .build())
                    .build();
            ReconciliationPlan plan = reconciler.reconcile(board, offBoard, current, readBodies(offBoard));
            auditPlan(plan, issues);

            ApplyResult applied = options.isDryRun() ? ApplyResult.empty() : reconciler.apply(plan);

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordPassDuration(duration);
            ReconciliationReport report = ReconciliationReport.builder()
                    .passId(passId)
                    .dryRun(options.isDryRun())
                    .sources(workspaces)
                    .plannedActions(plan.actions())
                    .applied(applied)
                    .notices(plan.notices())
                    .configurationErrors(issues.getMessages())
                    .identityConflicts(merged.conflicts())
                    .translations(stats.snapshot())
                    .duration(duration)
                    .build();
            log.info("pass.completed passId={} planned={} added={} updated={} removed={} failed={} durationMs={}",
                    passId, plan.actions().size(), report.getAdded(), report.getUpdated(), report.getRemoved(),
                    report.getFailedActions().size(), duration.toMillis());
            return report;
        }
    }

    List<String> resolveWorkspaces() {
        List<String> candidates = options.getWorkspaces().isEmpty()
                ? retrying.execute("listSources", source::listSources)
                : options.getWorkspaces();
        List<String> workspaces = new ArrayList<>();
        for (String workspace : candidates) {
            if (isExcludedWorkspace(workspace)) {
                log.info("pass.workspace.skipped workspace='{}' reason=excluded", workspace);
            } else if (!workspaces.contains(workspace)) {
                workspaces.add(workspace);
            }
        }
        if (workspaces.isEmpty()) {
            throw new ConfigurationException("No workspaces left to read from");
        }
        return workspaces;
    }

    private boolean isExcludedWorkspace(String workspace) {
        for (ExclusionRule rule : options.getExclusions()) {
            if (rule.excludesValue(CanonicalField.WORKSPACE, workspace)) {
                return true;
            }
        }
        return false;
    }

    private List<Set<SourceRecord>> fetchAll(String passId, List<String> workspaces) {
        ExecutorService executor = Executors.newFixedThreadPool(
                Math.min(options.getFetchConcurrency(), workspaces.size()));
        try {
            List<CompletableFuture<Set<SourceRecord>>> futures = new ArrayList<>();
            for (String workspace : workspaces) {
                futures.add(CompletableFuture.supplyAsync(() -> fetch(passId, workspace), executor));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();

            List<Set<SourceRecord>> records = new ArrayList<>();
            for (CompletableFuture<Set<SourceRecord>> future : futures) {
                records.add(future.join());
            }
            return records;
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        } finally {
            executor.shutdown();
        }
    }

    private Set<SourceRecord> fetch(String passId, String workspace) {
        try (LogContext ctx = LogContext.forSource(passId, workspace)) {
            List<RawItem> items = retrying.execute("fetchWorkspace", () -> source.fetchWorkspace(workspace));
            metrics.recordSourceFetched(workspace, items.size());
            return normalizer.normalize(workspace, items);
        }
    }

    /**
     * Current bodies of the off-board issues whose body or pull request directives are managed.
     * An issue that cannot be read is left out and skipped for this pass.
     */
    private Map<IssueKey, String> readBodies(List<TargetPayload> offBoard) {
        Map<IssueKey, String> bodies = new HashMap<>();
        for (TargetPayload payload : offBoard) {
            IssueKey key = payload.getKey();
            if (!payload.managesBody() && payload.getPullRequestDirectives().isEmpty()) {
                continue;
            }
            try {
                Optional<String> body = retrying.execute("readBody " + key, () -> target.readBody(key));
                if (body.isPresent()) {
                    bodies.put(key, body.get());
                } else {
                    log.warn("pass.body.missing issue={}", key);
                }
            } catch (TrackerException | TransientIOException e) {
                log.warn("pass.body.unreadable issue={} error={}", key, e.getMessage());
            }
        }
        return bodies;
    }

    private ScaleProvider scaleProvider() {
        return field -> source.listOrderedScaleLabels(field).map(OptionSet::new);
    }

    private void auditPlan(ReconciliationPlan plan, ConfigurationIssues issues) {
        for (Notice notice : plan.notices()) {
            if (notice.type() == NoticeType.ORPHANED_NOT_REMOVED) {
                auditService.record(AuditAction.ITEM_ORPHANED, String.valueOf(notice.key()), actor,
                        Map.of("itemId", notice.itemId()));
            }
        }
        for (String message : issues.getMessages()) {
            auditService.record(AuditAction.CONFIGURATION_ERROR, null, actor, Map.of("message", message));
        }
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public SyncOptions getOptions() {
        return options;
    }

    public static class Builder {
        private SourceAdapter source;
        private TargetAdapter target;
        private SyncOptions options;
        private SourceNormalizer normalizer;
        private AuditService auditService;
        private SyncMetrics metrics = NoOpSyncMetrics.INSTANCE;
        private RetryingExecutor retrying;
        private String actor = "tracker-sync";

        public Builder source(SourceAdapter source) {
            this.source = source;
            return this;
        }

        public Builder target(TargetAdapter target) {
            this.target = target;
            return this;
        }

        public Builder options(SyncOptions options) {
            this.options = options;
            return this;
        }

        public Builder normalizer(SourceNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metrics(SyncMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Overrides the executor built from the options' retry policy.
         */
        public Builder retryingExecutor(RetryingExecutor retrying) {
            this.retrying = retrying;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        public ReconciliationPass build() {
            return new ReconciliationPass(this);
        }
    }
}
