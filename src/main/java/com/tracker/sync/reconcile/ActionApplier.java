package com.tracker.sync.reconcile;

import com.tracker.sync.adapter.TargetAdapter;
import com.tracker.sync.audit.AuditAction;
import com.tracker.sync.audit.AuditService;
import com.tracker.sync.core.model.Action;
import com.tracker.sync.core.model.ActionType;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.TargetPayload;
import com.tracker.sync.lock.KeyedLock;
import com.tracker.sync.logging.LogContext;
import com.tracker.sync.metrics.NoOpSyncMetrics;
import com.tracker.sync.metrics.SyncMetrics;
import com.tracker.sync.relation.BodyBlocks;
import com.tracker.sync.retry.RetryPolicy;
import com.tracker.sync.retry.RetryingExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies a {@link ReconciliationPlan} to the target in four phases:
 * <ol>
 *   <li>creates, field updates and body rewrites, concurrently across issues and serialized per issue</li>
 *   <li>position moves, one at a time in column order</li>
 *   <li>pull request link directives</li>
 *   <li>removals</li>
 * </ol>
 * A failed action is recorded and the remaining actions still run.
 */
public class ActionApplier {
    private static final Logger log = LoggerFactory.getLogger(ActionApplier.class);

    private final TargetAdapter target;
    private final RetryingExecutor retrying;
    private final KeyedLock keyedLock;
    private final AuditService auditService;
    private final SyncMetrics metrics;
    private final int concurrency;
    private final String actor;
    private final String passId;

    private ActionApplier(Builder builder) {
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.metrics = builder.metrics;
        this.retrying = builder.retrying != null
                ? builder.retrying
                : new RetryingExecutor(builder.retryPolicy, metrics, RetryingExecutor.Sleeper.THREAD);
        this.keyedLock = builder.keyedLock;
        this.auditService = builder.auditService;
        this.concurrency = builder.concurrency;
        this.actor = builder.actor;
        this.passId = builder.passId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ApplyResult apply(ReconciliationPlan plan) {
        Progress progress = new Progress();
        progress.itemIds.putAll(plan.itemIds());
        Map<IssueKey, Action> byKey = new HashMap<>();
        List<Action> writes = new ArrayList<>();
        List<Action> removes = new ArrayList<>();
        for (Action action : plan.actions()) {
            if (action.type() == ActionType.REMOVE) {
                removes.add(action);
            } else {
                writes.add(action);
                byKey.put(action.key(), action);
                if (action.itemId() != null) {
                    progress.itemIds.put(action.key(), action.itemId());
                }
            }
        }

        applyWrites(writes, progress);
        applyMoves(plan, byKey, progress);
        applyDirectives(plan, progress);
        applyRemoves(removes, progress);

        ApplyResult result = new ApplyResult(progress.created.get(), progress.updated.get(), progress.removed.get(),
                progress.bodyChanges.get(), progress.moved.get(), progress.linked.get(),
                new ArrayList<>(progress.failures));
        log.info("apply.completed created={} updated={} removed={} bodies={} moved={} linked={} failed={}",
                result.created(), result.updated(), result.removed(), result.bodyChanges(), result.moved(),
                result.pullRequestsLinked(), result.failures().size());
        return result;
    }

    private void applyWrites(List<Action> writes, Progress progress) {
        if (writes.isEmpty()) {
            return;
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(concurrency, writes.size()));
        try {
            CompletableFuture<?>[] futures = writes.stream()
                    .map(action -> CompletableFuture.runAsync(() -> applyLocked(action, progress), executor))
                    .toArray(CompletableFuture[]::new);
            CompletableFuture.allOf(futures).join();
        } finally {
            executor.shutdown();
        }
    }

    /**
     * Runs one write under its key lock. Anything escaping the write is recorded against the
     * action so the other writes and the later phases still run.
     */
    private void applyLocked(Action action, Progress progress) {
        try {
            keyedLock.withLock(action.key().toString(), () -> {
                applyWrite(action, progress);
                return null;
            });
        } catch (RuntimeException e) {
            fail(action.type(), action.key(), "apply", e.getMessage(), progress);
        }
    }

    private void applyWrite(Action action, Progress progress) {
        try (LogContext ctx = LogContext.forIssue(passId, action.key().toString(), "apply")) {
            switch (action.type()) {
                case CREATE -> create(action, progress);
                case UPDATE -> update(action, progress);
                case EDIT_BODY -> {
                    if (step(action.type(), action.key(), "updateBody",
                            () -> target.updateBody(action.key(), action.body()), progress)) {
                        progress.bodyChanges.incrementAndGet();
                        metrics.incrementActionApplied(ActionType.EDIT_BODY);
                    }
                }
                default -> throw new IllegalArgumentException("Not a write action: " + action.type());
            }
        }
    }

    private void create(Action action, Progress progress) {
        String[] itemId = new String[1];
        if (!step(action.type(), action.key(), "createItem",
                () -> itemId[0] = target.createItem(action.payload()), progress)) {
            return;
        }
        progress.itemIds.put(action.key(), itemId[0]);
        progress.created.incrementAndGet();
        metrics.incrementActionApplied(ActionType.CREATE);
        audit(AuditAction.ITEM_CREATED, action.key(), Map.of(
                "itemId", String.valueOf(itemId[0]),
                "fields", action.diffs().size()));
        log.info("action.created issue={} itemId={}", action.key(), itemId[0]);

        if (!action.diffs().isEmpty()) {
            step(action.type(), action.key(), "updateFields",
                    () -> target.updateFields(itemId[0], action.key(), action.diffs()), progress);
        }
        if (action.payload().managesBody()) {
            step(action.type(), action.key(), "updateBody", () -> rewriteBody(action.payload(), progress), progress);
        }
    }

    private void update(Action action, Progress progress) {
        boolean changed = false;
        if (!action.diffs().isEmpty()) {
            changed |= step(action.type(), action.key(), "updateFields",
                    () -> target.updateFields(action.itemId(), action.key(), action.diffs()), progress);
        }
        if (action.changesBody()) {
            boolean written = step(action.type(), action.key(), "updateBody",
                    () -> target.updateBody(action.key(), action.body()), progress);
            if (written) {
                progress.bodyChanges.incrementAndGet();
            }
            changed |= written;
        }
        if (changed) {
            progress.updated.incrementAndGet();
            metrics.incrementActionApplied(ActionType.UPDATE);
            audit(AuditAction.ITEM_UPDATED, action.key(), Map.of(
                    "fields", action.diffs().toString(),
                    "body", action.changesBody()));
            log.info("action.updated issue={} fields={} body={}", action.key(), action.diffs().size(),
                    action.changesBody());
        }
    }

    /**
     * Reads the current body and writes the regenerated one when it differs.
     */
    private void rewriteBody(TargetPayload payload, Progress progress) {
        String current = target.readBody(payload.getKey()).orElse("");
        String updated = BodyBlocks.replace(current, payload.getBodyBlock());
        if (!updated.equals(current)) {
            target.updateBody(payload.getKey(), updated);
            progress.bodyChanges.incrementAndGet();
            log.debug("action.body.updated issue={}", payload.getKey());
        }
    }

    private void applyMoves(ReconciliationPlan plan, Map<IssueKey, Action> byKey, Progress progress) {
        for (IssueKey key : plan.moveOrder()) {
            Action action = byKey.get(key);
            String itemId = progress.itemIds.get(key);
            if (action == null || itemId == null) {
                log.debug("action.move.skipped issue={} reason=no-item", key);
                continue;
            }
            IssueKey after = action.position().after();
            String afterId = after != null ? progress.itemIds.get(after) : null;
            if (after != null && afterId == null) {
                fail(action.type(), key, "moveItem", "predecessor " + after + " is not on the board", progress);
                continue;
            }
            try (LogContext ctx = LogContext.forIssue(passId, key.toString(), "move")) {
                if (step(action.type(), key, "moveItem", () -> target.moveItem(itemId, afterId), progress)) {
                    progress.moved.incrementAndGet();
                    log.debug("action.moved issue={} {}", key, action.position());
                }
            }
        }
    }

    private void applyDirectives(ReconciliationPlan plan, Progress progress) {
        for (Map.Entry<IssueKey, List<String>> entry : plan.directives().entrySet()) {
            IssueKey pullRequest = entry.getKey();
            try (LogContext ctx = LogContext.forIssue(passId, pullRequest.toString(), "link")) {
                boolean[] changed = new boolean[1];
                boolean ok = step(ActionType.UPDATE, pullRequest, "updatePullRequestBody",
                        () -> changed[0] = target.updatePullRequestBody(pullRequest, entry.getValue()), progress);
                if (ok && changed[0]) {
                    progress.linked.incrementAndGet();
                    audit(AuditAction.PR_LINKED, pullRequest, Map.of("directives", String.join(", ", entry.getValue())));
                    log.info("action.linked pullRequest={} directives={}", pullRequest, entry.getValue());
                }
            }
        }
    }

    private void applyRemoves(List<Action> removes, Progress progress) {
        for (Action action : removes) {
            try (LogContext ctx = LogContext.forIssue(passId, String.valueOf(action.key()), "remove")) {
                if (step(action.type(), action.key(), "removeItem",
                        () -> target.removeItem(action.itemId(), action.key()), progress)) {
                    progress.removed.incrementAndGet();
                    metrics.incrementActionApplied(ActionType.REMOVE);
                    audit(AuditAction.ITEM_REMOVED, action.key(), Map.of("itemId", action.itemId()));
                    log.info("action.removed issue={} itemId={}", action.key(), action.itemId());
                }
            }
        }
    }

    /**
     * Runs one target call with retries.
     *
     * @return false when the call failed and was recorded
     */
    private boolean step(ActionType type, IssueKey key, String operation, Runnable call, Progress progress) {
        try {
            retrying.run(operation + " " + key, call);
            return true;
        } catch (RuntimeException e) {
            fail(type, key, operation, e.getMessage(), progress);
            return false;
        }
    }

    private void fail(ActionType type, IssueKey key, String operation, String message, Progress progress) {
        progress.failures.add(new FailedAction(type, key, operation, message));
        metrics.incrementActionFailed(type);
        audit(AuditAction.ACTION_FAILED, key, Map.of(
                "operation", operation,
                "message", String.valueOf(message)));
        log.error("action.failed type={} issue={} operation={} error={}", type, key, operation, message);
    }

    private void audit(AuditAction auditAction, IssueKey key, Map<String, Object> details) {
        if (auditService != null) {
            auditService.record(auditAction, key != null ? key.toString() : null, actor, details);
        }
    }

    /**
     * Mutable counters shared by the phases of one apply call.
     */
    private static final class Progress {
        final Map<IssueKey, String> itemIds = new ConcurrentHashMap<>();
        final Queue<FailedAction> failures = new ConcurrentLinkedQueue<>();
        final AtomicInteger created = new AtomicInteger();
        final AtomicInteger updated = new AtomicInteger();
        final AtomicInteger removed = new AtomicInteger();
        final AtomicInteger bodyChanges = new AtomicInteger();
        final AtomicInteger moved = new AtomicInteger();
        final AtomicInteger linked = new AtomicInteger();
    }

    public static class Builder {
        private TargetAdapter target;
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private RetryingExecutor retrying;
        private KeyedLock keyedLock = new KeyedLock();
        private AuditService auditService;
        private SyncMetrics metrics = NoOpSyncMetrics.INSTANCE;
        private int concurrency = 4;
        private String actor = "tracker-sync";
        private String passId;

        public Builder target(TargetAdapter target) {
            this.target = target;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder retryingExecutor(RetryingExecutor retrying) {
            this.retrying = retrying;
            return this;
        }

        public Builder keyedLock(KeyedLock keyedLock) {
            this.keyedLock = keyedLock;
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

        public Builder concurrency(int concurrency) {
            if (concurrency < 1) {
                throw new IllegalArgumentException("concurrency must be >= 1");
            }
            this.concurrency = concurrency;
            return this;
        }

        public Builder actor(String actor) {
            this.actor = actor;
            return this;
        }

        /**
         * Pass id put on the logging context of every worker thread.
         */
        public Builder passId(String passId) {
            this.passId = passId;
            return this;
        }

        public ActionApplier build() {
            return new ActionApplier(this);
        }
    }
}
