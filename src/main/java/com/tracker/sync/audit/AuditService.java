package com.tracker.sync.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only trail of what a pass did to the target.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} issue={} actor={}", entry.action(), entry.issueKey(), entry.actor());
        return entry;
    }

    public AuditEntry record(AuditAction action, String issueKey, String actor, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .issueKey(issueKey)
                .actor(actor)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, String issueKey, String actor) {
        return record(action, issueKey, actor, null);
    }

    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForIssue(String issueKey) {
        return entries.stream()
                .filter(e -> issueKey.equals(e.issueKey()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}
