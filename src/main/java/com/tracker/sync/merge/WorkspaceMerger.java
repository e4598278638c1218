package com.tracker.sync.merge;

import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.core.model.FieldValue;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.MergedIssue;
import com.tracker.sync.core.model.Relation;
import com.tracker.sync.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Joins source records by issue key and resolves each field by source priority.
 *
 * <p>Sources are ranked by their position in the list handed to {@link #merge}: the first
 * source wins every field it has a value for. The merger never reorders sources itself.</p>
 */
public class WorkspaceMerger {
    private static final Logger log = LoggerFactory.getLogger(WorkspaceMerger.class);

    /**
     * Merges prioritized sources after applying exclusion rules.
     *
     * @param orderedSources records per source, highest priority first
     * @param exclusions     rules that drop whole issue-source records
     */
    public MergeOutcome merge(List<? extends Collection<SourceRecord>> orderedSources,
                              List<ExclusionRule> exclusions) {
        int excluded = 0;
        Map<IssueKey, List<SourceRecord>> byKey = new TreeMap<>();
        Set<IssueKey> conflicted = new TreeSet<>();
        List<IdentityConflict> conflicts = new ArrayList<>();

        for (int rank = 0; rank < orderedSources.size(); rank++) {
            Map<IssueKey, SourceRecord> seen = new LinkedHashMap<>();
            Map<IssueKey, Set<String>> identities = new LinkedHashMap<>();
            for (SourceRecord raw : orderedSources.get(rank)) {
                SourceRecord record = raw.getPriorityRank() == rank ? raw : raw.withPriorityRank(rank);
                if (isExcluded(record, exclusions)) {
                    excluded++;
                    continue;
                }
                if (record.getExternalId() != null) {
                    identities.computeIfAbsent(record.getKey(), k -> new LinkedHashSet<>())
                            .add(record.getExternalId());
                }
                seen.putIfAbsent(record.getKey(), record);
            }
            for (Map.Entry<IssueKey, Set<String>> e : identities.entrySet()) {
                if (e.getValue().size() > 1) {
                    String sourceId = seen.get(e.getKey()).getSourceId();
                    log.warn("merge.identity-conflict key={} sourceId={} externalIds={}",
                            e.getKey(), sourceId, e.getValue());
                    conflicts.add(new IdentityConflict(e.getKey(), sourceId, new ArrayList<>(e.getValue())));
                    conflicted.add(e.getKey());
                }
            }
            for (SourceRecord record : seen.values()) {
                byKey.computeIfAbsent(record.getKey(), k -> new ArrayList<>()).add(record);
            }
        }

        List<MergedIssue> merged = new ArrayList<>();
        for (Map.Entry<IssueKey, List<SourceRecord>> entry : byKey.entrySet()) {
            if (conflicted.contains(entry.getKey())) {
                continue;
            }
            merged.add(resolve(entry.getKey(), entry.getValue()));
        }

        log.info("merge.completed sources={} issues={} excludedRecords={} conflicts={}",
                orderedSources.size(), merged.size(), excluded, conflicts.size());
        return new MergeOutcome(merged, conflicts, excluded);
    }

    /**
     * Resolves one issue from its records, which are already in priority order.
     */
    MergedIssue resolve(IssueKey key, List<SourceRecord> records) {
        Map<CanonicalField, FieldValue> fields = new EnumMap<>(CanonicalField.class);
        Map<CanonicalField, String> provenance = new EnumMap<>(CanonicalField.class);
        Set<Relation> relations = new TreeSet<>();
        boolean pullRequest = false;

        for (SourceRecord record : records) {
            pullRequest |= record.isPullRequest();
            for (CanonicalField field : CanonicalField.values()) {
                if (provenance.containsKey(field)) {
                    continue;
                }
                if (field.isRelation()) {
                    Set<Relation> ofKind = record.relationsOf(field.getRelationKind());
                    if (!ofKind.isEmpty()) {
                        relations.addAll(ofKind);
                        provenance.put(field, record.getSourceId());
                    }
                } else {
                    FieldValue value = record.get(field);
                    if (!value.isEmpty()) {
                        fields.put(field, value);
                        provenance.put(field, record.getSourceId());
                    }
                }
            }
        }
        return new MergedIssue(key, fields, provenance, new TreeSet<>(relations), pullRequest);
    }

    private static boolean isExcluded(SourceRecord record, List<ExclusionRule> exclusions) {
        for (ExclusionRule rule : exclusions) {
            if (rule.excludes(record)) {
                log.debug("merge.excluded key={} sourceId={} rule={}",
                        record.getKey(), record.getSourceId(), rule);
                return true;
            }
        }
        return false;
    }
}
