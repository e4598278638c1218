package com.tracker.sync.normalize;

import com.tracker.sync.adapter.RawItem;
import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.core.model.FieldValue;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.Relation;
import com.tracker.sync.core.model.RelationKind;
import com.tracker.sync.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Converts one source's raw items into canonical {@link SourceRecord}s.
 *
 * <p>Raw field names are resolved through {@link FieldAliasRule}s in priority order
 * (lower number first). Unknown fields are dropped.</p>
 */
public class SourceNormalizer {
    private static final Logger log = LoggerFactory.getLogger(SourceNormalizer.class);

    private final List<FieldAliasRule> rules;

    public SourceNormalizer(List<FieldAliasRule> rules) {
        this.rules = new ArrayList<>(rules);
        this.rules.sort(Comparator.comparingInt(FieldAliasRule::getPriority));
    }

    public List<FieldAliasRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Canonical field for a raw field name of the given source.
     */
    public Optional<CanonicalField> resolveField(String sourceId, String rawFieldName) {
        for (FieldAliasRule rule : rules) {
            if (rule.appliesTo(sourceId) && rule.matches(rawFieldName)) {
                return Optional.of(rule.getField());
            }
        }
        return Optional.empty();
    }

    /**
     * Normalizes every raw item of one source. One record per item; archived repositories are skipped.
     */
    public Set<SourceRecord> normalize(String sourceId, Collection<RawItem> rawItems) {
        Set<SourceRecord> records = new LinkedHashSet<>();
        int skipped = 0;
        for (RawItem item : rawItems) {
            if (item.isArchived()) {
                log.info("normalize.skipped sourceId={} item={} reason=archived-repository", sourceId, item);
                skipped++;
                continue;
            }
            Optional<SourceRecord> record = normalizeItem(sourceId, item);
            if (record.isPresent()) {
                records.add(record.get());
            } else {
                skipped++;
            }
        }
        log.debug("normalize.completed sourceId={} records={} skipped={}", sourceId, records.size(), skipped);
        return records;
    }

    Optional<SourceRecord> normalizeItem(String sourceId, RawItem item) {
        IssueKey key;
        try {
            key = IssueKey.of(item.getOwner(), item.getRepository(), item.getNumber());
        } catch (IllegalArgumentException e) {
            log.warn("normalize.invalid-key sourceId={} item={} error={}", sourceId, item, e.getMessage());
            return Optional.empty();
        }

        SourceRecord.Builder builder = SourceRecord.builder()
                .key(key)
                .sourceId(sourceId)
                .externalId(item.getExternalId())
                .pullRequest(item.isPullRequest())
                .lastModified(item.getUpdatedAt());

        for (Map.Entry<String, Object> entry : item.getFields().entrySet()) {
            Optional<CanonicalField> field = resolveField(sourceId, entry.getKey());
            if (field.isEmpty()) {
                log.trace("normalize.field-dropped sourceId={} field={}", sourceId, entry.getKey());
                continue;
            }
            CanonicalField canonical = field.get();
            if (canonical == CanonicalField.WORKSPACE) {
                continue;
            }
            if (canonical.isRelation()) {
                for (IssueKey ref : references(entry.getValue(), key)) {
                    builder.relation(edge(canonical.getRelationKind(), key, ref));
                }
            } else {
                builder.field(canonical, scalar(canonical, entry.getValue()));
            }
        }
        builder.field(CanonicalField.WORKSPACE, FieldValue.of(sourceId));
        return Optional.of(builder.build());
    }

    private static Relation edge(RelationKind kind, IssueKey owner, IssueKey ref) {
        switch (kind) {
            case EPIC_OF:
                return Relation.epicOf(owner, ref);
            case BLOCKS:
                return Relation.blocks(ref, owner);
            case LINKED_PR:
            default:
                return Relation.fixes(owner, ref);
        }
    }

    private static List<IssueKey> references(Object value, IssueKey base) {
        List<IssueKey> keys = new ArrayList<>();
        if (value == null) {
            return keys;
        }
        Collection<?> refs = value instanceof Collection<?> c ? c : List.of(value);
        for (Object ref : refs) {
            Optional<IssueKey> parsed = IssueKey.parse(String.valueOf(ref), base);
            if (parsed.isPresent()) {
                if (!parsed.get().equals(base)) {
                    keys.add(parsed.get());
                }
            } else {
                log.debug("normalize.unresolved-reference base={} reference='{}'", base, ref);
            }
        }
        return keys;
    }

    /**
     * Lists keep their last entry (the latest sprint); numeric estimates lose trailing zeros.
     */
    private static FieldValue scalar(CanonicalField field, Object value) {
        Object v = value;
        if (v instanceof List<?> list) {
            v = list.isEmpty() ? null : list.get(list.size() - 1);
        }
        if (v instanceof String s && (field == CanonicalField.ESTIMATE || field == CanonicalField.POSITION)) {
            try {
                return FieldValue.of(new BigDecimal(s.trim()));
            } catch (NumberFormatException e) {
                return FieldValue.of(s);
            }
        }
        return FieldValue.of(v);
    }
}
