package com.tracker.sync.core.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * One source's normalized view of an issue.
 *
 * Fields use the canonical vocabulary; relations are the edges this record owns
 * (see {@link Relation#subject()}).
 */
public final class SourceRecord {

    private final IssueKey key;
    private final String sourceId;
    private final int priorityRank;
    private final Map<CanonicalField, FieldValue> fields;
    private final Set<Relation> relations;
    private final Instant lastModified;
    private final String externalId;
    private final boolean pullRequest;

    private SourceRecord(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key is required");
        this.sourceId = Objects.requireNonNull(builder.sourceId, "sourceId is required");
        this.priorityRank = builder.priorityRank;
        EnumMap<CanonicalField, FieldValue> copy = new EnumMap<>(CanonicalField.class);
        builder.fields.forEach((f, v) -> {
            if (v != null && !v.isEmpty()) {
                copy.put(f, v);
            }
        });
        this.fields = Map.copyOf(copy);
        this.relations = Set.copyOf(builder.relations);
        this.lastModified = builder.lastModified;
        this.externalId = builder.externalId;
        this.pullRequest = builder.pullRequest;
    }

    public IssueKey getKey() {
        return key;
    }

    public String getSourceId() {
        return sourceId;
    }

    public int getPriorityRank() {
        return priorityRank;
    }

    public Map<CanonicalField, FieldValue> getFields() {
        return fields;
    }

    public FieldValue get(CanonicalField field) {
        return fields.getOrDefault(field, FieldValue.empty());
    }

    public Set<Relation> getRelations() {
        return relations;
    }

    /**
     * Relations of one kind owned by this record, in stable order.
     */
    public Set<Relation> relationsOf(RelationKind kind) {
        Set<Relation> result = new TreeSet<>();
        for (Relation r : relations) {
            if (r.kind() == kind) {
                result.add(r);
            }
        }
        return result;
    }

    public Instant getLastModified() {
        return lastModified;
    }

    public String getExternalId() {
        return externalId;
    }

    public boolean isPullRequest() {
        return pullRequest;
    }

    /**
     * Copy of this record with a different priority rank.
     */
    public SourceRecord withPriorityRank(int rank) {
        return toBuilder().priorityRank(rank).build();
    }

    public Builder toBuilder() {
        Builder b = new Builder()
                .key(key)
                .sourceId(sourceId)
                .priorityRank(priorityRank)
                .lastModified(lastModified)
                .externalId(externalId)
                .pullRequest(pullRequest);
        b.fields.putAll(fields);
        b.relations.addAll(relations);
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SourceRecord that = (SourceRecord) o;
        return key.equals(that.key) && sourceId.equals(that.sourceId)
                && Objects.equals(externalId, that.externalId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, sourceId, externalId);
    }

    @Override
    public String toString() {
        return "SourceRecord{" +
                "key=" + key +
                ", sourceId='" + sourceId + '\'' +
                ", rank=" + priorityRank +
                ", fields=" + fields.keySet() +
                ", relations=" + relations.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private IssueKey key;
        private String sourceId;
        private int priorityRank;
        private final Map<CanonicalField, FieldValue> fields = new EnumMap<>(CanonicalField.class);
        private final Set<Relation> relations = new TreeSet<>();
        private Instant lastModified;
        private String externalId;
        private boolean pullRequest;

        public Builder key(IssueKey key) {
            this.key = key;
            return this;
        }

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder priorityRank(int priorityRank) {
            this.priorityRank = priorityRank;
            return this;
        }

        public Builder field(CanonicalField field, FieldValue value) {
            this.fields.put(field, value);
            return this;
        }

        public Builder field(CanonicalField field, Object raw) {
            return field(field, FieldValue.of(raw));
        }

        public Builder relation(Relation relation) {
            this.relations.add(relation);
            return this;
        }

        public Builder lastModified(Instant lastModified) {
            this.lastModified = lastModified;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder pullRequest(boolean pullRequest) {
            this.pullRequest = pullRequest;
            return this;
        }

        public SourceRecord build() {
            return new SourceRecord(this);
        }
    }
}
