package com.tracker.sync.adapter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An issue or pull request as a source reports it, before normalization.
 *
 * <p>Field names are the source's own. Relation-bearing fields (epic children, blockers,
 * issues a pull request connects to) hold a {@code List<String>} of references such as
 * {@code owner/repo#12}, {@code #12} or a GitHub URL.</p>
 */
public final class RawItem {

    private final String owner;
    private final String repository;
    private final int number;
    private final String externalId;
    private final String title;
    private final Map<String, Object> fields;
    private final boolean pullRequest;
    private final boolean archived;
    private final Instant updatedAt;

    private RawItem(Builder builder) {
        this.owner = Objects.requireNonNull(builder.owner, "owner is required");
        this.repository = Objects.requireNonNull(builder.repository, "repository is required");
        this.number = builder.number;
        this.externalId = builder.externalId;
        this.title = builder.title;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fields));
        this.pullRequest = builder.pullRequest;
        this.archived = builder.archived;
        this.updatedAt = builder.updatedAt;
    }

    public String getOwner() {
        return owner;
    }

    public String getRepository() {
        return repository;
    }

    public int getNumber() {
        return number;
    }

    public String getExternalId() {
        return externalId;
    }

    public String getTitle() {
        return title;
    }

    public Map<String, Object> getFields() {
        return fields;
    }

    public boolean isPullRequest() {
        return pullRequest;
    }

    public boolean isArchived() {
        return archived;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public String toString() {
        return owner + "/" + repository + "#" + number + (title != null ? " '" + title + "'" : "");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String owner;
        private String repository;
        private int number;
        private String externalId;
        private String title;
        private final Map<String, Object> fields = new LinkedHashMap<>();
        private boolean pullRequest;
        private boolean archived;
        private Instant updatedAt;

        public Builder owner(String owner) {
            this.owner = owner;
            return this;
        }

        public Builder repository(String repository) {
            this.repository = repository;
            return this;
        }

        public Builder number(int number) {
            this.number = number;
            return this;
        }

        public Builder externalId(String externalId) {
            this.externalId = externalId;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder field(String name, Object value) {
            this.fields.put(name, value);
            return this;
        }

        public Builder pullRequest(boolean pullRequest) {
            this.pullRequest = pullRequest;
            return this;
        }

        public Builder archived(boolean archived) {
            this.archived = archived;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public RawItem build() {
            return new RawItem(this);
        }
    }
}
