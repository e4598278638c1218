package com.tracker.sync.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Target-shaped view of a merged issue, produced by the field mapper.
 */
public final class TargetPayload {

    private final IssueKey key;
    private final Map<String, String> fields;
    private final String bodyBlock;
    private final Integer position;
    private final List<String> pullRequestDirectives;
    private final boolean pullRequest;

    private TargetPayload(Builder builder) {
        this.key = Objects.requireNonNull(builder.key, "key is required");
        this.fields = Map.copyOf(builder.fields);
        this.bodyBlock = builder.bodyBlock;
        this.position = builder.position;
        this.pullRequestDirectives = List.copyOf(builder.pullRequestDirectives);
        this.pullRequest = builder.pullRequest;
    }

    public IssueKey getKey() {
        return key;
    }

    /**
     * Destination field name to value. Only fields present here are managed.
     */
    public Map<String, String> getFields() {
        return fields;
    }

    /**
     * Regenerated checklist block, empty when there is nothing to render,
     * null when the body is not managed by any mapping.
     */
    public String getBodyBlock() {
        return bodyBlock;
    }

    public boolean managesBody() {
        return bodyBlock != null;
    }

    /**
     * Position ordinal from the sources, null when position is not managed.
     */
    public Integer getPosition() {
        return position;
    }

    public List<String> getPullRequestDirectives() {
        return pullRequestDirectives;
    }

    public boolean isPullRequest() {
        return pullRequest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TargetPayload that = (TargetPayload) o;
        return pullRequest == that.pullRequest
                && key.equals(that.key)
                && fields.equals(that.fields)
                && Objects.equals(bodyBlock, that.bodyBlock)
                && Objects.equals(position, that.position)
                && pullRequestDirectives.equals(that.pullRequestDirectives);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, fields, bodyBlock, position, pullRequestDirectives, pullRequest);
    }

    @Override
    public String toString() {
        return "TargetPayload{" +
                "key=" + key +
                ", fields=" + fields +
                ", body=" + (bodyBlock == null ? "unmanaged" : bodyBlock.length() + " chars") +
                ", position=" + position +
                ", directives=" + pullRequestDirectives.size() +
                '}';
    }

    public static Builder builder(IssueKey key) {
        return new Builder().key(key);
    }

    public static class Builder {
        private IssueKey key;
        private final Map<String, String> fields = new LinkedHashMap<>();
        private String bodyBlock;
        private Integer position;
        private final List<String> pullRequestDirectives = new ArrayList<>();
        private boolean pullRequest;

        public Builder key(IssueKey key) {
            this.key = key;
            return this;
        }

        public Builder field(String name, String value) {
            this.fields.put(name, value);
            return this;
        }

        /**
         * Sets a field only if no earlier rule already did.
         *
         * @return true if the value was taken
         */
        public boolean fieldIfAbsent(String name, String value) {
            return this.fields.putIfAbsent(name, value) == null;
        }

        public boolean hasField(String name) {
            return fields.containsKey(name);
        }

        public Builder bodyBlock(String bodyBlock) {
            this.bodyBlock = bodyBlock;
            return this;
        }

        public Builder position(Integer position) {
            this.position = position;
            return this;
        }

        public Builder directive(String directive) {
            if (!pullRequestDirectives.contains(directive)) {
                pullRequestDirectives.add(directive);
            }
            return this;
        }

        public Builder pullRequest(boolean pullRequest) {
            this.pullRequest = pullRequest;
            return this;
        }

        public TargetPayload build() {
            return new TargetPayload(this);
        }
    }
}
