package com.tracker.sync.adapter.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tracker.sync.adapter.TargetAdapter;
import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.adapter.graphql.GraphQlClient;
import com.tracker.sync.api.ConfigurationException;
import com.tracker.sync.core.model.FieldDiff;
import com.tracker.sync.core.model.FieldValue;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.OptionSet;
import com.tracker.sync.core.model.TargetField;
import com.tracker.sync.core.model.TargetFieldType;
import com.tracker.sync.core.model.TargetItem;
import com.tracker.sync.core.model.TargetPayload;
import com.tracker.sync.core.model.TargetSchema;
import com.tracker.sync.metrics.NoOpSyncMetrics;
import com.tracker.sync.metrics.SyncMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A GitHub Projects (V2) board owned by an organization, accessed through the GitHub GraphQL API.
 *
 * <p>Issue and repository lookups are cached with Caffeine for the life of the adapter; a body
 * written through this adapter refreshes its cache entry.</p>
 */
public class GitHubProjectTargetAdapter implements TargetAdapter {
    private static final Logger log = LoggerFactory.getLogger(GitHubProjectTargetAdapter.class);

    public static final String ENDPOINT = "https://api.github.com/graphql";

    private static final String PROJECT_QUERY = """
            query ($login: String!, $number: Int!) {
              organization(login: $login) {
                projectV2(number: $number) { id title }
              }
            }
            """;

    private static final String FIELDS_QUERY = """
            query ($project: ID!) {
              node(id: $project) {
                ... on ProjectV2 {
                  fields(first: 50) {
                    nodes {
                      ... on ProjectV2Field { id name dataType }
                      ... on ProjectV2SingleSelectField { id name dataType options { id name } }
                      ... on ProjectV2IterationField {
                        id name dataType
                        configuration { iterations { id title } completedIterations { id title } }
                      }
                    }
                  }
                }
              }
            }
            """;

    private static final String ITEMS_QUERY = """
            query ($login: String!, $number: Int!, $cursor: String) {
              organization(login: $login) {
                projectV2(number: $number) {
                  items(first: 100, after: $cursor, orderBy: {field: POSITION, direction: ASC}) {
                    pageInfo { hasNextPage endCursor }
                    nodes {
                      id
                      type
                      content {
                        ... on Issue { id number body repository { name isArchived owner { login } } }
                        ... on PullRequest { id number body repository { name isArchived owner { login } } }
                      }
                      fieldValues(first: 50) {
                        nodes {
                          ... on ProjectV2ItemFieldTextValue { text field { ... on ProjectV2FieldCommon { name } } }
                          ... on ProjectV2ItemFieldNumberValue { number field { ... on ProjectV2FieldCommon { name } } }
                          ... on ProjectV2ItemFieldDateValue { date field { ... on ProjectV2FieldCommon { name } } }
                          ... on ProjectV2ItemFieldSingleSelectValue { name field { ... on ProjectV2FieldCommon { name } } }
                          ... on ProjectV2ItemFieldIterationValue { title field { ... on ProjectV2FieldCommon { name } } }
                        }
                      }
                    }
                  }
                }
              }
            }
            """;

    private static final String ISSUE_QUERY = """
            query ($owner: String!, $repo: String!, $number: Int!) {
              repository(owner: $owner, name: $repo) {
                isArchived
                issueOrPullRequest(number: $number) {
                  __typename
                  ... on Issue { id body }
                  ... on PullRequest { id body }
                }
              }
            }
            """;

    private static final String REPOSITORY_QUERY = """
            query ($owner: String!, $repo: String!) {
              repository(owner: $owner, name: $repo) { isArchived }
            }
            """;

    private static final String ADD_ITEM = """
            mutation ($project: ID!, $content: ID!) {
              addProjectV2ItemById(input: {projectId: $project, contentId: $content}) { item { id } }
            }
            """;

    private static final String SET_FIELD = """
            mutation ($project: ID!, $item: ID!, $field: ID!, $value: ProjectV2FieldValue!) {
              updateProjectV2ItemFieldValue(
                input: {projectId: $project, itemId: $item, fieldId: $field, value: $value}
              ) { projectV2Item { id } }
            }
            """;

    private static final String CLEAR_FIELD = """
            mutation ($project: ID!, $item: ID!, $field: ID!) {
              clearProjectV2ItemFieldValue(input: {projectId: $project, itemId: $item, fieldId: $field}) {
                projectV2Item { id }
              }
            }
            """;

    private static final String SET_ISSUE_BODY = """
            mutation ($id: ID!, $body: String!) {
              updateIssue(input: {id: $id, body: $body}) { issue { id } }
            }
            """;

    private static final String SET_PULL_REQUEST_BODY = """
            mutation ($id: ID!, $body: String!) {
              updatePullRequest(input: {pullRequestId: $id, body: $body}) { pullRequest { id } }
            }
            """;

    private static final String MOVE_ITEM = """
            mutation ($project: ID!, $item: ID!, $after: ID) {
              updateProjectV2ItemPosition(input: {projectId: $project, itemId: $item, afterId: $after}) {
                clientMutationId
              }
            }
            """;

    private static final String DELETE_ITEM = """
            mutation ($project: ID!, $item: ID!) {
              deleteProjectV2Item(input: {projectId: $project, itemId: $item}) { deletedItemId }
            }
            """;

    private final GraphQlClient client;
    private final String organization;
    private final int projectNumber;
    private final SyncMetrics metrics;
    private final Cache<IssueKey, IssueNode> issues;
    private final Cache<String, Boolean> archivedRepositories;

    private volatile String projectId;
    private volatile Schema schema;

    private GitHubProjectTargetAdapter(Builder builder) {
        this.client = Objects.requireNonNull(builder.client, "client is required");
        this.organization = Objects.requireNonNull(builder.organization, "organization is required");
        this.projectNumber = builder.projectNumber;
        this.metrics = builder.metrics;
        CacheConfig config = builder.cacheConfig;
        this.issues = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .build();
        this.archivedRepositories = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public TargetSchema listFieldSchema() {
        return schema().asTargetSchema();
    }

    @Override
    public List<TargetItem> listItems() {
        List<TargetItem> items = new ArrayList<>();
        String cursor = null;
        do {
            Map<String, Object> variables = new HashMap<>();
            variables.put("login", organization);
            variables.put("number", projectNumber);
            variables.put("cursor", cursor);
            JsonNode page = client.execute(ITEMS_QUERY, variables)
                    .path("organization").path("projectV2").path("items");
            for (JsonNode node : page.path("nodes")) {
                items.add(toTargetItem(node, items.size()));
            }
            JsonNode pageInfo = page.path("pageInfo");
            cursor = pageInfo.path("hasNextPage").asBoolean(false) ? pageInfo.path("endCursor").asText(null) : null;
        } while (cursor != null);
        log.info("github.items project={}/{} count={}", organization, projectNumber, items.size());
        return items;
    }

    @Override
    public String createItem(TargetPayload payload) {
        IssueNode issue = issue(payload.getKey())
                .orElseThrow(() -> new TrackerException("No issue " + payload.getKey() + " on GitHub"));
        JsonNode data = client.execute(ADD_ITEM, Map.of("project", projectId(), "content", issue.id()));
        String itemId = data.path("addProjectV2ItemById").path("item").path("id").asText(null);
        if (itemId == null) {
            throw new TrackerException("GitHub did not return an item id for " + payload.getKey());
        }
        return itemId;
    }

    @Override
    public void updateFields(String itemId, IssueKey key, List<FieldDiff> diffs) {
        Schema fields = schema();
        for (FieldDiff diff : diffs) {
            FieldRef field = fields.byName().get(diff.field());
            if (field == null) {
                throw new TrackerException("Project has no field '" + diff.field() + "'");
            }
            if (diff.to() == null) {
                client.execute(CLEAR_FIELD, Map.of("project", projectId(), "item", itemId, "field", field.id()));
            } else {
                client.execute(SET_FIELD, Map.of(
                        "project", projectId(),
                        "item", itemId,
                        "field", field.id(),
                        "value", fieldValue(field, diff.to())));
            }
            log.debug("github.field.set issue={} field={} value='{}'", key, diff.field(), diff.to());
        }
    }

    @Override
    public Optional<String> readBody(IssueKey key) {
        return issue(key).map(IssueNode::body);
    }

    @Override
    public void updateBody(IssueKey key, String body) {
        IssueNode issue = issue(key).orElseThrow(() -> new TrackerException("No issue " + key + " on GitHub"));
        String mutation = issue.pullRequest() ? SET_PULL_REQUEST_BODY : SET_ISSUE_BODY;
        client.execute(mutation, Map.of("id", issue.id(), "body", body));
        issues.put(key, new IssueNode(issue.id(), body, issue.pullRequest()));
    }

    @Override
    public void moveItem(String itemId, String afterItemId) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("project", projectId());
        variables.put("item", itemId);
        variables.put("after", afterItemId);
        client.execute(MOVE_ITEM, variables);
    }

    @Override
    public void removeItem(String itemId, IssueKey key) {
        client.execute(DELETE_ITEM, Map.of("project", projectId(), "item", itemId));
    }

    /**
     * Whether a repository is archived. Answers are cached.
     */
    public boolean isRepositoryArchived(String owner, String repository) {
        String cacheKey = (owner + "/" + repository).toLowerCase(Locale.ROOT);
        Boolean cached = archivedRepositories.getIfPresent(cacheKey);
        if (cached != null) {
            metrics.recordCacheHit();
            return cached;
        }
        metrics.recordCacheMiss();
        JsonNode repo = client.execute(REPOSITORY_QUERY, Map.of("owner", owner, "repo", repository))
                .path("repository");
        boolean archived = repo.path("isArchived").asBoolean(false);
        archivedRepositories.put(cacheKey, archived);
        return archived;
    }

    public String getOrganization() {
        return organization;
    }

    private TargetItem toTargetItem(JsonNode node, int position) {
        String itemId = node.path("id").asText();
        JsonNode content = node.path("content");
        IssueKey key = null;
        String body = null;
        String type = node.path("type").asText();
        if (("ISSUE".equals(type) || "PULL_REQUEST".equals(type)) && content.hasNonNull("number")) {
            JsonNode repo = content.path("repository");
            key = IssueKey.of(repo.path("owner").path("login").asText(), repo.path("name").asText(),
                    content.path("number").asInt());
            body = content.path("body").asText("");
            issues.put(key, new IssueNode(content.path("id").asText(), body, "PULL_REQUEST".equals(type)));
            archivedRepositories.put(key.owner() + "/" + key.repository(), repo.path("isArchived").asBoolean(false));
        }

        Map<String, String> values = new LinkedHashMap<>();
        for (JsonNode value : node.path("fieldValues").path("nodes")) {
            String field = value.path("field").path("name").asText(null);
            if (field == null) {
                continue;
            }
            if (value.has("text")) {
                values.put(field, value.path("text").asText());
            } else if (value.has("number")) {
                values.put(field, FieldValue.of(value.path("number").decimalValue()).text());
            } else if (value.has("date")) {
                values.put(field, value.path("date").asText());
            } else if (value.has("name")) {
                values.put(field, value.path("name").asText());
            } else if (value.has("title")) {
                values.put(field, value.path("title").asText());
            }
        }
        return new TargetItem(itemId, key, values, body, position);
    }

    private Optional<IssueNode> issue(IssueKey key) {
        IssueNode cached = issues.getIfPresent(key);
        if (cached != null) {
            metrics.recordCacheHit();
            return Optional.of(cached);
        }
        metrics.recordCacheMiss();
        JsonNode repo = client.execute(ISSUE_QUERY, Map.of(
                "owner", key.owner(),
                "repo", key.repository(),
                "number", key.number())).path("repository");
        JsonNode node = repo.path("issueOrPullRequest");
        if (!node.hasNonNull("id")) {
            return Optional.empty();
        }
        archivedRepositories.put(key.owner() + "/" + key.repository(), repo.path("isArchived").asBoolean(false));
        IssueNode issue = new IssueNode(node.path("id").asText(), node.path("body").asText(""),
                "PullRequest".equals(node.path("__typename").asText()));
        issues.put(key, issue);
        return Optional.of(issue);
    }

    private Map<String, Object> fieldValue(FieldRef field, String value) {
        switch (field.type()) {
            case NUMBER:
                try {
                    return Map.of("number", Double.parseDouble(value));
                } catch (NumberFormatException e) {
                    throw new TrackerException("'" + value + "' is not a number for field '" + field.name() + "'");
                }
            case SINGLE_SELECT:
                return Map.of("singleSelectOptionId", optionId(field, value));
            case ITERATION:
                return Map.of("iterationId", optionId(field, value));
            case DATE:
                return Map.of("date", value);
            case TEXT:
            default:
                return Map.of("text", value);
        }
    }

    private static String optionId(FieldRef field, String label) {
        String id = field.optionIds().get(label);
        if (id == null) {
            throw new TrackerException("'" + label + "' is not an option of field '" + field.name() + "'");
        }
        return id;
    }

    private String projectId() {
        String id = projectId;
        if (id == null) {
            JsonNode project = client.execute(PROJECT_QUERY, Map.of("login", organization, "number", projectNumber))
                    .path("organization").path("projectV2");
            id = project.path("id").asText(null);
            if (id == null) {
                throw new ConfigurationException(
                        "Project " + projectNumber + " of organization '" + organization + "' not found");
            }
            log.info("github.project id={} title='{}'", id, project.path("title").asText());
            projectId = id;
        }
        return id;
    }

    private Schema schema() {
        Schema current = schema;
        if (current == null) {
            Map<String, FieldRef> byName = new LinkedHashMap<>();
            JsonNode nodes = client.execute(FIELDS_QUERY, Map.of("project", projectId()))
                    .path("node").path("fields").path("nodes");
            for (JsonNode node : nodes) {
                TargetFieldType type = fieldType(node.path("dataType").asText());
                if (type == null) {
                    continue;
                }
                Map<String, String> options = new LinkedHashMap<>();
                for (JsonNode option : node.path("options")) {
                    options.put(option.path("name").asText(), option.path("id").asText());
                }
                JsonNode configuration = node.path("configuration");
                for (JsonNode iteration : configuration.path("completedIterations")) {
                    options.put(iteration.path("title").asText(), iteration.path("id").asText());
                }
                for (JsonNode iteration : configuration.path("iterations")) {
                    options.put(iteration.path("title").asText(), iteration.path("id").asText());
                }
                String name = node.path("name").asText();
                byName.put(name, new FieldRef(node.path("id").asText(), name, type, options));
            }
            current = new Schema(byName);
            schema = current;
            log.debug("github.schema fields={}", byName.keySet());
        }
        return current;
    }

    private static TargetFieldType fieldType(String dataType) {
        switch (dataType) {
            case "TEXT":
                return TargetFieldType.TEXT;
            case "NUMBER":
                return TargetFieldType.NUMBER;
            case "DATE":
                return TargetFieldType.DATE;
            case "SINGLE_SELECT":
                return TargetFieldType.SINGLE_SELECT;
            case "ITERATION":
                return TargetFieldType.ITERATION;
            default:
                return null;
        }
    }

    record IssueNode(String id, String body, boolean pullRequest) {}

    record FieldRef(String id, String name, TargetFieldType type, Map<String, String> optionIds) {}

    record Schema(Map<String, FieldRef> byName) {
        TargetSchema asTargetSchema() {
            List<TargetField> fields = new ArrayList<>();
            for (FieldRef ref : byName.values()) {
                OptionSet options = ref.type().hasOptions()
                        ? new OptionSet(new ArrayList<>(ref.optionIds().keySet()))
                        : OptionSet.empty();
                fields.add(new TargetField(ref.name(), ref.type(), options));
            }
            return new TargetSchema(fields);
        }
    }

    public static class Builder {
        private GraphQlClient client;
        private String organization;
        private int projectNumber;
        private SyncMetrics metrics = NoOpSyncMetrics.INSTANCE;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder client(GraphQlClient client) {
            this.client = client;
            return this;
        }

        public Builder organization(String organization) {
            this.organization = organization;
            return this;
        }

        public Builder projectNumber(int projectNumber) {
            this.projectNumber = projectNumber;
            return this;
        }

        public Builder metrics(SyncMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public GitHubProjectTargetAdapter build() {
            return new GitHubProjectTargetAdapter(this);
        }
    }
}
