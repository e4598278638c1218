package com.tracker.sync.adapter.zenhub;

import com.fasterxml.jackson.databind.JsonNode;
import com.tracker.sync.adapter.RawItem;
import com.tracker.sync.adapter.SourceAdapter;
import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.adapter.graphql.GraphQlClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Reads ZenHub workspaces through the ZenHub public GraphQL API.
 *
 * <p>Each board item becomes a {@link RawItem} with the raw fields {@code pipeline},
 * {@code position} (index within the pipeline), {@code estimate}, {@code priority},
 * {@code sprints}, {@code epic} (child issue URLs when the item is an epic), {@code blockedBy}
 * (blocking issue URLs) and {@code connections} (issues a pull request is linked to).</p>
 *
 * <p>ZenHub does not expose its estimate scale, so {@link #listOrderedScaleLabels} keeps the
 * default of reporting nothing.</p>
 */
public class ZenHubSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(ZenHubSourceAdapter.class);

    public static final String ENDPOINT = "https://api.zenhub.com/public/graphql";

    private static final int PAGE_SIZE = 100;

    private static final String WORKSPACES_QUERY = """
            query RecentlyViewedWorkspaces {
              recentlyViewedWorkspaces {
                nodes { id name pipelines { id name } }
              }
            }
            """;

    private static final String PIPELINE_ISSUES_QUERY = """
            query ($pipelineId: ID!, $workspaceId: ID!, $cursor: String) {
              searchIssuesByPipeline(pipelineId: $pipelineId, filters: {displayType: all}, first: 100, after: $cursor) {
                pageInfo { hasNextPage endCursor }
                nodes {
                  id number title pullRequest updatedAt
                  pipelineIssue(workspaceId: $workspaceId) { priority { name } }
                  repository { name owner { login } }
                  estimate { value }
                  sprints(first: 10) { nodes { name } }
                  connections(first: 20) { nodes { number repository { name owner { login } } } }
                }
              }
            }
            """;

    private static final String EPICS_QUERY = """
            query ($workspaceId: ID!) {
              workspace(id: $workspaceId) {
                epics(first: 100) { nodes { id issue { id } } }
              }
            }
            """;

    private static final String EPIC_CHILDREN_QUERY = """
            query ($epicId: ID!) {
              node(id: $epicId) {
                ... on Epic { childIssues(first: 100) { nodes { htmlUrl } } }
              }
            }
            """;

    private static final String DEPENDENCIES_QUERY = """
            query ($workspaceId: ID!) {
              workspace(id: $workspaceId) {
                issueDependencies(first: 100) {
                  nodes { blockedIssue { id } blockingIssue { htmlUrl } }
                }
              }
            }
            """;

    private final GraphQlClient client;
    private final BiPredicate<String, String> archivedRepository;
    private volatile Map<String, Workspace> workspaces;

    /**
     * @param archivedRepository tells whether {@code (owner, repository)} is archived; items of
     *                           archived repositories are flagged so normalization skips them
     */
    public ZenHubSourceAdapter(GraphQlClient client, BiPredicate<String, String> archivedRepository) {
        this.client = Objects.requireNonNull(client, "client is required");
        this.archivedRepository = archivedRepository != null ? archivedRepository : (owner, repo) -> false;
    }

    public ZenHubSourceAdapter(GraphQlClient client) {
        this(client, null);
    }

    @Override
    public List<String> listSources() {
        return List.copyOf(workspaces().keySet());
    }

    @Override
    public List<RawItem> fetchWorkspace(String sourceId) {
        Workspace workspace = findWorkspace(sourceId);
        Map<String, List<String>> epicChildren = epicChildren(workspace);
        Map<String, List<String>> blockers = blockers(workspace);

        Map<String, RawItem> items = new LinkedHashMap<>();
        for (Pipeline pipeline : workspace.pipelines()) {
            int position = 0;
            for (JsonNode node : pipelineIssues(workspace, pipeline)) {
                String id = node.path("id").asText();
                if (items.containsKey(id)) {
                    continue;
                }
                items.put(id, toRawItem(node, pipeline, position++, epicChildren, blockers));
            }
        }
        log.info("zenhub.fetched workspace='{}' items={} epics={} dependencies={}",
                workspace.name(), items.size(), epicChildren.size(), blockers.size());
        return new ArrayList<>(items.values());
    }

    private RawItem toRawItem(JsonNode node, Pipeline pipeline, int position,
                              Map<String, List<String>> epicChildren, Map<String, List<String>> blockers) {
        String id = node.path("id").asText();
        String owner = node.path("repository").path("owner").path("login").asText();
        String repository = node.path("repository").path("name").asText();

        RawItem.Builder builder = RawItem.builder()
                .owner(owner)
                .repository(repository)
                .number(node.path("number").asInt())
                .externalId(id)
                .title(node.path("title").asText(null))
                .pullRequest(node.path("pullRequest").asBoolean(false))
                .archived(archivedRepository.test(owner, repository))
                .field("pipeline", pipeline.name())
                .field("position", position);

        JsonNode updatedAt = node.path("updatedAt");
        if (updatedAt.isTextual()) {
            builder.updatedAt(Instant.parse(updatedAt.asText()));
        }
        JsonNode estimate = node.path("estimate").path("value");
        if (estimate.isNumber()) {
            builder.field("estimate", estimate.numberValue());
        }
        JsonNode priority = node.path("pipelineIssue").path("priority").path("name");
        if (priority.isTextual()) {
            builder.field("priority", priority.asText());
        }
        List<String> sprints = new ArrayList<>();
        for (JsonNode sprint : node.path("sprints").path("nodes")) {
            sprints.add(sprint.path("name").asText());
        }
        if (!sprints.isEmpty()) {
            builder.field("sprints", sprints);
        }
        if (epicChildren.containsKey(id)) {
            builder.field("epic", epicChildren.get(id));
        }
        if (blockers.containsKey(id)) {
            builder.field("blockedBy", blockers.get(id));
        }
        List<String> connections = new ArrayList<>();
        for (JsonNode linked : node.path("connections").path("nodes")) {
            connections.add(linked.path("repository").path("owner").path("login").asText() + "/"
                    + linked.path("repository").path("name").asText() + "#" + linked.path("number").asInt());
        }
        if (!connections.isEmpty() && node.path("pullRequest").asBoolean(false)) {
            builder.field("connections", connections);
        }
        return builder.build();
    }

    private List<JsonNode> pipelineIssues(Workspace workspace, Pipeline pipeline) {
        List<JsonNode> nodes = new ArrayList<>();
        String cursor = null;
        do {
            Map<String, Object> variables = new HashMap<>();
            variables.put("pipelineId", pipeline.id());
            variables.put("workspaceId", workspace.id());
            variables.put("cursor", cursor);
            JsonNode page = client.execute(PIPELINE_ISSUES_QUERY, variables).path("searchIssuesByPipeline");
            page.path("nodes").forEach(nodes::add);
            JsonNode pageInfo = page.path("pageInfo");
            cursor = pageInfo.path("hasNextPage").asBoolean(false) ? pageInfo.path("endCursor").asText(null) : null;
        } while (cursor != null);
        log.debug("zenhub.pipeline workspace='{}' pipeline='{}' items={}", workspace.name(), pipeline.name(),
                nodes.size());
        return nodes;
    }

    private Map<String, List<String>> epicChildren(Workspace workspace) {
        Map<String, List<String>> children = new HashMap<>();
        JsonNode epics = client.execute(EPICS_QUERY, Map.of("workspaceId", workspace.id()))
                .path("workspace").path("epics").path("nodes");
        for (JsonNode epic : epics) {
            List<String> urls = new ArrayList<>();
            JsonNode nodes = client.execute(EPIC_CHILDREN_QUERY, Map.of("epicId", epic.path("id").asText()))
                    .path("node").path("childIssues").path("nodes");
            for (JsonNode child : nodes) {
                urls.add(child.path("htmlUrl").asText());
            }
            children.put(epic.path("issue").path("id").asText(), urls);
        }
        return children;
    }

    private Map<String, List<String>> blockers(Workspace workspace) {
        Map<String, List<String>> blockedBy = new HashMap<>();
        JsonNode dependencies = client.execute(DEPENDENCIES_QUERY, Map.of("workspaceId", workspace.id()))
                .path("workspace").path("issueDependencies").path("nodes");
        for (JsonNode dependency : dependencies) {
            List<String> urls = blockedBy.computeIfAbsent(
                    dependency.path("blockedIssue").path("id").asText(), id -> new ArrayList<>());
            String url = dependency.path("blockingIssue").path("htmlUrl").asText();
            if (!urls.contains(url)) {
                urls.add(url);
            }
        }
        return blockedBy;
    }

    private Workspace findWorkspace(String name) {
        Map<String, Workspace> all = workspaces();
        Workspace workspace = all.get(name);
        if (workspace != null) {
            return workspace;
        }
        for (Workspace candidate : all.values()) {
            if (candidate.name().equalsIgnoreCase(name)) {
                return candidate;
            }
        }
        throw new TrackerException("Unknown ZenHub workspace '" + name + "'");
    }

    private Map<String, Workspace> workspaces() {
        Map<String, Workspace> result = workspaces;
        if (result == null) {
            result = new LinkedHashMap<>();
            JsonNode nodes = client.execute(WORKSPACES_QUERY, Map.of())
                    .path("recentlyViewedWorkspaces").path("nodes");
            for (JsonNode node : nodes) {
                List<Pipeline> pipelines = new ArrayList<>();
                for (JsonNode p : node.path("pipelines")) {
                    pipelines.add(new Pipeline(p.path("id").asText(), p.path("name").asText()));
                }
                String name = node.path("name").asText();
                result.put(name, new Workspace(node.path("id").asText(), name, List.copyOf(pipelines)));
            }
            workspaces = result;
            log.debug("zenhub.workspaces count={}", result.size());
        }
        return result;
    }

    record Workspace(String id, String name, List<Pipeline> pipelines) {}

    record Pipeline(String id, String name) {}
}
