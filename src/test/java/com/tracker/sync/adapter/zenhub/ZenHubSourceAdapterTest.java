package com.tracker.sync.adapter.zenhub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracker.sync.adapter.RawItem;
import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.adapter.graphql.GraphQlClient;
import com.tracker.sync.core.model.CanonicalField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ZenHubSourceAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String WORKSPACES = """
            {"recentlyViewedWorkspaces": {"nodes": [
              {"id": "ws1", "name": "Team A", "pipelines": [
                {"id": "p1", "name": "Backlog"}, {"id": "p2", "name": "In Progress"}]},
              {"id": "ws2", "name": "Team B", "pipelines": []}
            ]}}
            """;

    private static final String BACKLOG = """
            {"searchIssuesByPipeline": {
              "pageInfo": {"hasNextPage": false, "endCursor": null},
              "nodes": [
                {"id": "i1", "number": 1, "title": "Login", "pullRequest": false,
                 "updatedAt": "2024-05-01T10:00:00Z",
                 "pipelineIssue": {"priority": {"name": "High"}},
                 "repository": {"name": "api", "owner": {"login": "acme"}},
                 "estimate": {"value": 3},
                 "sprints": {"nodes": [{"name": "Sprint 4"}]},
                 "connections": {"nodes": []}},
                {"id": "i2", "number": 2, "title": "Fix login", "pullRequest": true,
                 "pipelineIssue": {"priority": null},
                 "repository": {"name": "api", "owner": {"login": "acme"}},
                 "estimate": null,
                 "sprints": {"nodes": []},
                 "connections": {"nodes": [{"number": 1, "repository": {"name": "api", "owner": {"login": "acme"}}}]}}
              ]}}
            """;

    private static final String IN_PROGRESS_PAGE_1 = """
            {"searchIssuesByPipeline": {
              "pageInfo": {"hasNextPage": true, "endCursor": "c1"},
              "nodes": [
                {"id": "i3", "number": 5, "title": "Old UI", "pullRequest": false,
                 "repository": {"name": "web", "owner": {"login": "acme"}}}
              ]}}
            """;

    private static final String IN_PROGRESS_PAGE_2 = """
            {"searchIssuesByPipeline": {
              "pageInfo": {"hasNextPage": false, "endCursor": null},
              "nodes": [
                {"id": "i1", "number": 1, "title": "Login", "pullRequest": false,
                 "repository": {"name": "api", "owner": {"login": "acme"}}},
                {"id": "i4", "number": 9, "title": "Docs", "pullRequest": false,
                 "repository": {"name": "api", "owner": {"login": "acme"}}}
              ]}}
            """;

    private static final String EPICS = """
            {"workspace": {"epics": {"nodes": [{"id": "e1", "issue": {"id": "i1"}}]}}}
            """;

    private static final String EPIC_CHILDREN = """
            {"node": {"childIssues": {"nodes": [{"htmlUrl": "https://github.com/acme/web/issues/5"}]}}}
            """;

    private static final String DEPENDENCIES = """
            {"workspace": {"issueDependencies": {"nodes": [
              {"blockedIssue": {"id": "i3"}, "blockingIssue": {"htmlUrl": "https://github.com/acme/api/issues/2"}},
              {"blockedIssue": {"id": "i3"}, "blockingIssue": {"htmlUrl": "https://github.com/acme/api/issues/2"}}
            ]}}}
            """;

    @Mock
    private GraphQlClient client;

    private ZenHubSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new ZenHubSourceAdapter(client, (owner, repo) -> repo.equals("web"));
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private void stubBoard() {
        when(client.execute(anyString(), any())).thenAnswer(invocation -> {
            String query = invocation.getArgument(0);
            Map<String, ?> variables = invocation.getArgument(1);
            if (query.contains("recentlyViewedWorkspaces")) {
                return json(WORKSPACES);
            }
            if (query.contains("searchIssuesByPipeline")) {
                if ("p1".equals(variables.get("pipelineId"))) {
                    return json(BACKLOG);
                }
                return variables.get("cursor") == null ? json(IN_PROGRESS_PAGE_1) : json(IN_PROGRESS_PAGE_2);
            }
            if (query.contains("childIssues")) {
                return json(EPIC_CHILDREN);
            }
            if (query.contains("epics")) {
                return json(EPICS);
            }
            if (query.contains("issueDependencies")) {
                return json(DEPENDENCIES);
            }
            throw new AssertionError("Unexpected query " + query);
        });
    }

    @Test
    @DisplayName("Should list workspaces in the order ZenHub returns them")
    void testListSources() {
        when(client.execute(anyString(), any())).thenReturn(json(WORKSPACES));

        assertEquals(List.of("Team A", "Team B"), adapter.listSources());
        adapter.listSources();
        verify(client, times(1)).execute(anyString(), any());
    }

    @Test
    @DisplayName("Should read every pipeline with positions, fields and relations")
    void testFetchWorkspace() {
        stubBoard();

        List<RawItem> items = adapter.fetchWorkspace("Team A");

        assertEquals(List.of("acme/api#1 'Login'", "acme/api#2 'Fix login'", "acme/web#5 'Old UI'", "acme/api#9 'Docs'"),
                items.stream().map(RawItem::toString).toList());

        RawItem login = items.get(0);
        assertEquals("Backlog", login.getFields().get("pipeline"));
        assertEquals(0, login.getFields().get("position"));
        assertEquals(3, login.getFields().get("estimate"));
        assertEquals("High", login.getFields().get("priority"));
        assertEquals(List.of("Sprint 4"), login.getFields().get("sprints"));
        assertEquals(List.of("https://github.com/acme/web/issues/5"), login.getFields().get("epic"));
        assertEquals(Instant.parse("2024-05-01T10:00:00Z"), login.getUpdatedAt());
        assertEquals("i1", login.getExternalId());

        RawItem pullRequest = items.get(1);
        assertTrue(pullRequest.isPullRequest());
        assertEquals(1, pullRequest.getFields().get("position"));
        assertEquals(List.of("acme/api#1"), pullRequest.getFields().get("connections"));
        assertFalse(pullRequest.getFields().containsKey("priority"));
        assertFalse(pullRequest.getFields().containsKey("estimate"));

        RawItem oldUi = items.get(2);
        assertEquals("In Progress", oldUi.getFields().get("pipeline"));
        assertEquals(0, oldUi.getFields().get("position"));
        assertTrue(oldUi.isArchived());
        assertEquals(List.of("https://github.com/acme/api/issues/2"), oldUi.getFields().get("blockedBy"));

        assertEquals(1, items.get(3).getFields().get("position"));
    }

    @Test
    @DisplayName("Workspace names are matched ignoring case")
    void testCaseInsensitiveName() {
        stubBoard();

        assertEquals(4, adapter.fetchWorkspace("team a").size());
    }

    @Test
    @DisplayName("Unknown workspaces are reported")
    void testUnknownWorkspace() {
        when(client.execute(anyString(), any())).thenReturn(json(WORKSPACES));

        TrackerException e = assertThrows(TrackerException.class, () -> adapter.fetchWorkspace("Team C"));
        assertTrue(e.getMessage().contains("Team C"));
    }

    @Test
    @DisplayName("ZenHub reports no estimate scale")
    void testNoScale() {
        assertTrue(adapter.listOrderedScaleLabels(CanonicalField.ESTIMATE).isEmpty());
    }
}
