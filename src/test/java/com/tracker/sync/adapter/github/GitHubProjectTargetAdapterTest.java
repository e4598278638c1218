package com.tracker.sync.adapter.github;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracker.sync.adapter.TrackerException;
import com.tracker.sync.adapter.graphql.GraphQlClient;
import com.tracker.sync.api.ConfigurationException;
import com.tracker.sync.core.model.FieldDiff;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.OptionSet;
import com.tracker.sync.core.model.TargetFieldType;
import com.tracker.sync.core.model.TargetItem;
import com.tracker.sync.core.model.TargetPayload;
import com.tracker.sync.core.model.TargetSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GitHubProjectTargetAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String PROJECT = """
            {"organization": {"projectV2": {"id": "PVT_1", "title": "Roadmap"}}}
            """;

    private static final String FIELDS = """
            {"node": {"fields": {"nodes": [
              {"id": "F_title", "name": "Title", "dataType": "TITLE"},
              {"id": "F_status", "name": "Status", "dataType": "SINGLE_SELECT",
               "options": [{"id": "O_todo", "name": "Todo"}, {"id": "O_done", "name": "Done"}]},
              {"id": "F_points", "name": "Points", "dataType": "NUMBER"},
              {"id": "F_notes", "name": "Notes", "dataType": "TEXT"},
              {"id": "F_iter", "name": "Iteration", "dataType": "ITERATION",
               "configuration": {"iterations": [{"id": "I_4", "title": "Sprint 4"}],
                                 "completedIterations": [{"id": "I_3", "title": "Sprint 3"}]}}
            ]}}}
            """;

    private static final String ITEMS_PAGE_1 = """
            {"organization": {"projectV2": {"items": {
              "pageInfo": {"hasNextPage": true, "endCursor": "c1"},
              "nodes": [
                {"id": "PVTI_1", "type": "ISSUE",
                 "content": {"id": "I_kw1", "number": 1, "body": "Intro",
                             "repository": {"name": "API", "isArchived": false, "owner": {"login": "Acme"}}},
                 "fieldValues": {"nodes": [
                   {"name": "Done", "field": {"name": "Status"}},
                   {"number": 5.0, "field": {"name": "Points"}},
                   {"title": "Sprint 4", "field": {"name": "Iteration"}},
                   {}
                 ]}}
              ]}}}}
            """;

    private static final String ITEMS_PAGE_2 = """
            {"organization": {"projectV2": {"items": {
              "pageInfo": {"hasNextPage": false, "endCursor": null},
              "nodes": [
                {"id": "PVTI_2", "type": "DRAFT_ISSUE", "content": {"title": "Idea"},
                 "fieldValues": {"nodes": [{"name": "Todo", "field": {"name": "Status"}}]}},
                {"id": "PVTI_3", "type": "PULL_REQUEST",
                 "content": {"id": "PR_kw3", "number": 3, "body": "",
                             "repository": {"name": "api", "isArchived": false, "owner": {"login": "acme"}}},
                 "fieldValues": {"nodes": []}}
              ]}}}}
            """;

    private static final String ISSUE = """
            {"repository": {"isArchived": true,
              "issueOrPullRequest": {"__typename": "Issue", "id": "I_kw7", "body": "Seven"}}}
            """;

    private static final String PULL_REQUEST = """
            {"repository": {"isArchived": false,
              "issueOrPullRequest": {"__typename": "PullRequest", "id": "PR_kw8", "body": "Eight"}}}
            """;

    private static final String MISSING = """
            {"repository": {"isArchived": false, "issueOrPullRequest": null}}
            """;

    @Mock
    private GraphQlClient client;

    private GitHubProjectTargetAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = GitHubProjectTargetAdapter.builder()
                .client(client)
                .organization("acme")
                .projectNumber(3)
                .build();
    }

    private static JsonNode json(String text) {
        try {
            return MAPPER.readTree(text);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    private void stubGitHub() {
        lenient().when(client.execute(anyString(), any())).thenAnswer(invocation -> {
            String query = invocation.getArgument(0);
            Map<String, ?> variables = invocation.getArgument(1);
            if (query.contains("items(first")) {
                return variables.get("cursor") == null ? json(ITEMS_PAGE_1) : json(ITEMS_PAGE_2);
            }
            if (query.contains("projectV2(number")) {
                return json(PROJECT);
            }
            if (query.contains("fields(first")) {
                return json(FIELDS);
            }
            if (query.contains("issueOrPullRequest")) {
                Object number = variables.get("number");
                if (Integer.valueOf(7).equals(number)) {
                    return json(ISSUE);
                }
                if (Integer.valueOf(8).equals(number)) {
                    return json(PULL_REQUEST);
                }
                return json(MISSING);
            }
            if (query.contains("{ isArchived }")) {
                return json("{\"repository\": {\"isArchived\": true}}");
            }
            if (query.contains("addProjectV2ItemById")) {
                return json("{\"addProjectV2ItemById\": {\"item\": {\"id\": \"PVTI_new\"}}}");
            }
            return json("{}");
        });
    }

    private int calls(String fragment) {
        return (int) mockingDetails(client).getInvocations().stream()
                .filter(i -> i.getArgument(0, String.class).contains(fragment))
                .count();
    }

    @Nested
    @DisplayName("Reading")
    class ReadingTests {

        @Test
        @DisplayName("Should read the schema with options and iterations, skipping built-in fields")
        void testSchema() {
            stubGitHub();

            TargetSchema schema = adapter.listFieldSchema();

            assertFalse(schema.contains("Title"));
            assertEquals(OptionSet.of("Todo", "Done"), schema.field("Status").orElseThrow().options());
            assertEquals(OptionSet.of("Sprint 3", "Sprint 4"), schema.field("Iteration").orElseThrow().options());
            assertEquals(TargetFieldType.NUMBER, schema.field("Points").orElseThrow().type());
            assertTrue(schema.field("Notes").orElseThrow().options().isEmpty());
            adapter.listFieldSchema();
            assertEquals(1, calls("fields(first"));
        }

        @Test
        @DisplayName("A missing project is a configuration error")
        void testMissingProject() {
            when(client.execute(anyString(), any())).thenReturn(json("{\"organization\": {\"projectV2\": null}}"));

            assertThrows(ConfigurationException.class, () -> adapter.listFieldSchema());
        }

        @Test
        @DisplayName("Should page through items in board order")
        void testListItems() {
            stubGitHub();

            List<TargetItem> items = adapter.listItems();

            assertEquals(3, items.size());
            TargetItem first = items.get(0);
            assertEquals(IssueKey.of("acme", "api", 1), first.key());
            assertEquals(Map.of("Status", "Done", "Points", "5", "Iteration", "Sprint 4"), first.fields());
            assertEquals("Intro", first.body());
            assertEquals(0, first.position());

            assertTrue(items.get(1).isDraft());
            assertEquals("Todo", items.get(1).field("Status"));
            assertEquals(2, items.get(2).position());
            assertEquals(2, calls("items(first"));
        }

        @Test
        @DisplayName("Bodies of listed items come from the cache")
        void testBodyCache() {
            stubGitHub();
            adapter.listItems();

            assertEquals(Optional.of("Intro"), adapter.readBody(IssueKey.of("acme", "api", 1)));
            assertEquals(0, calls("issueOrPullRequest"));
        }

        @Test
        @DisplayName("Unknown issues read as empty")
        void testMissingIssue() {
            stubGitHub();

            assertTrue(adapter.readBody(IssueKey.of("acme", "api", 99)).isEmpty());
        }

        @Test
        @DisplayName("Archived lookups are cached per repository")
        void testArchived() {
            stubGitHub();

            assertTrue(adapter.isRepositoryArchived("acme", "legacy"));
            assertTrue(adapter.isRepositoryArchived("Acme", "Legacy"));
            assertEquals(1, calls("{ isArchived }"));
        }

        @Test
        @DisplayName("Archived lookups share one cache entry whatever the default locale")
        void testArchivedLocale() {
            stubGitHub();
            Locale previous = Locale.getDefault();
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            try {
                assertTrue(adapter.isRepositoryArchived("ACME", "INFRA"));
                assertTrue(adapter.isRepositoryArchived("acme", "infra"));
            } finally {
                Locale.setDefault(previous);
            }
            assertEquals(1, calls("{ isArchived }"));
        }
    }

    @Nested
    @DisplayName("Writing")
    class WritingTests {

        @Test
        @DisplayName("Should add the issue's content id to the project")
        void testCreateItem() {
            stubGitHub();

            String itemId = adapter.createItem(
                    TargetPayload.builder(IssueKey.of("acme", "api", 7)).build());

            assertEquals("PVTI_new", itemId);
            verify(client).execute(contains("addProjectV2ItemById"), eq(Map.of("project", "PVT_1", "content", "I_kw7")));
        }

        @Test
        @DisplayName("Creating an item for a missing issue fails")
        void testCreateMissing() {
            stubGitHub();

            assertThrows(TrackerException.class, () -> adapter.createItem(
                    TargetPayload.builder(IssueKey.of("acme", "api", 99)).build()));
        }

        @Test
        @DisplayName("Should send option ids, numbers and clears")
        void testUpdateFields() {
            stubGitHub();
            IssueKey key = IssueKey.of("acme", "api", 1);

            adapter.updateFields("PVTI_1", key, List.of(
                    new FieldDiff("Status", "Todo", "Done"),
                    new FieldDiff("Points", null, "5"),
                    new FieldDiff("Iteration", "Sprint 3", "Sprint 4"),
                    new FieldDiff("Notes", "old", null)));

            verify(client).execute(contains("updateProjectV2ItemFieldValue"), eq(Map.of("project", "PVT_1",
                    "item", "PVTI_1", "field", "F_status", "value", Map.of("singleSelectOptionId", "O_done"))));
            verify(client).execute(contains("updateProjectV2ItemFieldValue"), eq(Map.of("project", "PVT_1",
                    "item", "PVTI_1", "field", "F_points", "value", Map.of("number", 5.0))));
            verify(client).execute(contains("updateProjectV2ItemFieldValue"), eq(Map.of("project", "PVT_1",
                    "item", "PVTI_1", "field", "F_iter", "value", Map.of("iterationId", "I_4"))));
            verify(client).execute(contains("clearProjectV2ItemFieldValue"), eq(Map.of("project", "PVT_1",
                    "item", "PVTI_1", "field", "F_notes")));
        }

        @Test
        @DisplayName("Unknown options and fields are rejected")
        void testUpdateInvalid() {
            stubGitHub();
            IssueKey key = IssueKey.of("acme", "api", 1);

            assertThrows(TrackerException.class, () -> adapter.updateFields("PVTI_1", key,
                    List.of(new FieldDiff("Status", null, "Blocked"))));
            assertThrows(TrackerException.class, () -> adapter.updateFields("PVTI_1", key,
                    List.of(new FieldDiff("Size", null, "Large"))));
        }

        @Test
        @DisplayName("Issue and pull request bodies use their own mutations")
        void testUpdateBody() {
            stubGitHub();

            adapter.updateBody(IssueKey.of("acme", "api", 7), "Seven\n# Dependencies\n");
            adapter.updateBody(IssueKey.of("acme", "api", 8), "Eight\nfixes acme/api#7");

            verify(client).execute(contains("updateIssue("), eq(Map.of("id", "I_kw7", "body", "Seven\n# Dependencies\n")));
            verify(client).execute(contains("updatePullRequest("), eq(Map.of("id", "PR_kw8", "body", "Eight\nfixes acme/api#7")));
            assertEquals(Optional.of("Seven\n# Dependencies\n"), adapter.readBody(IssueKey.of("acme", "api", 7)));
        }

        @Test
        @DisplayName("Moves to the top send a null predecessor")
        void testMoveItem() {
            stubGitHub();

            adapter.moveItem("PVTI_3", null);

            Map<String, Object> expected = new HashMap<>();
            expected.put("project", "PVT_1");
            expected.put("item", "PVTI_3");
            expected.put("after", null);
            verify(client).execute(contains("updateProjectV2ItemPosition"), eq(expected));
        }

        @Test
        @DisplayName("Removing deletes the project item only")
        void testRemoveItem() {
            stubGitHub();

            adapter.removeItem("PVTI_3", IssueKey.of("acme", "api", 3));

            verify(client).execute(contains("deleteProjectV2Item"), eq(Map.of("project", "PVT_1", "item", "PVTI_3")));
        }
    }
}
