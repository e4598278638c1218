package com.tracker.sync.reconcile;

import com.tracker.sync.core.model.ActionType;
import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.mapping.TranslationStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReconciliationReportTest {

    private static final IssueKey A = IssueKey.of("acme", "api", 1);

    @Test
    @DisplayName("Should print counts, problems and translations")
    void testSummary() {
        TranslationStats stats = new TranslationStats();
        stats.record("Status", "In Progres", "In Progress");
        stats.record("Status", "In Progres", "In Progress");
        stats.record("Priority", "Hihg", "High");

        ReconciliationReport report = ReconciliationReport.builder()
                .passId("pass-1")
                .sources(List.of("Team A"))
                .applied(new ApplyResult(2, 1, 0, 3, 1, 0,
                        List.of(new FailedAction(ActionType.UPDATE, A, "updateFields", "boom"))))
                .notices(List.of(new Notice(NoticeType.DRAFT_NOT_REMOVED, null, "item-5", "draft item")))
                .configurationErrors(List.of("Unknown destination field 'Size'"))
                .translations(stats.snapshot())
                .build();

        String expected = """
                Summary
                =======
                Added: 2, Removed: 0, Text Changes: 3
                Updated: 1, Moved: 1, Linked pull requests: 0

                Not removed
                - DRAFT_NOT_REMOVED item-5 - draft item

                Failed
                - UPDATE acme/api#1 updateFields: boom

                Configuration errors
                - Unknown destination field 'Size'

                Priority
                \tHihg -> High: 1
                Status
                \tIn Progres -> In Progress: 2
                """;
        assertEquals(expected, report.summary());
        assertTrue(report.hasFailures());
    }

    @Test
    @DisplayName("A quiet pass prints only the counts")
    void testEmpty() {
        ReconciliationReport report = ReconciliationReport.builder().passId("pass-2").build();

        assertEquals("Summary\n=======\nAdded: 0, Removed: 0, Text Changes: 0\n"
                + "Updated: 0, Moved: 0, Linked pull requests: 0\n", report.summary());
        assertFalse(report.hasFailures());
    }

    @Test
    @DisplayName("A pass id is required")
    void testPassIdRequired() {
        assertThrows(NullPointerException.class, () -> ReconciliationReport.builder().build());
    }
}
