package com.tracker.sync.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
    }

    @Test
    @DisplayName("Should record entries with details")
    void testRecord() {
        AuditEntry entry = auditService.record(AuditAction.ITEM_CREATED, "acme/api#1", "tracker-sync",
                Map.of("itemId", "item-1"));

        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
        assertEquals("item-1", entry.details().get("itemId"));
        assertEquals(1, auditService.size());
    }

    @Test
    @DisplayName("Should filter by issue and by action")
    void testFilters() {
        auditService.record(AuditAction.ITEM_CREATED, "acme/api#1", "tracker-sync");
        auditService.record(AuditAction.ITEM_UPDATED, "acme/api#1", "tracker-sync");
        auditService.record(AuditAction.ITEM_REMOVED, "acme/api#2", "tracker-sync");
        auditService.record(AuditAction.CONFIGURATION_ERROR, null, "tracker-sync",
                Map.of("message", "Unknown destination field 'Size'"));

        assertEquals(2, auditService.getEntriesForIssue("acme/api#1").size());
        assertEquals(1, auditService.getEntriesByAction(AuditAction.ITEM_REMOVED).size());
        assertEquals(4, auditService.getAllEntries().size());
        assertFalse(auditService.getEntriesByAction(AuditAction.CONFIGURATION_ERROR).get(0).details().isEmpty());
    }

    @Test
    @DisplayName("Entries require an action")
    void testValidation() {
        assertThrows(NullPointerException.class, () -> AuditEntry.builder().build());
        assertThrows(UnsupportedOperationException.class,
                () -> auditService.getAllEntries().add(AuditEntry.builder().action(AuditAction.PR_LINKED).build()));
    }
}
