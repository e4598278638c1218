package com.tracker.sync.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should set and clear issue context")
    void testForIssue() {
        try (LogContext ctx = LogContext.forIssue("pass-1", "acme/api#1", "apply")) {
            assertEquals("pass-1", MDC.get("passId"));
            assertEquals("acme/api#1", MDC.get("issueKey"));
            assertEquals("apply", MDC.get("operation"));
        }
        assertNull(MDC.get("passId"));
        assertNull(MDC.get("issueKey"));
    }

    @Test
    @DisplayName("Should set source context and extra keys")
    void testForSource() {
        try (LogContext ctx = LogContext.forSource("pass-1", "Team A").with("page", "2")) {
            assertEquals("Team A", MDC.get("sourceId"));
            assertEquals("fetch", MDC.get("operation"));
            assertEquals("2", MDC.get("page"));
        }
        assertNull(MDC.get("sourceId"));
        assertNull(MDC.get("page"));
    }

    @Test
    @DisplayName("Null values are skipped")
    void testNullValue() {
        try (LogContext ctx = LogContext.forIssue(null, "acme/api#1", "remove")) {
            assertNull(MDC.get("passId"));
            assertEquals("acme/api#1", MDC.get("issueKey"));
        }
    }

    @Test
    @DisplayName("Pass ids are unique")
    void testGeneratePassId() {
        assertNotEquals(LogContext.generatePassId(), LogContext.generatePassId());
        try (LogContext ctx = LogContext.forPass("pass-9")) {
            assertEquals("pass", MDC.get("operation"));
        }
    }
}
