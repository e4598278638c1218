package com.tracker.sync.api;

import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.mapping.FieldMappingRule;
import com.tracker.sync.matching.MatchStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SyncOptionsTest {

    @ParameterizedTest
    @CsvSource({
            "https://github.com/orgs/acme/projects/3, acme, 3",
            "https://github.com/orgs/Acme-Labs/projects/12/views/1, acme-labs, 12",
            "http://github.example.com/orgs/acme/projects/7/, acme, 7"
    })
    @DisplayName("Should read organization and project number from the project URL")
    void testProjectUrl(String url, String organization, int number) {
        SyncOptions options = SyncOptions.builder().projectUrl(url).build();

        assertEquals(organization, options.getOrganization());
        assertEquals(number, options.getProjectNumber());
    }

    @ParameterizedTest
    @ValueSource(strings = {"https://github.com/acme/projects/3", "https://github.com/orgs/acme/projects/x",
            "github.com/orgs/acme/projects/3", " "})
    @DisplayName("Should reject URLs that do not name an organization project")
    void testInvalidUrl(String url) {
        assertThrows(IllegalArgumentException.class, () -> SyncOptions.builder().projectUrl(url).build());
    }

    @Test
    @DisplayName("Defaults")
    void testDefaults() {
        SyncOptions options = SyncOptions.builder().projectUrl("https://github.com/orgs/acme/projects/3").build();

        assertTrue(options.getWorkspaces().isEmpty());
        assertTrue(options.isSkipLinkedPullRequests());
        assertFalse(options.isRemoveDisabled());
        assertFalse(options.isDryRun());
        assertEquals("Status", options.getStatusField());
        assertEquals(Duration.ofSeconds(180), options.getTimeout());
        assertEquals(4, options.getFetchConcurrency());
        assertEquals(8, options.getFieldMappings().size());
    }

    @Test
    @DisplayName("User mappings replace the defaults of their field")
    void testFieldMappings() {
        SyncOptions options = SyncOptions.builder()
                .projectUrl("https://github.com/orgs/acme/projects/3")
                .fieldMappings(List.of("Estimate:Points", "Epic:"))
                .build();

        List<FieldMappingRule> rules = options.getFieldMappings();
        assertTrue(rules.contains(FieldMappingRule.of(CanonicalField.ESTIMATE, "Points")));
        assertFalse(rules.contains(FieldMappingRule.of(CanonicalField.ESTIMATE, "Size", MatchStrategy.SCALE)));
        assertTrue(rules.stream().noneMatch(r -> r.sourceField() == CanonicalField.EPIC));
    }

    @Test
    @DisplayName("Invalid values are rejected when set")
    void testValidation() {
        SyncOptions.Builder builder = SyncOptions.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.workspace(" "));
        assertThrows(IllegalArgumentException.class, () -> builder.fieldMapping("Colour:Status"));
        assertThrows(IllegalArgumentException.class, () -> builder.fetchConcurrency(0));
        assertThrows(IllegalArgumentException.class, () -> builder.timeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> builder.statusField(""));
    }
}
