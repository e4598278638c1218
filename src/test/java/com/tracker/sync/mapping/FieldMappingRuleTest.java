package com.tracker.sync.mapping;

import com.tracker.sync.core.model.CanonicalField;
import com.tracker.sync.matching.MatchStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldMappingRuleTest {

    @Nested
    @DisplayName("parse")
    class ParseTests {

        @Test
        @DisplayName("Should parse source, destination and conversion")
        void testFull() {
            FieldMappingRule rule = FieldMappingRule.parse("Estimate:Size:Scale");
            assertEquals(CanonicalField.ESTIMATE, rule.sourceField());
            assertEquals("Size", rule.destination());
            assertEquals(MatchStrategy.SCALE, rule.strategy());
            assertEquals("Estimate:Size:Scale", rule.toString());
        }

        @Test
        @DisplayName("Conversion defaults to CLOSEST")
        void testDefaultStrategy() {
            FieldMappingRule rule = FieldMappingRule.parse("Priority:Priority");
            assertNull(rule.strategy());
            assertEquals(MatchStrategy.CLOSEST, rule.effectiveStrategy());
        }

        @Test
        @DisplayName("Source names with spaces resolve")
        void testMultiWordSource() {
            assertEquals(CanonicalField.BLOCKING, FieldMappingRule.parse("Blocked By:Text").sourceField());
            assertEquals(CanonicalField.LINKED_PR, FieldMappingRule.parse("linked issues:Text").sourceField());
        }

        @Test
        @DisplayName("SRC alone maps to the same name, SRC: disables")
        void testShortForms() {
            assertEquals("Priority", FieldMappingRule.parse("Priority").destination());
            assertTrue(FieldMappingRule.parse("Priority:").isDisabled());
            assertEquals("Priority:", FieldMappingRule.parse("Priority:").toString());
        }

        @Test
        @DisplayName("Special destinations are recognized ignoring case")
        void testSpecialDestinations() {
            assertTrue(FieldMappingRule.parse("Epic:text").isText());
            assertTrue(FieldMappingRule.parse("Position:POSITION").isPosition());
            assertTrue(FieldMappingRule.parse("Linked Issues:Linked pull requests").isLinkedPullRequests());
        }

        @Test
        @DisplayName("Unknown source fields and conversions are rejected")
        void testInvalid() {
            assertThrows(IllegalArgumentException.class, () -> FieldMappingRule.parse("Colour:Status"));
            assertThrows(IllegalArgumentException.class, () -> FieldMappingRule.parse("Priority:Priority:Fuzzy"));
            assertThrows(IllegalArgumentException.class, () -> FieldMappingRule.parse(" "));
        }
    }

    @Nested
    @DisplayName("overlay")
    class OverlayTests {

        @Test
        @DisplayName("Defaults cover every source field but Workspace")
        void testDefaults() {
            List<FieldMappingRule> defaults = FieldMappingRules.defaults();
            assertEquals(8, defaults.size());
            assertEquals(FieldMappingRule.of(CanonicalField.PIPELINE, "Status"), defaults.get(2));
        }

        @Test
        @DisplayName("A user rule replaces every default rule for its source field")
        void testReplace() {
            List<FieldMappingRule> rules = FieldMappingRules.overlay(FieldMappingRules.defaults(),
                    FieldMappingRules.parseAll(List.of("Pipeline:Column:Exact")));

            assertFalse(rules.contains(FieldMappingRule.of(CanonicalField.PIPELINE, "Status")));
            assertTrue(rules.contains(FieldMappingRule.of(CanonicalField.PIPELINE, "Column", MatchStrategy.EXACT)));
            assertEquals(8, rules.size());
        }

        @Test
        @DisplayName("Several user rules for one field fan out")
        void testFanOut() {
            List<FieldMappingRule> rules = FieldMappingRules.overlay(FieldMappingRules.defaults(),
                    FieldMappingRules.parseAll(List.of("Priority:Priority", "Priority:Text")));

            assertEquals(2, rules.stream().filter(r -> r.sourceField() == CanonicalField.PRIORITY).count());
        }

        @Test
        @DisplayName("SRC: removes the field altogether")
        void testDisable() {
            List<FieldMappingRule> rules = FieldMappingRules.overlay(FieldMappingRules.defaults(),
                    FieldMappingRules.parseAll(List.of("Estimate:")));

            assertTrue(rules.stream().noneMatch(r -> r.sourceField() == CanonicalField.ESTIMATE));
            assertEquals(7, rules.size());
        }
    }
}
