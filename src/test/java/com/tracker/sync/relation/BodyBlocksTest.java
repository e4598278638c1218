package com.tracker.sync.relation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BodyBlocksTest {

    private static final String BLOCK = "# Dependencies\n\n## Epic\n- [ ] #2\n";
    private static final String OTHER_BLOCK = "# Dependencies\n\n## Epic\n- [ ] #2\n- [ ] #3\n";

    @Nested
    @DisplayName("replace")
    class ReplaceTests {

        @Test
        @DisplayName("Should append the block after a blank line")
        void testAppend() {
            assertEquals("Intro\n\n" + BLOCK, BodyBlocks.replace("Intro", BLOCK));
            assertEquals("Intro\n\n" + BLOCK, BodyBlocks.replace("Intro\n", BLOCK));
            assertEquals("Intro\n\n" + BLOCK, BodyBlocks.replace("Intro\n\n", BLOCK));
            assertEquals(BLOCK, BodyBlocks.replace(null, BLOCK));
        }

        @Test
        @DisplayName("Applying the same block twice changes nothing")
        void testIdempotent() {
            String once = BodyBlocks.replace("Intro", BLOCK);
            assertEquals(once, BodyBlocks.replace(once, BLOCK));
        }

        @Test
        @DisplayName("Should keep text before and after the block byte for byte")
        void testPreservesSurroundingText() {
            String body = "Intro  \n\n" + BLOCK + "# Notes\nkeep *me*\n";
            String updated = BodyBlocks.replace(body, OTHER_BLOCK);

            assertEquals("Intro  \n\n" + OTHER_BLOCK + "# Notes\nkeep *me*\n", updated);
        }

        @Test
        @DisplayName("Empty block removes an existing one")
        void testRemove() {
            assertEquals("Intro\n\n", BodyBlocks.replace("Intro\n\n" + BLOCK, ""));
            assertEquals("Intro", BodyBlocks.replace("Intro", ""));
        }

        @Test
        @DisplayName("Should follow CRLF bodies")
        void testCrLf() {
            String once = BodyBlocks.replace("Intro\r\n", BLOCK);
            assertEquals("Intro\r\n\r\n# Dependencies\r\n\r\n## Epic\r\n- [ ] #2\r\n", once);
            assertEquals(once, BodyBlocks.replace(once, BLOCK));
        }

        @Test
        @DisplayName("A heading that merely contains the anchor text is not the anchor")
        void testAnchorMustBeWholeLine() {
            String body = "# Dependencies of the release\ntext\n";
            assertEquals(body + "\n" + BLOCK, BodyBlocks.replace(body, BLOCK));
        }
    }

    @Test
    @DisplayName("extract returns the current block")
    void testExtract() {
        assertEquals(BLOCK, BodyBlocks.extract("Intro\n\n" + BLOCK + "# Notes\n"));
        assertEquals("", BodyBlocks.extract("Intro"));
        assertEquals("", BodyBlocks.extract(null));
    }

    @Nested
    @DisplayName("insertMissingLines")
    class InsertTests {

        @Test
        @DisplayName("Should append missing lines to a body without a block")
        void testAppend() {
            assertEquals("Some text\nfixes acme/web#4\n",
                    BodyBlocks.insertMissingLines("Some text", List.of("fixes acme/web#4")));
            assertEquals("fixes acme/web#4\n", BodyBlocks.insertMissingLines("", List.of("fixes acme/web#4")));
        }

        @Test
        @DisplayName("Lines already present (ignoring case) are not repeated")
        void testIdempotent() {
            String once = BodyBlocks.insertMissingLines("Some text", List.of("fixes acme/web#4"));
            assertSame(once, BodyBlocks.insertMissingLines(once, List.of("fixes acme/web#4")));
            assertEquals("Fixes ACME/web#4", BodyBlocks.insertMissingLines("Fixes ACME/web#4",
                    List.of("fixes acme/web#4")));
        }

        @Test
        @DisplayName("New lines go above the block and survive its regeneration")
        void testAboveBlock() {
            String body = "Intro\n\n" + BLOCK;
            String linked = BodyBlocks.insertMissingLines(body, List.of("fixes acme/web#4"));

            assertEquals("Intro\n\nfixes acme/web#4\n\n" + BLOCK, linked);
            assertEquals("Intro\n\nfixes acme/web#4\n\n" + OTHER_BLOCK, BodyBlocks.replace(linked, OTHER_BLOCK));
        }
    }
}
