package com.tracker.sync.relation;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Locates the anchored checklist block inside an issue body and replaces it as a unit.
 *
 * <p>The block starts at the {@value RelationEncoder#ANCHOR_HEADING} line and runs up to the
 * next top-level ({@code # }) heading or the end of the body. Everything else is kept byte for
 * byte, including the body's line separator.</p>
 */
public final class BodyBlocks {

    private BodyBlocks() {
    }

    /**
     * Returns {@code body} with its block replaced by {@code block}. An empty block removes
     * an existing one. Applying the same block twice gives the same result as applying it once.
     */
    public static String replace(String body, String block) {
        String text = body != null ? body : "";
        String newBlock = block != null ? block : "";
        String separator = text.contains("\r\n") ? "\r\n" : "\n";
        if (!newBlock.isEmpty() && !separator.equals("\n")) {
            newBlock = newBlock.replace("\n", separator);
        }

        int start = findAnchor(text);
        if (start < 0) {
            if (newBlock.isEmpty()) {
                return text;
            }
            return text + glue(text, separator) + newBlock;
        }
        int end = findNextHeading(text, start);
        return text.substring(0, start) + newBlock + text.substring(end);
    }

    /**
     * Returns the current block of {@code body}, or an empty string.
     */
    public static String extract(String body) {
        if (body == null) {
            return "";
        }
        int start = findAnchor(body);
        if (start < 0) {
            return "";
        }
        return body.substring(start, findNextHeading(body, start));
    }

    /**
     * Adds each line of {@code lines} that the body does not already contain (compared trimmed,
     * ignoring case). New lines go just above the block when there is one, so regenerating the
     * block leaves them alone; otherwise they are appended.
     */
    public static String insertMissingLines(String body, List<String> lines) {
        String text = body != null ? body : "";
        String separator = text.contains("\r\n") ? "\r\n" : "\n";
        Set<String> present = new HashSet<>();
        for (String line : text.split("\\r?\\n", -1)) {
            present.add(line.trim().toLowerCase(Locale.ROOT));
        }
        StringBuilder missing = new StringBuilder();
        for (String line : lines) {
            if (present.add(line.trim().toLowerCase(Locale.ROOT))) {
                missing.append(line).append(separator);
            }
        }
        if (missing.length() == 0) {
            return text;
        }
        int anchor = findAnchor(text);
        if (anchor >= 0) {
            return text.substring(0, anchor) + missing + separator + text.substring(anchor);
        }
        String glue = text.isEmpty() || text.endsWith(separator) ? "" : separator;
        return text + glue + missing;
    }

    private static String glue(String text, String separator) {
        if (text.isEmpty() || text.endsWith(separator + separator)) {
            return "";
        }
        return text.endsWith(separator) ? separator : separator + separator;
    }

    private static int findAnchor(String text) {
        int lineStart = 0;
        while (lineStart <= text.length()) {
            int lineEnd = lineEnd(text, lineStart);
            if (stripCr(text.substring(lineStart, lineEnd)).equals(RelationEncoder.ANCHOR_HEADING)) {
                return lineStart;
            }
            if (lineEnd >= text.length()) {
                return -1;
            }
            lineStart = lineEnd + 1;
        }
        return -1;
    }

    private static int findNextHeading(String text, int anchorStart) {
        int lineStart = lineEnd(text, anchorStart) + 1;
        while (lineStart < text.length()) {
            if (text.startsWith("# ", lineStart)) {
                return lineStart;
            }
            int lineEnd = lineEnd(text, lineStart);
            if (lineEnd >= text.length()) {
                break;
            }
            lineStart = lineEnd + 1;
        }
        return text.length();
    }

    private static int lineEnd(String text, int from) {
        int nl = text.indexOf('\n', from);
        return nl < 0 ? text.length() : nl;
    }

    private static String stripCr(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
