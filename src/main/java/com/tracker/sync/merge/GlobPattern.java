package com.tracker.sync.merge;

import java.util.regex.Pattern;

/**
 * Shell-style wildcard matching: {@code *}, {@code ?}, {@code [abc]} and {@code [!abc]}.
 * Matching is case-sensitive and covers the whole value.
 */
public final class GlobPattern {

    private final String glob;
    private final Pattern regex;

    private GlobPattern(String glob) {
        this.glob = glob;
        this.regex = Pattern.compile(translate(glob), Pattern.DOTALL);
    }

    public static GlobPattern compile(String glob) {
        if (glob == null) {
            throw new IllegalArgumentException("glob must not be null");
        }
        return new GlobPattern(glob);
    }

    public boolean matches(String value) {
        return value != null && regex.matcher(value).matches();
    }

    public String glob() {
        return glob;
    }

    static String translate(String glob) {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            if (c == '*') {
                sb.append(".*");
            } else if (c == '?') {
                sb.append('.');
            } else if (c == '[') {
                int j = i;
                if (j < n && glob.charAt(j) == '!') {
                    j++;
                }
                if (j < n && glob.charAt(j) == ']') {
                    j++;
                }
                while (j < n && glob.charAt(j) != ']') {
                    j++;
                }
                if (j >= n) {
                    sb.append("\\[");
                } else {
                    appendSet(sb, glob.substring(i, j));
                    i = j + 1;
                }
            } else {
                sb.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return sb.toString();
    }

    /**
     * Appends a character class for the body of a {@code [...]} set. Only ranges and a leading
     * {@code !} keep a meaning; every other class metacharacter is taken literally.
     */
    private static void appendSet(StringBuilder sb, String set) {
        sb.append('[');
        int k = 0;
        if (set.startsWith("!")) {
            sb.append('^');
            k = 1;
        }
        for (; k < set.length(); k++) {
            char ch = set.charAt(k);
            if (ch == '\\' || ch == '[' || ch == ']' || ch == '&' || ch == '^') {
                sb.append('\\');
            }
            sb.append(ch);
        }
        sb.append(']');
    }

    @Override
    public String toString() {
        return glob;
    }
}
