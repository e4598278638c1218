package com.tracker.sync.core.model;

import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonical identity of a logical issue: the repository it lives in and its number.
 * Owner and repository names are compared case-insensitively, as GitHub does.
 */
public record IssueKey(String owner, String repository, int number) implements Comparable<IssueKey> {

    private static final Pattern SHORT_REF = Pattern.compile("^([\\w.-]+)/([\\w.-]+)#(\\d+)$");
    private static final Pattern RELATIVE_REF = Pattern.compile("^#(\\d+)$");
    private static final Pattern URL_REF = Pattern.compile(
            "^https?://github\\.com/([\\w.-]+)/([\\w.-]+)/(?:issues?|pull)/(\\d+)(?:[/?#].*)?$");

    private static final Comparator<IssueKey> ORDER = Comparator
            .comparing(IssueKey::owner)
            .thenComparing(IssueKey::repository)
            .thenComparingInt(IssueKey::number);

    public IssueKey {
        Objects.requireNonNull(owner, "owner is required");
        Objects.requireNonNull(repository, "repository is required");
        if (owner.isBlank() || repository.isBlank()) {
            throw new IllegalArgumentException("owner and repository must not be blank");
        }
        if (number <= 0) {
            throw new IllegalArgumentException("Issue number must be positive, got " + number);
        }
        owner = owner.toLowerCase(Locale.ROOT);
        repository = repository.toLowerCase(Locale.ROOT);
    }

    public static IssueKey of(String owner, String repository, int number) {
        return new IssueKey(owner, repository, number);
    }

    /**
     * Parses {@code owner/repo#N} or a GitHub issue/pull request URL.
     */
    public static Optional<IssueKey> parse(String reference) {
        return parse(reference, null);
    }

    /**
     * Parses a reference, resolving {@code #N} against {@code base}'s repository when given.
     */
    public static Optional<IssueKey> parse(String reference, IssueKey base) {
        if (reference == null) {
            return Optional.empty();
        }
        String ref = reference.trim();
        Matcher m = SHORT_REF.matcher(ref);
        if (m.matches()) {
            return Optional.of(new IssueKey(m.group(1), m.group(2), Integer.parseInt(m.group(3))));
        }
        m = URL_REF.matcher(ref);
        if (m.matches()) {
            return Optional.of(new IssueKey(m.group(1), m.group(2), Integer.parseInt(m.group(3))));
        }
        m = RELATIVE_REF.matcher(ref);
        if (m.matches() && base != null) {
            return Optional.of(new IssueKey(base.owner(), base.repository(), Integer.parseInt(m.group(1))));
        }
        return Optional.empty();
    }

    public boolean sameRepository(IssueKey other) {
        return other != null && owner.equals(other.owner) && repository.equals(other.repository);
    }

    /**
     * {@code #N} when {@code context} lives in the same repository, {@code owner/repo#N} otherwise.
     */
    public String shortReference(IssueKey context) {
        return sameRepository(context) ? "#" + number : toString();
    }

    @Override
    public int compareTo(IssueKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return owner + "/" + repository + "#" + number;
    }
}
