package com.tracker.sync.relation;

import com.tracker.sync.core.model.IssueKey;
import com.tracker.sync.core.model.Relation;
import com.tracker.sync.core.model.RelationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns the relations of one issue into a checklist block and pull request link directives.
 *
 * <p>The block is regenerated from scratch on every call, so identical input always
 * produces byte-identical text. Layout:</p>
 * <pre>
 * # Dependencies
 *
 * ## Epic
 * - [ ] #12
 * - [ ] other-org/lib#3
 * </pre>
 */
public class RelationEncoder {
    private static final Logger log = LoggerFactory.getLogger(RelationEncoder.class);

    public static final String ANCHOR_TITLE = "Dependencies";
    public static final String ANCHOR_HEADING = "# " + ANCHOR_TITLE;

    private final String targetOrganization;

    /**
     * @param targetOrganization owner login of the target project; directives are only emitted
     *                           for issues of this organization
     */
    public RelationEncoder(String targetOrganization) {
        this.targetOrganization = targetOrganization != null
                ? targetOrganization.toLowerCase(Locale.ROOT) : null;
    }

    /**
     * Encodes with every kind rendered as text, except linked pull requests which become directives.
     */
    public EncodedRelations encode(IssueKey issueKey, Collection<Relation> relations) {
        return encode(issueKey, relations,
                EnumSet.of(RelationKind.EPIC_OF, RelationKind.BLOCKS),
                EnumSet.of(RelationKind.LINKED_PR),
                List.of());
    }

    /**
     * Encodes the relations whose subject is {@code issueKey}.
     *
     * @param textKinds      kinds rendered as checklist sections
     * @param directiveKinds kinds turned into pull request directives (only LINKED_PR applies)
     * @param extraSections  scalar sections appended after the relation sections
     */
    public EncodedRelations encode(IssueKey issueKey, Collection<Relation> relations,
                                   Set<RelationKind> textKinds, Set<RelationKind> directiveKinds,
                                   List<TextSection> extraSections) {
        Map<RelationKind, Set<IssueKey>> byKind = new EnumMap<>(RelationKind.class);
        for (Relation relation : relations) {
            if (relation.subject().equals(issueKey)) {
                byKind.computeIfAbsent(relation.kind(), k -> new TreeSet<>()).add(relation.referenced());
            }
        }

        List<TextSection> sections = new ArrayList<>();
        for (RelationKind kind : RelationKind.values()) {
            Set<IssueKey> refs = byKind.get(kind);
            if (refs == null || refs.isEmpty() || !textKinds.contains(kind)) {
                continue;
            }
            String prefix = kind == RelationKind.LINKED_PR ? "fixes " : "";
            List<String> lines = new ArrayList<>();
            for (IssueKey ref : refs) {
                lines.add("- [ ] " + prefix + ref.shortReference(issueKey));
            }
            sections.add(new TextSection(kind.getHeading(), lines));
        }
        for (TextSection extra : extraSections) {
            if (!extra.lines().isEmpty()) {
                sections.add(extra);
            }
        }

        List<String> directives = new ArrayList<>();
        Set<IssueKey> fixed = byKind.get(RelationKind.LINKED_PR);
        if (fixed != null && directiveKinds.contains(RelationKind.LINKED_PR)) {
            for (IssueKey issue : fixed) {
                if (targetOrganization != null && !targetOrganization.equals(issue.owner())) {
                    log.debug("relation.directive.skipped pr={} issue={} reason=other-organization",
                            issueKey, issue);
                    continue;
                }
                directives.add("fixes " + issue);
            }
        }

        return new EncodedRelations(render(sections), directives);
    }

    /**
     * Renders sections under the anchor heading, or an empty string when there are none.
     */
    static String render(List<TextSection> sections) {
        if (sections.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder(ANCHOR_HEADING).append('\n');
        for (TextSection section : sections) {
            sb.append('\n').append("## ").append(section.title()).append('\n');
            for (String line : section.lines()) {
                sb.append(line).append('\n');
            }
        }
        return sb.toString();
    }
}
