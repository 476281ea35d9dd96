/*
 * PDF-Auto-Label - Automated label numbering for tagged documents
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.autolabel.label;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.issue.Issue;
import net.boyechko.pdf.autolabel.issue.IssueList;
import net.boyechko.pdf.autolabel.issue.IssueLoc;
import net.boyechko.pdf.autolabel.issue.IssueSev;
import net.boyechko.pdf.autolabel.issue.IssueType;
import net.boyechko.pdf.autolabel.template.ParentIndicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces {@code ##} placeholders in link text with labels of the link target.
 *
 * <p>{@code ##} alone inserts the target's full label. A qualifier ({@code ##H}, {@code ##h2},
 * {@code ##L}, {@code ##X}, or braced as {@code ##{H2}}) inserts the bare label of the nearest
 * enclosing heading, list item or any label around the target, including the target itself.
 * {@code \##} stands for a literal {@code ##}. A placeholder that cannot be resolved is removed
 * and reported.
 */
public class CrossReferenceResolver {
    private static final Logger logger = LoggerFactory.getLogger(CrossReferenceResolver.class);

    private static final Pattern PLACEHOLDER =
            Pattern.compile(
                    "(\\\\)?##(?:\\{([XxLlHh][1-6]?)\\}|([XxLl]|[Hh][1-6]?)(?![A-Za-z0-9]))?");

    /** Rewrites the text of every link in the allocation. Returns the number of links changed. */
    public int resolve(Allocation allocation) {
        int changed = 0;
        for (DocNode link : allocation.links()) {
            String text = link.text();
            if (text == null || !text.contains("##")) {
                continue;
            }
            String resolved = resolveText(text, link, allocation.idIndex(), allocation.issues());
            if (!resolved.equals(text)) {
                link.setText(resolved);
                changed++;
            }
        }
        logger.debug("Resolved cross references in {} link(s)", changed);
        return changed;
    }

    /** Resolves the placeholders in one link's text, left to right. */
    String resolveText(String text, DocNode link, ElementIdIndex index, IssueList issues) {
        String targetId = targetId(link.href());
        IdTarget target = index.lookup(targetId);

        Matcher m = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String replacement;
            if (m.group(1) != null) {
                replacement = m.group().substring(1);
            } else {
                String qualifier = m.group(2) != null ? m.group(2) : m.group(3);
                replacement = labelFor(target, qualifier);
                if (replacement == null) {
                    logger.warn(
                            "Cannot resolve \"{}\" in link {} to \"{}\"",
                            m.group(),
                            link.path(),
                            link.href());
                    issues.add(
                            new Issue(
                                    IssueType.UNRESOLVED_REFERENCE,
                                    IssueSev.WARNING,
                                    IssueLoc.atNode(link),
                                    "Cannot resolve \""
                                            + m.group()
                                            + "\" for target \""
                                            + targetId
                                            + "\""));
                    replacement = "";
                }
            }
            m.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        m.appendTail(out);
        return out.toString();
    }

    /** Returns the text to insert, or null if the reference cannot be resolved. */
    private static String labelFor(IdTarget target, String qualifier) {
        if (target == null) {
            return null;
        }
        if (qualifier == null) {
            LabelAssignment assignment = target.assignment();
            return assignment != null && assignment.isLabelled()
                    ? assignment.displayText()
                    : null;
        }
        ParentLabelRecord record = target.nearest(ParentIndicator.fromToken(qualifier));
        return record != null ? record.bareText() : null;
    }

    private static String targetId(String href) {
        if (href == null || href.isEmpty()) {
            return null;
        }
        return href.startsWith("#") ? href.substring(1) : href;
    }
}
