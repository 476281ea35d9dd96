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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.issue.IssueList;

/** The outcome of one labelling pass over an element tree. */
public final class Allocation {
    private final DocNode root;
    private final List<LabelAssignment> assignments;
    private final ElementIdIndex idIndex;
    private final List<DocNode> links;
    private final IssueList issues;
    private final Map<DocNode, LabelAssignment> byNode = new IdentityHashMap<>();

    Allocation(
            DocNode root,
            List<LabelAssignment> assignments,
            ElementIdIndex idIndex,
            List<DocNode> links,
            IssueList issues) {
        this.root = root;
        this.assignments = List.copyOf(assignments);
        this.idIndex = idIndex;
        this.links = List.copyOf(links);
        this.issues = issues;
        for (LabelAssignment assignment : assignments) {
            byNode.put(assignment.element(), assignment);
        }
    }

    public DocNode root() {
        return root;
    }

    /** One assignment per labelable element, in document order. */
    public List<LabelAssignment> assignments() {
        return assignments;
    }

    /** Returns the assignment for an element, or null if the element is not labelable. */
    public LabelAssignment assignmentFor(DocNode node) {
        return byNode.get(node);
    }

    /** Display text for an element, empty if it has none. */
    public String labelOf(DocNode node) {
        LabelAssignment assignment = byNode.get(node);
        return assignment != null ? assignment.displayText() : "";
    }

    public ElementIdIndex idIndex() {
        return idIndex;
    }

    /** Link elements in document order. */
    public List<DocNode> links() {
        return links;
    }

    /** Issues collected so far; later passes append to the same list. */
    public IssueList issues() {
        return issues;
    }

    public Map<DocNode, LabelAssignment> asMap() {
        return Collections.unmodifiableMap(byNode);
    }
}
