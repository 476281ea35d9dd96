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

import java.util.List;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.template.ParentIndicator;

/**
 * What an element id refers to for cross references.
 *
 * @param id the element id
 * @param node the element carrying the id
 * @param assignment the nearest labelled ancestor-or-self, or null
 * @param scope the labels enclosing the element, outermost first
 */
public record IdTarget(
        String id, DocNode node, LabelAssignment assignment, List<ParentLabelRecord> scope) {

    public IdTarget {
        scope = List.copyOf(scope);
    }

    /** The nearest enclosing label of the given kind, or null. */
    public ParentLabelRecord nearest(ParentIndicator indicator) {
        for (int i = scope.size() - 1; i >= 0; i--) {
            if (scope.get(i).matches(indicator)) {
                return scope.get(i);
            }
        }
        return null;
    }
}
