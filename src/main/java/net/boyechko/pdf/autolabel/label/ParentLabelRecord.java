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

import net.boyechko.pdf.autolabel.document.ElementKind;
import net.boyechko.pdf.autolabel.template.ParentIndicator;

/** A label that enclosed elements can insert through a parent indicator. */
public record ParentLabelRecord(LabelAssignment assignment) {

    public ElementKind kind() {
        return assignment.kind();
    }

    public int headingLevel() {
        return assignment.element().headingLevel();
    }

    public String bareText() {
        return assignment.bareText();
    }

    public boolean matches(ParentIndicator indicator) {
        return indicator.accepts(kind(), headingLevel());
    }
}
