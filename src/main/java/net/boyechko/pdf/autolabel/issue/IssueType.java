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
package net.boyechko.pdf.autolabel.issue;

/** Represents the type of a condition met while labelling a document. */
public enum IssueType {
    // Template issues
    TEMPLATE_SYNTAX("label templates that could not be parsed"),

    // Allocation issues
    UNCOVERED_DEPTH("elements nested deeper than their label template reaches"),
    MISSING_PARENT_LABEL("labels whose enclosing label was not found"),
    DUPLICATE_ID("element ids used more than once"),

    // Reference issues
    UNRESOLVED_REFERENCE("cross references that could not be resolved"),

    // Rendering issues
    RENDER_MODE_UNSUPPORTED("kinds that cannot be rendered with the requested mode"),

    // Document issues
    NO_STRUCT_TREE("structure tree missing");

    private final String groupLabel;

    IssueType(String groupLabel) {
        this.groupLabel = groupLabel;
    }

    public String groupLabel() {
        return groupLabel;
    }
}
