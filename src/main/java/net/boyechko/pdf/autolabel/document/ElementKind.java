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
package net.boyechko.pdf.autolabel.document;

/** The kinds of document element the labelling engine distinguishes. */
public enum ElementKind {
    HEADING("heading"),
    ORDERED_LIST("ordered list"),
    UNORDERED_LIST("unordered list"),
    LIST_ITEM("list item"),
    FIGURE("figure"),
    TABLE("table"),
    LINK("link"),
    OTHER("other");

    private final String displayName;

    ElementKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isList() {
        return this == ORDERED_LIST || this == UNORDERED_LIST;
    }

    /** Kinds that own a counter sequence: headings, lists, figures and tables. */
    public boolean isNumbered() {
        return this == HEADING || isList() || this == FIGURE || this == TABLE;
    }
}
