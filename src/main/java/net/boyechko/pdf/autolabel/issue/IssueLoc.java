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

import net.boyechko.pdf.autolabel.document.DocNode;

/** Where a labelling issue was found. */
public sealed interface IssueLoc {
    record None() implements IssueLoc {}

    record AtNode(String path, String id) implements IssueLoc {}

    record InTemplate(String source, int index) implements IssueLoc {}

    static IssueLoc none() {
        return new None();
    }

    static IssueLoc atNode(DocNode node) {
        if (node == null) {
            return none();
        }
        return new AtNode(node.path(), node.id());
    }

    static IssueLoc inTemplate(String source, int index) {
        return new InTemplate(source, index);
    }

    /** A short suffix for messages, empty when there is no location. */
    default String describe() {
        if (this instanceof AtNode at) {
            return at.id() != null ? " at " + at.path() + " (#" + at.id() + ")" : " at " + at.path();
        } else if (this instanceof InTemplate in) {
            return " in \"" + in.source() + "\" at index " + in.index();
        }
        return "";
    }
}
