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
package net.boyechko.pdf.autolabel.template;

import net.boyechko.pdf.autolabel.document.ElementKind;

/**
 * Names the kind of enclosing label a template component inserts before its own counter: {@code
 * X} for any labelled ancestor, {@code L} for a list item, {@code H} for a heading and {@code
 * H1}..{@code H6} for a heading at that level.
 */
public sealed interface ParentIndicator
        permits ParentIndicator.AnyLabel,
                ParentIndicator.ListLabel,
                ParentIndicator.HeadingLabel,
                ParentIndicator.HeadingLabelAtLevel {

    /** The token as written in a template. */
    String token();

    /** Whether a label owned by an element of this kind (and heading level) qualifies. */
    boolean accepts(ElementKind kind, int headingLevel);

    record AnyLabel() implements ParentIndicator {
        @Override
        public String token() {
            return "X";
        }

        @Override
        public boolean accepts(ElementKind kind, int headingLevel) {
            return true;
        }
    }

    record ListLabel() implements ParentIndicator {
        @Override
        public String token() {
            return "L";
        }

        @Override
        public boolean accepts(ElementKind kind, int headingLevel) {
            return kind == ElementKind.LIST_ITEM;
        }
    }

    record HeadingLabel() implements ParentIndicator {
        @Override
        public String token() {
            return "H";
        }

        @Override
        public boolean accepts(ElementKind kind, int headingLevel) {
            return kind == ElementKind.HEADING;
        }
    }

    record HeadingLabelAtLevel(int level) implements ParentIndicator {
        public HeadingLabelAtLevel {
            if (level < 1 || level > 6) {
                throw new IllegalArgumentException("Heading level must be 1..6, got " + level);
            }
        }

        @Override
        public String token() {
            return "H" + level;
        }

        @Override
        public boolean accepts(ElementKind kind, int headingLevel) {
            return kind == ElementKind.HEADING && headingLevel == level;
        }
    }

    /**
     * Returns the indicator for a token ({@code X}, {@code L}, {@code H}, {@code H1}..{@code H6},
     * case-insensitive), or null if the token is not an indicator.
     */
    static ParentIndicator fromToken(String token) {
        if (token == null) {
            return null;
        }
        String t = token.toUpperCase();
        if (t.equals("X")) {
            return new AnyLabel();
        } else if (t.equals("L")) {
            return new ListLabel();
        } else if (t.equals("H")) {
            return new HeadingLabel();
        } else if (t.length() == 2 && t.charAt(0) == 'H' && t.charAt(1) >= '1' && t.charAt(1) <= '6') {
            return new HeadingLabelAtLevel(t.charAt(1) - '0');
        }
        return null;
    }
}
