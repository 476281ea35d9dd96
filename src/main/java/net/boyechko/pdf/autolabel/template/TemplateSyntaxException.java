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

/** Thrown when a label template cannot be parsed. */
public class TemplateSyntaxException extends Exception {
    private final String source;
    private final int index;

    public TemplateSyntaxException(String message, String source, int index) {
        super(message + " at index " + index + " in label template \"" + source + "\"");
        this.source = source;
        this.index = index;
    }

    public TemplateSyntaxException(String message, String source, int index, Throwable cause) {
        this(message, source, index);
        initCause(cause);
    }

    public String source() {
        return source;
    }

    /** Zero-based position in the source where parsing failed. */
    public int index() {
        return index;
    }
}
