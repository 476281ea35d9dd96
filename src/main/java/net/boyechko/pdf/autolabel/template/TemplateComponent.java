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

import net.boyechko.pdf.autolabel.counter.CounterStyle;

/**
 * The part of a label template that applies at one nesting depth.
 *
 * @param prefix literal text before the label
 * @param style counter style of the element's own number; null for a literal-only label
 * @param suffix literal text after the number
 * @param parent which enclosing label to insert before the number; null for none
 * @param parentSeparator literal text between the inserted enclosing label and the number
 */
public record TemplateComponent(
        String prefix,
        CounterStyle style,
        String suffix,
        ParentIndicator parent,
        String parentSeparator) {

    public TemplateComponent {
        prefix = prefix != null ? prefix : "";
        suffix = suffix != null ? suffix : "";
        parentSeparator = parentSeparator != null ? parentSeparator : "";
    }

    public static TemplateComponent literal(String text) {
        return new TemplateComponent(text, null, "", null, "");
    }

    public boolean hasCounter() {
        return style != null;
    }

    public boolean hasParent() {
        return parent != null;
    }

    /** A fixed label such as a bullet: no counter and no enclosing label. */
    public boolean isLiteralOnly() {
        return style == null && parent == null;
    }
}
