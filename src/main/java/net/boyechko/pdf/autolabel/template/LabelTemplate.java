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

import java.util.List;

/**
 * A parsed label template: one component per nesting depth, the last optionally repeating for
 * all deeper levels.
 *
 * @param source the text the template was parsed from
 * @param parts components in depth order
 * @param repeatIndefinitely whether the last component also covers every deeper level
 */
public record LabelTemplate(
        String source, List<TemplateComponent> parts, boolean repeatIndefinitely) {

    public LabelTemplate {
        parts = List.copyOf(parts);
        if (repeatIndefinitely && parts.isEmpty()) {
            throw new IllegalArgumentException("A repeating template needs a component");
        }
    }

    /** The template that produces no label at all. */
    public static LabelTemplate empty() {
        return new LabelTemplate("", List.of(), false);
    }

    public boolean isEmpty() {
        return parts.isEmpty();
    }

    /** Returns the component for a zero-based depth, or null if the template does not reach it. */
    public TemplateComponent componentAt(int depth) {
        if (depth < 0) {
            throw new IllegalArgumentException("Negative depth " + depth);
        }
        if (depth < parts.size()) {
            return parts.get(depth);
        }
        return repeatIndefinitely ? parts.get(parts.size() - 1) : null;
    }

    @Override
    public String toString() {
        return "LabelTemplate[\"" + source + "\"]";
    }
}
