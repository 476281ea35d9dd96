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

import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.document.ElementKind;
import net.boyechko.pdf.autolabel.template.LabelTemplate;
import net.boyechko.pdf.autolabel.template.TemplateComponent;

/**
 * The label decided for one element.
 *
 * @param element the labelled element
 * @param kind the element's kind
 * @param container the list an item belongs to; null for other kinds
 * @param depth nesting depth the template component was chosen for
 * @param displayText the full label, empty for no label
 * @param bareText the label without the component's own prefix and suffix, used by descendants
 * @param template the effective template, or null if none applied
 * @param component the component used, or null if none applied
 * @param counterValue the counter value rendered, or 0 if no counter was advanced
 * @param parentRecord the enclosing label inserted into this one, or null
 * @param suppressed whether the element asked not to be labelled
 */
public record LabelAssignment(
        DocNode element,
        ElementKind kind,
        DocNode container,
        int depth,
        String displayText,
        String bareText,
        LabelTemplate template,
        TemplateComponent component,
        int counterValue,
        ParentLabelRecord parentRecord,
        boolean suppressed) {

    static LabelAssignment unlabelled(
            DocNode element, DocNode container, int depth, LabelTemplate template) {
        return new LabelAssignment(
                element,
                element.kind(),
                container,
                depth,
                "",
                "",
                template,
                null,
                0,
                null,
                false);
    }

    static LabelAssignment suppressed(
            DocNode element, DocNode container, int depth, LabelTemplate template) {
        return new LabelAssignment(
                element,
                element.kind(),
                container,
                depth,
                "",
                "",
                template,
                null,
                0,
                null,
                true);
    }

    public boolean isLabelled() {
        return !displayText.isEmpty();
    }

    /** The kind that decides how this label is configured and rendered. */
    public ElementKind seriesKind() {
        return container != null ? container.kind() : kind;
    }

    @Override
    public String toString() {
        return "LabelAssignment[" + element.path() + " \"" + displayText + "\"]";
    }
}
