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
package net.boyechko.pdf.autolabel.pdf;

import com.itextpdf.io.font.PdfEncodings;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.document.ElementKind;
import net.boyechko.pdf.autolabel.label.Allocation;
import net.boyechko.pdf.autolabel.label.LabelAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes computed labels back into the structure tree: a list item's label becomes the
 * {@code /ActualText} of its {@code Lbl} child, or its {@code /T} when it has none; headings,
 * figures and tables get the label as {@code /T}. Link text rewritten by cross references
 * replaces the link's {@code /ActualText}.
 */
public final class StructTreeLabelWriter {
    private static final Logger logger = LoggerFactory.getLogger(StructTreeLabelWriter.class);

    private StructTreeLabelWriter() {}

    /** Returns the number of structure elements written. */
    public static int write(Allocation allocation, StructTreeImporter.ImportedTree tree) {
        int written = 0;
        for (LabelAssignment assignment : allocation.assignments()) {
            if (!assignment.isLabelled()) {
                continue;
            }
            PdfStructElem elem = tree.elementFor(assignment.element());
            if (elem == null) {
                continue;
            }
            String label = assignment.displayText().strip();
            PdfString value = new PdfString(label, PdfEncodings.UNICODE_BIG);

            if (assignment.kind() == ElementKind.LIST_ITEM) {
                PdfStructElem lbl = StructureTree.findFirstChild(elem, PdfName.Lbl);
                if (lbl != null) {
                    lbl.getPdfObject().put(PdfName.ActualText, value);
                    logger.debug(
                            "Set ActualText \"{}\" on Lbl of obj #{}",
                            label,
                            StructureTree.objNumber(elem));
                    written++;
                    continue;
                }
            }
            elem.getPdfObject().put(PdfName.T, value);
            logger.debug("Set title \"{}\" on obj #{}", label, StructureTree.objNumber(elem));
            written++;
        }
        for (DocNode link : allocation.links()) {
            if (writeLinkText(link, tree.elementFor(link))) {
                written++;
            }
        }
        return written;
    }

    /** Replaces a link's {@code /ActualText} when cross references changed it. */
    private static boolean writeLinkText(DocNode link, PdfStructElem elem) {
        if (elem == null || link.text() == null) {
            return false;
        }
        PdfString current = elem.getPdfObject().getAsString(PdfName.ActualText);
        if (current != null && current.toUnicodeString().equals(link.text())) {
            return false;
        }
        elem.getPdfObject()
                .put(PdfName.ActualText, new PdfString(link.text(), PdfEncodings.UNICODE_BIG));
        logger.debug(
                "Set link text \"{}\" on obj #{}", link.text(), StructureTree.objNumber(elem));
        return true;
    }
}
