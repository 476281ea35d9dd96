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

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.action.PdfAction;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import com.itextpdf.layout.element.ListItem;
import com.itextpdf.layout.element.Paragraph;
import com.itextpdf.layout.properties.ListNumberingType;
import java.nio.file.Path;
import java.util.List;
import net.boyechko.pdf.autolabel.PdfTestBase;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.document.ElementKind;
import net.boyechko.pdf.autolabel.document.LabelDirectives;
import net.boyechko.pdf.autolabel.pdf.StructTreeImporter.ImportedTree;
import org.junit.jupiter.api.Test;

class StructTreeImporterTest extends PdfTestBase {

    @Test
    void importsLabelableRoles() throws Exception {
        Path pdf =
                createTaggedPdf(
                        (pdfDoc, document) -> {
                            addElem(document, "H1");
                            addElem(document, "P");
                            addElem(document, "H3");
                            PdfStructElem list = addElem(document, "L");
                            setListNumbering(list, "Decimal");
                            addListItem(list);
                            addListItem(list);
                            setId(addElem(document, "Figure"), "fig-1");
                            addElem(document, "Table");
                        });

        try (PdfDocument pdfDoc = open(pdf)) {
            ImportedTree tree = StructTreeImporter.importTree(pdfDoc.getStructTreeRoot());

            DocNode document = tree.root().children().get(0);
            assertEquals("Document", document.tag());
            List<DocNode> kids = document.children();
            assertEquals(ElementKind.HEADING, kids.get(0).kind());
            assertEquals(1, kids.get(0).headingLevel());
            assertEquals(ElementKind.OTHER, kids.get(1).kind());
            assertEquals(3, kids.get(2).headingLevel());
            assertEquals(ElementKind.ORDERED_LIST, kids.get(3).kind());
            assertEquals(2, kids.get(3).children().size());
            assertEquals(ElementKind.LIST_ITEM, kids.get(3).children().get(0).kind());
            assertEquals(ElementKind.FIGURE, kids.get(4).kind());
            assertEquals("fig-1", kids.get(4).id());
            assertEquals(ElementKind.TABLE, kids.get(5).kind());

            PdfStructElem figure = tree.elementFor(kids.get(4));
            assertEquals(PdfName.Figure, figure.getRole());
            assertNull(tree.elementFor(DocNode.figure()));
        }
    }

    @Test
    void listsWithoutNumberingAreUnordered() throws Exception {
        Path pdf =
                createTaggedPdf(
                        (pdfDoc, document) -> {
                            addListItem(addElem(document, "L"));
                            PdfStructElem bulleted = addElem(document, "L");
                            setListNumbering(bulleted, "Disc");
                            addListItem(bulleted);
                            PdfStructElem roman = addElem(document, "L");
                            setListNumbering(roman, "UpperRoman");
                        });

        try (PdfDocument pdfDoc = open(pdf)) {
            List<DocNode> kids =
                    StructTreeImporter.importTree(pdfDoc.getStructTreeRoot())
                            .root()
                            .children()
                            .get(0)
                            .children();

            assertEquals(ElementKind.UNORDERED_LIST, kids.get(0).kind());
            assertEquals(ElementKind.UNORDERED_LIST, kids.get(1).kind());
            assertEquals(ElementKind.ORDERED_LIST, kids.get(2).kind());
        }
    }

    @Test
    void customRolesFollowTheRoleMap() throws Exception {
        Path pdf =
                createTaggedPdf(
                        (pdfDoc, document) -> {
                            pdfDoc.getStructTreeRoot().addRoleMapping("Chapter", "H1");
                            addElem(document, "Chapter");
                        });

        try (PdfDocument pdfDoc = open(pdf)) {
            DocNode chapter =
                    StructTreeImporter.importTree(pdfDoc.getStructTreeRoot())
                            .root()
                            .children()
                            .get(0)
                            .children()
                            .get(0);

            assertEquals(ElementKind.HEADING, chapter.kind());
            assertEquals(1, chapter.headingLevel());
        }
    }

    @Test
    void readsDirectivesFromUserProperties() throws Exception {
        Path pdf =
                createTaggedPdf(
                        (pdfDoc, document) -> {
                            setUserProperty(
                                    addElem(document, "H1"), "label", new PdfString("'Part '1"));
                            PdfStructElem list = addElem(document, "L");
                            setListNumbering(list, "Decimal");
                            setUserProperty(addListItem(list), "no-label", PdfBoolean.TRUE);
                            setUserProperty(
                                    addListItem(list), "no-label", new PdfBoolean(false));
                            addListItem(list);
                        });

        try (PdfDocument pdfDoc = open(pdf)) {
            List<DocNode> kids =
                    StructTreeImporter.importTree(pdfDoc.getStructTreeRoot())
                            .root()
                            .children()
                            .get(0)
                            .children();

            assertEquals(LabelDirectives.template("'Part '1"), kids.get(0).directives());
            DocNode list = kids.get(1);
            assertEquals(ElementKind.ORDERED_LIST, list.kind());
            assertTrue(list.children().get(0).directives().noLabel());
            assertFalse(list.children().get(1).directives().noLabel());
            assertSame(LabelDirectives.NONE, list.children().get(2).directives());
        }
    }

    @Test
    void importsLinksWithTargetAndText() throws Exception {
        Path pdf =
                createTaggedPdf(
                        (pdfDoc, document) -> {
                            addLink(document, "see ##", PdfAction.createGoTo("results"));
                            addLink(
                                    document,
                                    "project site",
                                    PdfAction.createURI("https://example.org/"));
                            addElem(document, "Link");
                        });

        try (PdfDocument pdfDoc = open(pdf)) {
            List<DocNode> kids =
                    StructTreeImporter.importTree(pdfDoc.getStructTreeRoot())
                            .root()
                            .children()
                            .get(0)
                            .children();

            assertEquals(ElementKind.LINK, kids.get(0).kind());
            assertEquals("#results", kids.get(0).href());
            assertEquals("see ##", kids.get(0).text());
            assertEquals("https://example.org/", kids.get(1).href());
            assertEquals("project site", kids.get(1).text());
            assertEquals(ElementKind.LINK, kids.get(2).kind());
            assertNull(kids.get(2).href());
            assertNull(kids.get(2).text());
        }
    }

    @Test
    void importsLayoutTaggedDocument() throws Exception {
        Path pdf =
                createLayoutPdf(
                        testOutputPath(),
                        (pdfDoc, document) -> {
                            Paragraph title = new Paragraph("Results");
                            title.getAccessibilityProperties().setRole("H1");
                            document.add(title);
                            com.itextpdf.layout.element.List list =
                                    new com.itextpdf.layout.element.List(
                                            ListNumberingType.DECIMAL);
                            list.add(new ListItem("First"));
                            list.add(new ListItem("Second"));
                            document.add(list);
                        });

        try (PdfDocument pdfDoc = open(pdf)) {
            ImportedTree tree = StructTreeImporter.importTree(pdfDoc.getStructTreeRoot());

            long headings = count(tree.root(), ElementKind.HEADING);
            long items = count(tree.root(), ElementKind.LIST_ITEM);
            assertEquals(1, headings);
            assertEquals(2, items);
        }
    }

    private static long count(DocNode node, ElementKind kind) {
        long n = node.kind() == kind ? 1 : 0;
        for (DocNode child : node.children()) {
            n += count(child, kind);
        }
        return n;
    }
}
