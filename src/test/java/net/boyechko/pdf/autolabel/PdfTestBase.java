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
package net.boyechko.pdf.autolabel;

import com.itextpdf.kernel.geom.Rectangle;
import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.action.PdfAction;
import com.itextpdf.kernel.pdf.annot.PdfLinkAnnotation;
import com.itextpdf.kernel.pdf.tagging.IStructureNode;
import com.itextpdf.kernel.pdf.tagging.PdfObjRef;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import com.itextpdf.layout.Document;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.junit.jupiter.api.io.TempDir;

/** Base for tests that build tagged PDFs, optionally kept via -Dpdf.autolabel.testOutputDir. */
public abstract class PdfTestBase {
    @TempDir Path tempDir;
    private Path outputDir;
    private String testClassName;
    private String testMethodName;

    // ── Test lifecycle ──────────────────────────────────────────────

    @BeforeEach
    void captureTestName(TestInfo testInfo) {
        testClassName =
                testInfo.getTestClass()
                        .map(Class::getSimpleName)
                        .orElse(getClass().getSimpleName());
        testMethodName = testInfo.getTestMethod().map(method -> method.getName()).orElse("test");
    }

    // ── Output path helpers ─────────────────────────────────────────

    protected final Path testOutputPath() {
        return testOutputPath(testMethodName + ".pdf");
    }

    protected final Path testOutputPath(String filename) {
        return testOutputDir().resolve(filename);
    }

    /** Returns {baseDir}/{testClassName}/, creating it if needed. */
    protected final Path testOutputDir() {
        if (outputDir != null) {
            return outputDir;
        }
        String configured = System.getProperty("pdf.autolabel.testOutputDir");
        Path baseDir = configured != null && !configured.isBlank() ? Path.of(configured) : tempDir;
        Path dir = baseDir.resolve(testClassName);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create test output dir: " + dir, e);
        }
        outputDir = dir;
        return outputDir;
    }

    // ── PDF creation ────────────────────────────────────────────────

    /** Callback for building a structure tree under the Document element. */
    @FunctionalInterface
    protected interface StructureContent {
        void addTo(PdfDocument pdfDoc, PdfStructElem document) throws Exception;
    }

    /** Callback for adding content through the iText layout API. */
    @FunctionalInterface
    protected interface LayoutContent {
        void addTo(PdfDocument pdfDoc, Document document) throws Exception;
    }

    /** Creates a tagged PDF whose structure tree is built directly. */
    protected final Path createTaggedPdf(Path outputPath, StructureContent content)
            throws Exception {
        try (PdfDocument pdfDoc = new PdfDocument(new PdfWriter(outputPath.toString()))) {
            pdfDoc.setTagged();
            pdfDoc.addNewPage();
            PdfStructElem document = new PdfStructElem(pdfDoc, PdfName.Document);
            pdfDoc.getStructTreeRoot().addKid(document);
            content.addTo(pdfDoc, document);
        }
        return outputPath;
    }

    protected final Path createTaggedPdf(StructureContent content) throws Exception {
        return createTaggedPdf(testOutputPath(), content);
    }

    /** Creates a tagged PDF from layout content; iText tags it as it lays it out. */
    protected final Path createLayoutPdf(Path outputPath, LayoutContent content) throws Exception {
        try (PdfWriter writer = new PdfWriter(outputPath.toString());
                PdfDocument pdfDoc = new PdfDocument(writer)) {
            pdfDoc.setTagged();
            Document document = new Document(pdfDoc);
            content.addTo(pdfDoc, document);
            document.close();
        }
        return outputPath;
    }

    /** Creates an untagged one-page PDF. */
    protected final Path createUntaggedPdf(Path outputPath) throws Exception {
        try (PdfDocument pdfDoc = new PdfDocument(new PdfWriter(outputPath.toString()))) {
            pdfDoc.addNewPage();
        }
        return outputPath;
    }

    // ── Structure helpers ───────────────────────────────────────────

    /** Appends a new element with the given role and returns it. */
    protected static PdfStructElem addElem(PdfStructElem parent, String role) {
        PdfDocument pdfDoc = parent.getPdfObject().getIndirectReference().getDocument();
        return parent.addKid(new PdfStructElem(pdfDoc, new PdfName(role)));
    }

    /** Appends an {@code LI} with {@code Lbl} and {@code LBody} children and returns the LI. */
    protected static PdfStructElem addListItem(PdfStructElem list) {
        PdfStructElem item = addElem(list, "LI");
        addElem(item, "Lbl");
        addElem(item, "LBody");
        return item;
    }

    protected static void setId(PdfStructElem elem, String id) {
        elem.getPdfObject().put(PdfName.ID, new PdfString(id));
    }

    /** Marks a list with a {@code ListNumbering} attribute in the List owner. */
    protected static void setListNumbering(PdfStructElem list, String numbering) {
        PdfDictionary attrs = new PdfDictionary();
        attrs.put(PdfName.O, new PdfName("List"));
        attrs.put(new PdfName("ListNumbering"), new PdfName(numbering));
        addAttributes(list, attrs);
    }

    /** Adds a {@code UserProperties} attribute with one name/value entry. */
    protected static void setUserProperty(PdfStructElem elem, String name, PdfObject value) {
        PdfDictionary property = new PdfDictionary();
        property.put(PdfName.N, new PdfString(name));
        property.put(PdfName.V, value);
        PdfDictionary attrs = new PdfDictionary();
        attrs.put(PdfName.O, new PdfName("UserProperties"));
        attrs.put(PdfName.P, new PdfArray(property));
        addAttributes(elem, attrs);
    }

    private static void addAttributes(PdfStructElem elem, PdfDictionary attrs) {
        PdfObject existing = elem.getPdfObject().get(PdfName.A);
        if (existing == null) {
            elem.getPdfObject().put(PdfName.A, attrs);
        } else if (existing.isArray()) {
            ((PdfArray) existing).add(attrs);
        } else {
            PdfArray both = new PdfArray(existing);
            both.add(attrs);
            elem.getPdfObject().put(PdfName.A, both);
        }
    }

    /**
     * Appends a {@code Link} element with the given {@code /ActualText}, tied through an OBJR to a
     * link annotation on the first page that performs {@code action}.
     */
    protected static PdfStructElem addLink(PdfStructElem parent, String text, PdfAction action) {
        PdfDocument pdfDoc = parent.getPdfObject().getIndirectReference().getDocument();
        PdfStructElem link = addElem(parent, "Link");
        link.getPdfObject().put(PdfName.ActualText, new PdfString(text));

        PdfLinkAnnotation annotation = new PdfLinkAnnotation(new Rectangle(36, 700, 100, 20));
        annotation.setAction(action);
        annotation.makeIndirect(pdfDoc);
        pdfDoc.getFirstPage().addAnnotation(-1, annotation, false);
        link.addKid(new PdfObjRef(annotation, link, pdfDoc.getNextStructParentIndex()));
        return link;
    }

    /** Reopens a PDF and returns every element with the given role, in document order. */
    protected static List<PdfStructElem> findAll(PdfDocument pdfDoc, String role) {
        List<PdfStructElem> out = new ArrayList<>();
        collect(pdfDoc.getStructTreeRoot(), new PdfName(role), out);
        return out;
    }

    private static void collect(IStructureNode node, PdfName role, List<PdfStructElem> out) {
        List<IStructureNode> kids = node.getKids();
        if (kids == null) {
            return;
        }
        for (IStructureNode kid : kids) {
            if (kid instanceof PdfStructElem elem) {
                if (role.equals(elem.getRole())) {
                    out.add(elem);
                }
                collect(elem, role, out);
            }
        }
    }

    protected static PdfDocument open(Path path) throws IOException {
        return new PdfDocument(new PdfReader(path.toString()));
    }
}
