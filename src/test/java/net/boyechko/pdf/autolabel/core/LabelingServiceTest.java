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
package net.boyechko.pdf.autolabel.core;

import static org.junit.jupiter.api.Assertions.*;

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.action.PdfAction;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autolabel.PdfTestBase;
import net.boyechko.pdf.autolabel.config.LabelConfig;
import net.boyechko.pdf.autolabel.document.ElementKind;
import net.boyechko.pdf.autolabel.issue.Issue;
import net.boyechko.pdf.autolabel.issue.IssueType;
import net.boyechko.pdf.autolabel.pdf.PdfCustodian;
import org.junit.jupiter.api.Test;

class LabelingServiceTest extends PdfTestBase {

    /** Records what the service reports. */
    private static final class RecordingListener implements ProcessingListener {
        final List<String> phases = new ArrayList<>();
        final List<String> labels = new ArrayList<>();
        final List<String> errors = new ArrayList<>();
        final List<String> groups = new ArrayList<>();
        ProcessingResult summary;

        @Override
        public void onPhaseStart(String phaseName) {
            phases.add(phaseName);
        }

        @Override
        public void onSuccess(String message) {}

        @Override
        public void onWarning(Issue issue) {}

        @Override
        public void onSummary(ProcessingResult result) {
            summary = result;
        }

        @Override
        public void onError(String message) {
            errors.add(message);
        }

        @Override
        public void onLabel(String where, String label) {
            labels.add(label);
        }

        @Override
        public void onIssueGroup(String groupLabel, List<Issue> issues) {
            groups.add(groupLabel);
        }
    }

    private Path sampleInput() throws Exception {
        return createTaggedPdf(
                testOutputPath("input.pdf"),
                (pdfDoc, document) -> {
                    addElem(document, "H1");
                    PdfStructElem list = addElem(document, "L");
                    setListNumbering(list, "Decimal");
                    addListItem(list);
                    addListItem(list);
                    addElem(document, "Table");
                });
    }

    @Test
    void builderRequiresCustodian() {
        assertThrows(
                IllegalStateException.class,
                () -> new LabelingService.LabelingServiceBuilder().build());
    }

    @Test
    void labelWritesOutputAndReports() throws Exception {
        Path input = sampleInput();
        Path output = testOutputPath("labelled.pdf");
        RecordingListener listener = new RecordingListener();

        ProcessingResult result =
                new LabelingService.LabelingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .withListener(listener)
                        .withConfig(
                                LabelConfig.loadDefault()
                                        .withTemplate(ElementKind.HEADING, "1 "))
                        .build()
                        .label(output);

        assertTrue(Files.exists(output));
        assertEquals(output, result.outputFile());
        assertEquals(4, result.labelableElements());
        assertEquals(4, result.labelledElements());
        assertEquals(4, result.writtenElements());
        assertFalse(result.isAborted());
        assertEquals(List.of("1 ", "1. ", "2. ", "Table 1. "), listener.labels);
        assertEquals(List.of("Labels"), listener.phases);
        assertSame(result, listener.summary);

        try (PdfDocument pdfDoc = open(output)) {
            List<PdfStructElem> lbls = findAll(pdfDoc, "Lbl");
            assertEquals(
                    "2.", lbls.get(1).getPdfObject().getAsString(PdfName.ActualText).toUnicodeString());
        }
    }

    @Test
    void directivesAndCrossReferencesReachThePdf() throws Exception {
        Path input =
                createTaggedPdf(
                        testOutputPath("input.pdf"),
                        (pdfDoc, document) -> {
                            PdfStructElem heading = addElem(document, "H1");
                            setUserProperty(heading, "label", new PdfString("'Part '1"));
                            PdfStructElem list = addElem(document, "L");
                            setListNumbering(list, "Decimal");
                            setUserProperty(addListItem(list), "no-label", PdfBoolean.TRUE);
                            setId(addListItem(list), "step");
                            addLink(document, "see step ##", PdfAction.createGoTo("step"));
                            addLink(document, "in ##H", PdfAction.createGoTo("step"));
                            addLink(document, "plain text", PdfAction.createGoTo("step"));
                        });
        Path output = testOutputPath("labelled.pdf");
        RecordingListener listener = new RecordingListener();

        ProcessingResult result =
                new LabelingService.LabelingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .withListener(listener)
                        .build()
                        .label(output);

        assertEquals(List.of("Part 1", "1. "), listener.labels);
        assertEquals(4, result.writtenElements());
        try (PdfDocument pdfDoc = open(output)) {
            PdfStructElem heading = findAll(pdfDoc, "H1").get(0);
            assertEquals("Part 1", heading.getPdfObject().getAsString(PdfName.T).toUnicodeString());
            List<PdfStructElem> lbls = findAll(pdfDoc, "Lbl");
            assertNull(lbls.get(0).getPdfObject().get(PdfName.ActualText));
            assertEquals("1.", actualText(lbls.get(1)));

            List<PdfStructElem> links = findAll(pdfDoc, "Link");
            assertEquals("see step 1. ", actualText(links.get(0)));
            assertEquals("in 1", actualText(links.get(1)));
            assertEquals("plain text", actualText(links.get(2)));
        }
    }

    private static String actualText(PdfStructElem elem) {
        return elem.getPdfObject().getAsString(PdfName.ActualText).toUnicodeString();
    }

    @Test
    void analyzeDoesNotWrite() throws Exception {
        Path input = sampleInput();

        ProcessingResult result =
                new LabelingService.LabelingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .build()
                        .analyze();

        assertNull(result.outputFile());
        assertEquals(0, result.writtenElements());
        assertEquals(3, result.labelledElements());
    }

    @Test
    void untaggedDocumentIsAborted() throws Exception {
        Path input = createUntaggedPdf(testOutputPath("untagged.pdf"));
        RecordingListener listener = new RecordingListener();

        ProcessingResult result =
                new LabelingService.LabelingServiceBuilder()
                        .withPdfCustodian(new PdfCustodian(input))
                        .withListener(listener)
                        .build()
                        .analyze();

        assertTrue(result.isAborted());
        assertTrue(result.issues().hasErrors());
        assertEquals(IssueType.NO_STRUCT_TREE, result.issues().get(0).type());
        assertEquals(1, listener.errors.size());
    }

    @Test
    void issuesAreReportedInGroups() throws Exception {
        Path input =
                createTaggedPdf(
                        testOutputPath("input.pdf"),
                        (pdfDoc, document) -> {
                            setId(addElem(document, "Figure"), "dup");
                            setId(addElem(document, "Table"), "dup");
                        });
        RecordingListener listener = new RecordingListener();

        new LabelingService.LabelingServiceBuilder()
                .withPdfCustodian(new PdfCustodian(input))
                .withListener(listener)
                .build()
                .analyze();

        assertEquals(List.of(IssueType.DUPLICATE_ID.groupLabel()), listener.groups);
    }
}
