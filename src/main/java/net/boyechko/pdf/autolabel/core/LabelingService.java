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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.tagging.PdfStructTreeRoot;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.autolabel.config.LabelConfig;
import net.boyechko.pdf.autolabel.issue.Issue;
import net.boyechko.pdf.autolabel.issue.IssueList;
import net.boyechko.pdf.autolabel.issue.IssueSev;
import net.boyechko.pdf.autolabel.issue.IssueType;
import net.boyechko.pdf.autolabel.label.LabelAssignment;
import net.boyechko.pdf.autolabel.pdf.PdfCustodian;
import net.boyechko.pdf.autolabel.pdf.StructTreeImporter;
import net.boyechko.pdf.autolabel.pdf.StructTreeImporter.ImportedTree;
import net.boyechko.pdf.autolabel.pdf.StructTreeLabelWriter;
import net.boyechko.pdf.autolabel.render.RenderingStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Orchestrates labelling of a tagged PDF document. */
public class LabelingService {
    private static final Logger logger = LoggerFactory.getLogger(LabelingService.class);

    private final PdfCustodian custodian;
    private final ProcessingListener listener;
    private final LabelEngine engine;

    public static class LabelingServiceBuilder {
        private PdfCustodian custodian;
        private ProcessingListener listener;
        private LabelConfig config;

        public LabelingServiceBuilder withPdfCustodian(PdfCustodian custodian) {
            this.custodian = custodian;
            return this;
        }

        public LabelingServiceBuilder withListener(ProcessingListener listener) {
            this.listener = listener;
            return this;
        }

        public LabelingServiceBuilder withConfig(LabelConfig config) {
            this.config = config;
            return this;
        }

        public LabelingService build() {
            if (custodian == null) {
                throw new IllegalStateException(
                        "PdfCustodian must be provided via withPdfCustodian(...) before building LabelingService");
            }
            return new LabelingService(this);
        }
    }

    private LabelingService(LabelingServiceBuilder builder) {
        this.custodian = builder.custodian;
        this.listener = builder.listener != null ? builder.listener : new SilentListener();
        LabelConfig config = builder.config != null ? builder.config : LabelConfig.loadDefault();
        // Labels in a PDF are always baked in as text
        this.engine = new LabelEngine(config, RenderingStrategy.textOnly());
    }

    /** Computes labels without writing anything. */
    public ProcessingResult analyze() throws IOException {
        try (PdfDocument doc = custodian.openForReading()) {
            return run(doc, null);
        }
    }

    /** Computes labels and writes them into a copy of the input at {@code outputPath}. */
    public ProcessingResult label(Path outputPath) throws IOException {
        try (PdfDocument doc = custodian.openForModification(outputPath)) {
            return run(doc, outputPath);
        }
    }

    private ProcessingResult run(PdfDocument doc, Path outputPath) {
        listener.onPhaseStart("Labels");
        PdfStructTreeRoot root = doc.getStructTreeRoot();
        if (root == null) {
            Issue issue =
                    new Issue(
                            IssueType.NO_STRUCT_TREE,
                            IssueSev.ERROR,
                            "Document has no structure tree; nothing to label");
            listener.onError(issue.message());
            ProcessingResult aborted = ProcessingResult.aborted(new IssueList(List.of(issue)));
            listener.onSummary(aborted);
            return aborted;
        }

        ImportedTree tree = StructTreeImporter.importTree(root);
        LabelResult result = engine.label(tree.root());

        for (LabelAssignment assignment : result.assignments()) {
            if (assignment.isLabelled()) {
                listener.onLabel(assignment.element().path(), assignment.displayText());
            }
        }
        if (result.resolvedLinks() > 0) {
            listener.onInfo("Resolved cross references in " + result.resolvedLinks() + " link(s)");
        }
        reportIssuesGrouped(result.issues());

        int written = 0;
        if (outputPath != null) {
            written = StructTreeLabelWriter.write(result.allocation(), tree);
            logger.info("Wrote {} label(s) into {}", written, outputPath);
        }

        ProcessingResult processed =
                new ProcessingResult(
                        result.assignments().size(),
                        (int) result.labelledCount(),
                        written,
                        result.issues(),
                        outputPath);
        listener.onSummary(processed);
        return processed;
    }

    private void reportIssuesGrouped(IssueList issues) {
        for (Map.Entry<IssueType, IssueList> group : issues.byType().entrySet()) {
            listener.onIssueGroup(group.getKey().groupLabel(), group.getValue());
        }
    }

    private static final class SilentListener implements ProcessingListener {
        @Override
        public void onPhaseStart(String phaseName) {}

        @Override
        public void onSuccess(String message) {}

        @Override
        public void onWarning(Issue issue) {}

        @Override
        public void onSummary(ProcessingResult result) {}
    }
}
