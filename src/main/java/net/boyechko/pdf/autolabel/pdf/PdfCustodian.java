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

import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfReader;
import com.itextpdf.kernel.pdf.PdfWriter;
import com.itextpdf.kernel.pdf.ReaderProperties;
import java.io.IOException;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Factory for opening the input PDF for reading or for writing labels into a copy. */
public final class PdfCustodian {
    private static final Logger logger = LoggerFactory.getLogger(PdfCustodian.class);

    private final Path inputPath;
    private final ReaderProperties readerProps;

    public PdfCustodian(Path inputPath, String password) {
        this.inputPath = inputPath;
        this.readerProps = new ReaderProperties();
        if (password != null) {
            this.readerProps.setPassword(password.getBytes());
        }
    }

    public PdfCustodian(Path inputPath) {
        this(inputPath, null);
    }

    public Path getInputPath() {
        return inputPath;
    }

    public PdfDocument openForReading() throws IOException {
        logger.debug("Opening {} for reading", inputPath);
        PdfReader pdfReader = new PdfReader(inputPath.toString(), readerProps);
        return new PdfDocument(pdfReader);
    }

    /** Opens the input with its changes written to {@code outputPath} when the document closes. */
    public PdfDocument openForModification(Path outputPath) throws IOException {
        logger.debug("Opening {} for modification into {}", inputPath, outputPath);
        PdfReader pdfReader = new PdfReader(inputPath.toString(), readerProps);
        PdfWriter pdfWriter = new PdfWriter(outputPath.toString());
        return new PdfDocument(pdfReader, pdfWriter);
    }
}
