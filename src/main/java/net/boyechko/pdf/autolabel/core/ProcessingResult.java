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

import java.nio.file.Path;
import net.boyechko.pdf.autolabel.issue.IssueList;
import net.boyechko.pdf.autolabel.issue.IssueType;

/**
 * Summary of labelling a PDF document.
 *
 * @param labelableElements Headings, list items, figures and tables found.
 * @param labelledElements Elements that received a label.
 * @param writtenElements Structure elements given a label or new link text (0 for a dry run).
 * @param issues Everything reported while labelling.
 * @param outputFile The written file, or null for a dry run or an aborted run.
 */
public record ProcessingResult(
        int labelableElements,
        int labelledElements,
        int writtenElements,
        IssueList issues,
        Path outputFile) {

    /** Returns an aborted result with no output file and the given issues. */
    public static ProcessingResult aborted(IssueList issues) {
        return new ProcessingResult(0, 0, 0, issues, null);
    }

    public boolean isAborted() {
        return !issues.ofType(IssueType.NO_STRUCT_TREE).isEmpty();
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
