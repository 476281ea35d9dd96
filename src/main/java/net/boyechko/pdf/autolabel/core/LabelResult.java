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

import java.util.List;
import net.boyechko.pdf.autolabel.issue.IssueList;
import net.boyechko.pdf.autolabel.label.Allocation;
import net.boyechko.pdf.autolabel.label.LabelAssignment;

/**
 * Output of one {@link LabelEngine} run.
 *
 * @param allocation the label assignments and id index
 * @param stylesheet counter rules for CSS-rendered lists; empty if none
 * @param resolvedLinks number of links whose text was rewritten
 */
public record LabelResult(Allocation allocation, String stylesheet, int resolvedLinks) {

    public List<LabelAssignment> assignments() {
        return allocation.assignments();
    }

    public IssueList issues() {
        return allocation.issues();
    }

    public long labelledCount() {
        return assignments().stream().filter(LabelAssignment::isLabelled).count();
    }

    public boolean hasStylesheet() {
        return !stylesheet.isEmpty();
    }
}
