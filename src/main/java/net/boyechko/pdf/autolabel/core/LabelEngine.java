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

import java.util.ArrayList;
import java.util.List;
import net.boyechko.pdf.autolabel.config.LabelConfig;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.document.ElementKind;
import net.boyechko.pdf.autolabel.issue.Issue;
import net.boyechko.pdf.autolabel.issue.IssueList;
import net.boyechko.pdf.autolabel.issue.IssueSev;
import net.boyechko.pdf.autolabel.issue.IssueType;
import net.boyechko.pdf.autolabel.label.Allocation;
import net.boyechko.pdf.autolabel.label.CrossReferenceResolver;
import net.boyechko.pdf.autolabel.label.LabelAllocator;
import net.boyechko.pdf.autolabel.label.LabelAssignment;
import net.boyechko.pdf.autolabel.render.CssLabelRenderer;
import net.boyechko.pdf.autolabel.render.RenderMode;
import net.boyechko.pdf.autolabel.render.RenderingStrategy;
import net.boyechko.pdf.autolabel.render.TextLabelRenderer;
import net.boyechko.pdf.autolabel.template.TemplateParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Labels one element tree: allocates labels, renders them as text or stylesheet counters, then
 * resolves cross references in link text. An engine keeps a template cache and may label several
 * documents one after another, but is not safe for concurrent use.
 */
public class LabelEngine {
    private static final Logger logger = LoggerFactory.getLogger(LabelEngine.class);

    private final LabelConfig config;
    private final RenderingStrategy strategy;
    private final TemplateParser parser = new TemplateParser();

    public LabelEngine(LabelConfig config) {
        this(config, RenderingStrategy.fromConfig(config));
    }

    public LabelEngine(LabelConfig config, RenderingStrategy strategy) {
        this.config = config;
        this.strategy = strategy;
    }

    public LabelResult label(DocNode root) {
        Allocation allocation = new LabelAllocator(config, parser).allocate(root);
        IssueList issues = allocation.issues();
        for (ElementKind kind : strategy.downgradedKinds()) {
            issues.add(
                    new Issue(
                            IssueType.RENDER_MODE_UNSUPPORTED,
                            IssueSev.WARNING,
                            "CSS rendering is not available for "
                                    + kind.displayName()
                                    + " labels; rendered as text"));
        }

        List<LabelAssignment> asText = new ArrayList<>();
        List<LabelAssignment> asCss = new ArrayList<>();
        for (LabelAssignment assignment : allocation.assignments()) {
            if (strategy.modeFor(assignment.seriesKind()) == RenderMode.CSS) {
                asCss.add(assignment);
            } else {
                asText.add(assignment);
            }
        }
        new TextLabelRenderer().render(asText);
        String stylesheet = asCss.isEmpty() ? "" : new CssLabelRenderer().render(asCss);

        int resolvedLinks = new CrossReferenceResolver().resolve(allocation);

        logger.info(
                "Labelled {} of {} elements, resolved {} link(s), {} issue(s)",
                allocation.assignments().stream().filter(LabelAssignment::isLabelled).count(),
                allocation.assignments().size(),
                resolvedLinks,
                issues.size());
        return new LabelResult(allocation, stylesheet, resolvedLinks);
    }
}
