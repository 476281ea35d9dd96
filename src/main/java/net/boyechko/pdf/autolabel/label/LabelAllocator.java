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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.pdf.autolabel.config.LabelConfig;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.document.ElementKind;
import net.boyechko.pdf.autolabel.document.LabelDirectives;
import net.boyechko.pdf.autolabel.issue.Issue;
import net.boyechko.pdf.autolabel.issue.IssueList;
import net.boyechko.pdf.autolabel.issue.IssueLoc;
import net.boyechko.pdf.autolabel.issue.IssueSev;
import net.boyechko.pdf.autolabel.issue.IssueType;
import net.boyechko.pdf.autolabel.label.CounterArena.CounterKey;
import net.boyechko.pdf.autolabel.template.LabelTemplate;
import net.boyechko.pdf.autolabel.template.ParentIndicator;
import net.boyechko.pdf.autolabel.template.TemplateComponent;
import net.boyechko.pdf.autolabel.template.TemplateParser;
import net.boyechko.pdf.autolabel.template.TemplateSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns labels to the headings, list items, figures and tables of an element tree in a single
 * pass in document order.
 *
 * <p>Each labelled element draws on a <em>series</em>: a template plus the depth within it. The
 * series comes from the element's own directive, from the enclosing element of the same kind
 * (one level deeper), or from the configured default. Headings carry their series per level
 * until a heading of the same or a shallower level replaces it; list items share their list's
 * series, which an item directive switches from that item on; figures and tables share one
 * series per enclosing container.
 *
 * <p>Counters restart whenever the template, depth or inserted parent label they run under
 * changes. Suppressed elements hold their counter. Degraded cases (uncovered depth, missing
 * parent label, unparsable template) are reported as issues and leave the element unlabelled.
 */
public class LabelAllocator {
    private static final Logger logger = LoggerFactory.getLogger(LabelAllocator.class);

    private final LabelConfig config;
    private final TemplateParser parser;

    public LabelAllocator(LabelConfig config) {
        this(config, new TemplateParser());
    }

    public LabelAllocator(LabelConfig config, TemplateParser parser) {
        this.config = config != null ? config : LabelConfig.none();
        this.parser = parser;
    }

    public Allocation allocate(DocNode root) {
        Pass pass = new Pass();
        pass.visit(root);

        long labelled = pass.assignments.stream().filter(LabelAssignment::isLabelled).count();
        logger.debug(
                "Allocated {} labels for {} labelable elements; {} ids, {} links",
                labelled,
                pass.assignments.size(),
                pass.targets.size(),
                pass.links.size());

        return new Allocation(
                root,
                pass.assignments,
                new ElementIdIndex(pass.targets),
                pass.links,
                pass.issues);
    }

    private record Series(LabelTemplate template, int depth) {
        Series deeper() {
            return new Series(template, depth + 1);
        }
    }

    /** What a counter runs under; a change restarts it. */
    private record Binding(LabelTemplate template, int depth, ParentLabelRecord parent) {}

    private record SeriesKey(ElementKind kind, DocNode scope) {}

    /** State of one allocation run. */
    private final class Pass {
        private final CounterArena arena = new CounterArena();
        private final List<ParentLabelRecord> records = new ArrayList<>();
        private final Series[] headings = new Series[7];
        private final Map<DocNode, Series> containers = new IdentityHashMap<>();
        private final Map<SeriesKey, Series> sequences = new HashMap<>();
        private final Map<ElementKind, LabelTemplate> defaults = new EnumMap<>(ElementKind.class);
        private final Deque<LabelAssignment> owners = new ArrayDeque<>();

        private final List<LabelAssignment> assignments = new ArrayList<>();
        private final Map<String, IdTarget> targets = new LinkedHashMap<>();
        private final List<DocNode> links = new ArrayList<>();
        private final IssueList issues = new IssueList();

        void visit(DocNode node) {
            switch (node.kind()) {
                case HEADING -> visitHeading(node);
                case ORDERED_LIST, UNORDERED_LIST -> visitList(node);
                case FIGURE, TABLE -> visitCaptioned(node);
                case LINK -> {
                    links.add(node);
                    indexId(node);
                    visitChildren(node);
                }
                default -> {
                    indexId(node);
                    visitChildren(node);
                }
            }
        }

        private void visitChildren(DocNode node) {
            for (DocNode child : node.children()) {
                visit(child);
            }
        }

        // --- Headings ---

        private void visitHeading(DocNode heading) {
            int level = heading.headingLevel();
            closeHeadings(level);

            LabelDirectives directives = heading.directives();
            Series current = headings[level];
            Series series;
            if (directives.hasTemplate()) {
                LabelTemplate template = parseDirective(heading, directives.template());
                if (template == null) {
                    enter(heading, LabelAssignment.unlabelled(heading, null, 0, null), false);
                    return;
                }
                series =
                        current != null && current.template().equals(template)
                                ? current
                                : new Series(template, 0);
            } else if (current != null) {
                series = current;
            } else {
                series = inheritedHeadingSeries(level);
            }
            headings[level] = series;

            LabelAssignment assignment;
            if (series == null) {
                assignment = LabelAssignment.unlabelled(heading, null, 0, null);
            } else if (directives.noLabel()) {
                assignment =
                        LabelAssignment.suppressed(
                                heading, null, series.depth(), series.template());
            } else {
                assignment =
                        compose(
                                heading,
                                null,
                                series,
                                new CounterKey(ElementKind.HEADING, level, null));
            }
            enter(heading, assignment, false);
        }

        /** Ends the scope of headings at this level and below. */
        private void closeHeadings(int level) {
            records.removeIf(r -> r.kind() == ElementKind.HEADING && r.headingLevel() >= level);
            for (int deeper = level + 1; deeper < headings.length; deeper++) {
                headings[deeper] = null;
            }
            arena.discardDeeper(ElementKind.HEADING, level);
        }

        private Series inheritedHeadingSeries(int level) {
            for (int shallower = level - 1; shallower >= 1; shallower--) {
                Series outer = headings[shallower];
                if (outer != null) {
                    return new Series(outer.template(), outer.depth() + level - shallower);
                }
            }
            if (level == config.headingLevel()) {
                LabelTemplate template = defaultTemplate(ElementKind.HEADING);
                if (template != null) {
                    return new Series(template, 0);
                }
            }
            return null;
        }

        // --- Lists ---

        private void visitList(DocNode list) {
            ElementKind kind = list.kind();
            DocNode enclosing = nearestAncestor(list, kind);
            int nesting = countAncestors(list, kind);

            LabelDirectives directives = list.directives();
            Series series = null;
            if (directives.hasTemplate()) {
                LabelTemplate template = parseDirective(list, directives.template());
                if (template != null) {
                    series = new Series(template, 0);
                }
            } else if (enclosing != null && containers.get(enclosing) != null) {
                series = containers.get(enclosing).deeper();
            } else {
                LabelTemplate template = defaultTemplate(kind);
                if (template != null) {
                    series = new Series(template, nesting);
                }
            }
            if (series != null) {
                containers.put(list, series);
            }

            indexId(list);
            CounterKey key = new CounterKey(kind, nesting, list);
            for (DocNode child : list.children()) {
                if (child.kind() == ElementKind.LIST_ITEM) {
                    visitItem(list, child, key, directives.noLabel());
                } else {
                    visit(child);
                }
            }
        }

        private void visitItem(DocNode list, DocNode item, CounterKey key, boolean listSuppressed) {
            Series series = containers.get(list);
            LabelDirectives directives = item.directives();
            if (directives.hasTemplate()) {
                LabelTemplate template = parseDirective(item, directives.template());
                if (template == null) {
                    enter(item, LabelAssignment.unlabelled(item, list, 0, null), true);
                    return;
                }
                if (series == null || !series.template().equals(template)) {
                    logger.debug("Switching {} to template {}", list.path(), template);
                    series = new Series(template, 0);
                    containers.put(list, series);
                }
            }

            LabelAssignment assignment;
            if (series == null) {
                assignment = LabelAssignment.unlabelled(item, list, 0, null);
            } else if (directives.noLabel() || listSuppressed) {
                assignment =
                        LabelAssignment.suppressed(item, list, series.depth(), series.template());
            } else {
                assignment = compose(item, list, series, key);
            }
            enter(item, assignment, true);
        }

        // --- Figures and tables ---

        private void visitCaptioned(DocNode node) {
            ElementKind kind = node.kind();
            DocNode enclosing = nearestAncestor(node, kind);
            int nesting = countAncestors(node, kind);
            SeriesKey seriesKey = new SeriesKey(kind, enclosing);

            LabelDirectives directives = node.directives();
            Series current = sequences.get(seriesKey);
            Series series;
            if (directives.hasTemplate()) {
                LabelTemplate template = parseDirective(node, directives.template());
                if (template == null) {
                    enter(node, LabelAssignment.unlabelled(node, null, 0, null), true);
                    return;
                }
                series =
                        current != null && current.template().equals(template)
                                ? current
                                : new Series(template, 0);
            } else if (current != null) {
                series = current;
            } else if (enclosing != null && containers.get(enclosing) != null) {
                series = containers.get(enclosing).deeper();
            } else {
                LabelTemplate template = defaultTemplate(kind);
                series = template != null ? new Series(template, nesting) : null;
            }

            LabelAssignment assignment;
            if (series == null) {
                assignment = LabelAssignment.unlabelled(node, null, 0, null);
            } else {
                sequences.put(seriesKey, series);
                containers.put(node, series);
                if (directives.noLabel()) {
                    assignment =
                            LabelAssignment.suppressed(
                                    node, null, series.depth(), series.template());
                } else {
                    assignment =
                            compose(node, null, series, new CounterKey(kind, nesting, enclosing));
                }
            }
            enter(node, assignment, true);
        }

        // --- Shared ---

        private LabelAssignment compose(
                DocNode node, DocNode container, Series series, CounterKey key) {
            LabelTemplate template = series.template();
            int depth = series.depth();
            if (template.isEmpty()) {
                return LabelAssignment.unlabelled(node, container, depth, template);
            }
            TemplateComponent component = template.componentAt(depth);
            if (component == null) {
                issues.add(
                        new Issue(
                                IssueType.UNCOVERED_DEPTH,
                                IssueSev.INFO,
                                IssueLoc.atNode(node),
                                "Template "
                                        + template
                                        + " has no component for depth "
                                        + depth));
                return LabelAssignment.unlabelled(node, container, depth, template);
            }

            ParentLabelRecord parent = null;
            String parentText = "";
            if (component.hasParent()) {
                parent = nearestRecord(component.parent());
                if (parent != null) {
                    parentText = parent.bareText() + component.parentSeparator();
                } else {
                    issues.add(
                            new Issue(
                                    IssueType.MISSING_PARENT_LABEL,
                                    IssueSev.INFO,
                                    IssueLoc.atNode(node),
                                    "No enclosing label for \""
                                            + component.parent().token()
                                            + "\" in template "
                                            + template));
                }
            }

            int value = 0;
            String counterText = "";
            if (component.hasCounter()) {
                value = arena.next(key, new Binding(template, depth, parent));
                counterText = component.style().render(value);
            }

            String bare;
            if (component.hasCounter()) {
                bare = parentText + counterText;
            } else {
                bare = parent != null ? parent.bareText() : "";
            }
            String display = component.prefix() + parentText + counterText + component.suffix();

            logger.debug("{} {} labelled \"{}\"", node.kind(), node.path(), display);
            return new LabelAssignment(
                    node,
                    node.kind(),
                    container,
                    depth,
                    display,
                    bare,
                    template,
                    component,
                    value,
                    parent,
                    false);
        }

        /**
         * Records the assignment, makes it visible to the element's subtree and visits it. Scoped
         * records are withdrawn when the subtree ends; heading records stay until closed.
         */
        private void enter(DocNode node, LabelAssignment assignment, boolean scoped) {
            assignments.add(assignment);
            if (assignment.suppressed()) {
                logger.debug("{} {} suppressed", node.kind(), node.path());
            }

            // Ids below resolve to this element, labelled or not
            owners.push(assignment);
            ParentLabelRecord record = null;
            if (!assignment.bareText().isEmpty()) {
                record = new ParentLabelRecord(assignment);
                records.add(record);
            }

            indexId(node);
            visitChildren(node);

            if (record != null && scoped) {
                removeRecord(record);
            }
            owners.pop();
        }

        private void removeRecord(ParentLabelRecord record) {
            for (int i = records.size() - 1; i >= 0; i--) {
                if (records.get(i) == record) {
                    records.remove(i);
                    return;
                }
            }
        }

        private ParentLabelRecord nearestRecord(ParentIndicator indicator) {
            for (int i = records.size() - 1; i >= 0; i--) {
                if (records.get(i).matches(indicator)) {
                    return records.get(i);
                }
            }
            return null;
        }

        private void indexId(DocNode node) {
            String id = node.id();
            if (id == null || id.isEmpty()) {
                return;
            }
            if (targets.containsKey(id)) {
                issues.add(
                        new Issue(
                                IssueType.DUPLICATE_ID,
                                IssueSev.WARNING,
                                IssueLoc.atNode(node),
                                "Id \"" + id + "\" already used; references go to the first use"));
                return;
            }
            targets.put(id, new IdTarget(id, node, owners.peek(), records));
        }

        private LabelTemplate parseDirective(DocNode node, String source) {
            try {
                return parser.parse(source);
            } catch (TemplateSyntaxException e) {
                logger.error("Invalid label template on {}: {}", node.path(), e.getMessage());
                issues.add(
                        new Issue(
                                IssueType.TEMPLATE_SYNTAX,
                                IssueSev.ERROR,
                                IssueLoc.atNode(node),
                                e.getMessage()));
                return null;
            }
        }

        private LabelTemplate defaultTemplate(ElementKind kind) {
            if (defaults.containsKey(kind)) {
                return defaults.get(kind);
            }
            LabelTemplate template = null;
            String source = config.templateFor(kind);
            if (source != null) {
                try {
                    template = parser.parse(source);
                } catch (TemplateSyntaxException e) {
                    logger.error(
                            "Invalid default {} template: {}",
                            kind.displayName(),
                            e.getMessage());
                    issues.add(
                            new Issue(
                                    IssueType.TEMPLATE_SYNTAX,
                                    IssueSev.ERROR,
                                    IssueLoc.inTemplate(e.source(), e.index()),
                                    e.getMessage()));
                }
            }
            defaults.put(kind, template);
            return template;
        }
    }

    private static DocNode nearestAncestor(DocNode node, ElementKind kind) {
        for (DocNode p = node.parent(); p != null; p = p.parent()) {
            if (p.kind() == kind) {
                return p;
            }
        }
        return null;
    }

    private static int countAncestors(DocNode node, ElementKind kind) {
        int count = 0;
        for (DocNode p = node.parent(); p != null; p = p.parent()) {
            if (p.kind() == kind) {
                count++;
            }
        }
        return count;
    }
}
