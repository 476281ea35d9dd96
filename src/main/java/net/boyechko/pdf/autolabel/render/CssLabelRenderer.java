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
package net.boyechko.pdf.autolabel.render;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.label.LabelAssignment;
import net.boyechko.pdf.autolabel.template.LabelTemplate;
import net.boyechko.pdf.autolabel.template.TemplateComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders list labels as stylesheet counters. Each labelled list gets its own {@code la-labelN}
 * counter, reset on the list and incremented per item, with a {@code ::before} rule whose
 * content mirrors the computed label. An item that switches template starts a new counter on
 * itself; suppressed items hold the counter and show nothing.
 */
public class CssLabelRenderer implements LabelRenderer {
    private static final Logger logger = LoggerFactory.getLogger(CssLabelRenderer.class);

    public static final String COUNTER_PREFIX = "la-label";
    public static final String NO_LABEL_CLASS = "la-no-label";

    private final Map<DocNode, String> itemCounters = new IdentityHashMap<>();
    private int nextCounter = 1;

    @Override
    public String render(List<LabelAssignment> assignments) {
        Map<DocNode, List<LabelAssignment>> byList = new LinkedHashMap<>();
        for (LabelAssignment assignment : assignments) {
            if (assignment.container() != null) {
                byList.computeIfAbsent(assignment.container(), l -> new ArrayList<>())
                        .add(assignment);
            }
        }

        StringBuilder css = new StringBuilder();
        boolean anyLabelled = false;
        boolean anySuppressed = false;
        for (Map.Entry<DocNode, List<LabelAssignment>> entry : byList.entrySet()) {
            ListOutcome outcome = renderList(entry.getKey(), entry.getValue(), css);
            anyLabelled |= outcome.labelled();
            anySuppressed |= outcome.suppressed();
        }

        if (anyLabelled) {
            rule(css, "." + TextLabelRenderer.LABELLED_CLASS + " > li", "list-style-type: none");
        }
        if (anySuppressed) {
            rule(css, "li." + NO_LABEL_CLASS, "counter-increment: none");
            rule(css, "li." + NO_LABEL_CLASS + "::before", "content: none");
        }
        logger.debug("Rendered {} list(s) with {} counter(s)", byList.size(), nextCounter - 1);
        return css.toString();
    }

    private record ListOutcome(boolean labelled, boolean suppressed) {}

    private ListOutcome renderList(DocNode list, List<LabelAssignment> items, StringBuilder css) {
        String listCounter = null;
        String activeCounter = null;
        LabelTemplate activeTemplate = null;
        Set<String> withContent = new HashSet<>();
        boolean suppressed = false;

        for (LabelAssignment item : items) {
            if (item.template() == null) {
                continue;
            }
            DocNode element = item.element();

            if (listCounter == null) {
                listCounter = newCounter();
                activeCounter = listCounter;
                activeTemplate = item.template();
                list.addCssClass(TextLabelRenderer.LABELLED_CLASS);
                list.addCssClass(listCounter);
                rule(css, "." + listCounter, "counter-reset: " + listCounter);
                rule(css, "." + listCounter + " > li", "counter-increment: " + listCounter);
            } else if (!item.template().equals(activeTemplate)) {
                activeCounter = newCounter();
                activeTemplate = item.template();
                element.appendInlineStyle("counter-reset: " + activeCounter);
                rule(css, "li." + activeCounter, "counter-increment: " + activeCounter);
            }

            if (activeCounter != listCounter) {
                element.addCssClass(activeCounter);
            }
            itemCounters.put(element, activeCounter);

            if (item.component() == null) {
                // suppressed, or deeper than the template reaches
                element.addCssClass(NO_LABEL_CLASS);
                suppressed = true;
                continue;
            }
            if (withContent.add(activeCounter)) {
                String selector =
                        activeCounter == listCounter
                                ? "." + listCounter + " > li::before"
                                : "li." + activeCounter + "::before";
                rule(css, selector, "content: " + contentExpr(item, activeCounter));
            }
        }
        return new ListOutcome(listCounter != null, suppressed);
    }

    private String newCounter() {
        return COUNTER_PREFIX + nextCounter++;
    }

    /** The {@code content} value equivalent to the item's display text. */
    String contentExpr(LabelAssignment item, String counter) {
        TemplateComponent component = item.component();
        List<String> parts = new ArrayList<>();
        parts.add(cssString(component.prefix()));
        if (item.parentRecord() != null) {
            parts.add(coreExpr(item.parentRecord().assignment()));
            parts.add(cssString(component.parentSeparator()));
        }
        if (component.hasCounter()) {
            parts.add(counterCall(counter, component));
        }
        parts.add(cssString(component.suffix()));
        String expr = join(parts);
        return expr.isEmpty() ? "\"\"" : expr;
    }

    /** Expression for an enclosing label's bare text; counters where the label is CSS-rendered. */
    private String coreExpr(LabelAssignment label) {
        String counter = itemCounters.get(label.element());
        TemplateComponent component = label.component();
        if (counter == null || component == null) {
            return cssString(label.bareText());
        }
        List<String> parts = new ArrayList<>();
        if (!component.hasCounter()) {
            return label.parentRecord() != null ? coreExpr(label.parentRecord().assignment()) : "";
        }
        if (label.parentRecord() != null) {
            parts.add(coreExpr(label.parentRecord().assignment()));
            parts.add(cssString(component.parentSeparator()));
        }
        parts.add(counterCall(counter, component));
        return join(parts);
    }

    private static String counterCall(String counter, TemplateComponent component) {
        return "counter(" + counter + ", " + component.style().name() + ")";
    }

    private static String join(List<String> parts) {
        return String.join(" ", parts.stream().filter(p -> !p.isEmpty()).toList());
    }

    /** Quotes text as a CSS string; empty text gives an empty expression. */
    static String cssString(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return "\"" + text.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    private static void rule(StringBuilder css, String selector, String declaration) {
        css.append(selector).append(" {\n    ").append(declaration).append(";\n}\n");
    }
}
