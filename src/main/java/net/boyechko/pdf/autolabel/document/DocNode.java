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
package net.boyechko.pdf.autolabel.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A node of the element tree the engine labels. Nodes carry their input (kind, heading level, id,
 * directives, link target and text) and receive the engine's output (label text, CSS classes and
 * inline style).
 */
public final class DocNode {
    private final ElementKind kind;
    private final String tag;
    private final int headingLevel;
    private final List<DocNode> children = new ArrayList<>();
    private DocNode parent;

    private String id;
    private LabelDirectives directives = LabelDirectives.NONE;
    private String href;
    private String text;

    private String label;
    private final Set<String> cssClasses = new LinkedHashSet<>();
    private String inlineStyle;

    private DocNode(ElementKind kind, String tag, int headingLevel) {
        this.kind = kind;
        this.tag = tag;
        this.headingLevel = headingLevel;
    }

    public static DocNode heading(int level) {
        if (level < 1 || level > 6) {
            throw new IllegalArgumentException("Heading level must be 1..6, got " + level);
        }
        return new DocNode(ElementKind.HEADING, "H" + level, level);
    }

    public static DocNode orderedList() {
        return new DocNode(ElementKind.ORDERED_LIST, "OL", 0);
    }

    public static DocNode unorderedList() {
        return new DocNode(ElementKind.UNORDERED_LIST, "UL", 0);
    }

    public static DocNode listItem() {
        return new DocNode(ElementKind.LIST_ITEM, "LI", 0);
    }

    public static DocNode figure() {
        return new DocNode(ElementKind.FIGURE, "Figure", 0);
    }

    public static DocNode table() {
        return new DocNode(ElementKind.TABLE, "Table", 0);
    }

    public static DocNode link(String href, String text) {
        DocNode node = new DocNode(ElementKind.LINK, "Link", 0);
        node.href = href;
        node.text = text;
        return node;
    }

    public static DocNode other(String tag) {
        return new DocNode(ElementKind.OTHER, tag, 0);
    }

    /** Appends a child and returns it. */
    public DocNode addChild(DocNode child) {
        if (child.parent != null) {
            throw new IllegalStateException("Node " + child.tag + " already has a parent");
        }
        child.parent = this;
        children.add(child);
        return child;
    }

    /** Appends the children and returns this node. */
    public DocNode with(DocNode... kids) {
        for (DocNode kid : kids) {
            addChild(kid);
        }
        return this;
    }

    public DocNode withId(String id) {
        this.id = id;
        return this;
    }

    public DocNode withTemplate(String template) {
        this.directives = new LabelDirectives(template, directives.noLabel());
        return this;
    }

    public DocNode withNoLabel() {
        this.directives = new LabelDirectives(directives.template(), true);
        return this;
    }

    public DocNode withDirectives(LabelDirectives directives) {
        this.directives = directives != null ? directives : LabelDirectives.NONE;
        return this;
    }

    public ElementKind kind() {
        return kind;
    }

    public String tag() {
        return tag;
    }

    /** Heading level 1..6 for headings, 0 otherwise. */
    public int headingLevel() {
        return headingLevel;
    }

    public DocNode parent() {
        return parent;
    }

    public List<DocNode> children() {
        return Collections.unmodifiableList(children);
    }

    public String id() {
        return id;
    }

    public LabelDirectives directives() {
        return directives;
    }

    public String href() {
        return href;
    }

    public String text() {
        return text;
    }

    public void setText(String text) {
        this.text = text;
    }

    public String label() {
        return label;
    }

    public void setLabel(String label) {
        this.label = label;
    }

    public Set<String> cssClasses() {
        return Collections.unmodifiableSet(cssClasses);
    }

    public void addCssClass(String cssClass) {
        cssClasses.add(cssClass);
    }

    public String inlineStyle() {
        return inlineStyle;
    }

    /** Appends a declaration to the inline style, separating it from any existing ones. */
    public void appendInlineStyle(String declaration) {
        inlineStyle = inlineStyle == null ? declaration : inlineStyle + "; " + declaration;
    }

    /** A readable location such as {@code /Document/H1[2]/OL[1]/LI[3]}. */
    public String path() {
        StringBuilder sb = new StringBuilder();
        for (DocNode node = this; node != null; node = node.parent) {
            String step = node.tag;
            if (node.parent != null) {
                step += "[" + node.siblingIndex() + "]";
            }
            sb.insert(0, "/" + step);
        }
        return sb.toString();
    }

    /** One-based position among same-tag siblings. */
    private int siblingIndex() {
        int index = 0;
        for (DocNode sibling : parent.children) {
            if (sibling.tag.equals(tag)) {
                index++;
            }
            if (sibling == this) {
                break;
            }
        }
        return index;
    }

    @Override
    public String toString() {
        return id != null ? tag + "#" + id : tag;
    }
}
