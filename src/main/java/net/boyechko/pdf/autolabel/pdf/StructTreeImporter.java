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

import com.itextpdf.kernel.pdf.PdfArray;
import com.itextpdf.kernel.pdf.PdfBoolean;
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.tagging.PdfObjRef;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import com.itextpdf.kernel.pdf.tagging.PdfStructTreeRoot;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.document.LabelDirectives;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the labelling engine's element tree from a PDF structure tree. Roles are resolved
 * through the role map; {@code H1}..{@code H6}, {@code L}, {@code LI}, {@code Figure} and
 * {@code Table} become labelable nodes, {@code Link} becomes a link and everything else is kept
 * as structure. A list is ordered when its {@code ListNumbering} attribute names a numbering
 * system.
 *
 * <p>Per-element directives come from {@code UserProperties} attributes: {@code label} holds a
 * template and {@code no-label} (any value but {@code false}) suppresses the label. A link's text
 * is its {@code /ActualText}; its target is the {@code /ID} of a structure destination, a named
 * destination (as {@code #name}) or a URI, read from the annotation it references.
 */
public final class StructTreeImporter {
    private static final Logger logger = LoggerFactory.getLogger(StructTreeImporter.class);

    private static final PdfName LIST_NUMBERING = new PdfName("ListNumbering");
    private static final PdfName STRUCT_DEST = new PdfName("SD");
    static final String TEMPLATE_PROPERTY = "label";
    static final String NO_LABEL_PROPERTY = "no-label";
    private static final Set<String> ORDERED_NUMBERING =
            Set.of("Decimal", "UpperRoman", "LowerRoman", "UpperAlpha", "LowerAlpha");

    private StructTreeImporter() {}

    /** The imported tree with the structure element behind each node. */
    public record ImportedTree(DocNode root, Map<DocNode, PdfStructElem> elements) {
        public ImportedTree {
            elements = Collections.unmodifiableMap(elements);
        }

        /** Returns the structure element a node was imported from, or null. */
        public PdfStructElem elementFor(DocNode node) {
            return elements.get(node);
        }
    }

    public static ImportedTree importTree(PdfStructTreeRoot root) {
        Map<DocNode, PdfStructElem> elements = new IdentityHashMap<>();
        DocNode doc = DocNode.other("StructTreeRoot");
        for (PdfStructElem kid : StructureTree.structKidsOf(root)) {
            doc.addChild(importElem(kid, elements));
        }
        logger.debug("Imported {} structure elements", elements.size());
        return new ImportedTree(doc, elements);
    }

    private static DocNode importElem(PdfStructElem elem, Map<DocNode, PdfStructElem> elements) {
        DocNode node = nodeFor(elem);
        elements.put(node, elem);

        PdfString id = elem.getPdfObject().getAsString(PdfName.ID);
        if (id != null) {
            node.withId(id.toUnicodeString());
        }
        node.withDirectives(directivesOf(elem));
        for (PdfStructElem kid : StructureTree.structKidsOf(elem)) {
            node.addChild(importElem(kid, elements));
        }
        return node;
    }

    private static DocNode nodeFor(PdfStructElem elem) {
        String role = StructureTree.mappedRole(elem);
        return switch (role) {
            case "H1", "H2", "H3", "H4", "H5", "H6" -> DocNode.heading(role.charAt(1) - '0');
            case "L" -> isOrdered(elem) ? DocNode.orderedList() : DocNode.unorderedList();
            case "LI" -> DocNode.listItem();
            case "Figure" -> DocNode.figure();
            case "Table" -> DocNode.table();
            case "Link" -> DocNode.link(linkTarget(elem), linkText(elem));
            default -> DocNode.other(role);
        };
    }

    static boolean isOrdered(PdfStructElem list) {
        for (PdfDictionary attrs : StructureTree.attributesOf(list)) {
            PdfName numbering = attrs.getAsName(LIST_NUMBERING);
            if (numbering != null) {
                return ORDERED_NUMBERING.contains(numbering.getValue());
            }
        }
        return false;
    }

    static LabelDirectives directivesOf(PdfStructElem elem) {
        Map<String, PdfObject> properties = StructureTree.userProperties(elem);
        if (properties.isEmpty()) {
            return LabelDirectives.NONE;
        }
        String template = null;
        PdfObject templateValue = properties.get(TEMPLATE_PROPERTY);
        if (templateValue instanceof PdfString str) {
            template = str.toUnicodeString();
        }
        PdfObject noLabelValue = properties.get(NO_LABEL_PROPERTY);
        boolean noLabel =
                noLabelValue != null
                        && !(noLabelValue instanceof PdfBoolean flag && !flag.getValue());
        return new LabelDirectives(template, noLabel);
    }

    private static String linkText(PdfStructElem link) {
        PdfString text = link.getPdfObject().getAsString(PdfName.ActualText);
        return text != null ? text.toUnicodeString() : null;
    }

    /** Returns the link's target as {@code #id}, a URI, or null when it has none. */
    static String linkTarget(PdfStructElem link) {
        PdfObjRef objRef = StructureTree.findFirstObjRef(link);
        if (objRef == null) {
            return null;
        }
        PdfDictionary annot = objRef.getReferencedObject();
        if (annot == null) {
            return null;
        }
        PdfObject dest = annot.get(PdfName.Dest);
        PdfDictionary action = annot.getAsDictionary(PdfName.A);
        if (action != null) {
            PdfName type = action.getAsName(PdfName.S);
            if (PdfName.URI.equals(type)) {
                PdfString uri = action.getAsString(PdfName.URI);
                return uri != null ? uri.toUnicodeString() : null;
            }
            if (PdfName.GoTo.equals(type)) {
                PdfArray structDest = action.getAsArray(STRUCT_DEST);
                if (structDest != null && !structDest.isEmpty()) {
                    PdfDictionary target = structDest.getAsDictionary(0);
                    PdfString id = target != null ? target.getAsString(PdfName.ID) : null;
                    if (id != null) {
                        return "#" + id.toUnicodeString();
                    }
                }
                dest = action.get(PdfName.D);
            }
        }
        return namedDestination(dest);
    }

    private static String namedDestination(PdfObject dest) {
        if (dest instanceof PdfString str) {
            return "#" + str.toUnicodeString();
        }
        if (dest instanceof PdfName name) {
            return "#" + name.getValue();
        }
        // Explicit page destinations name no element
        return null;
    }
}
