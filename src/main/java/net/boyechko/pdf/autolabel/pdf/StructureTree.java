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
import com.itextpdf.kernel.pdf.PdfDictionary;
import com.itextpdf.kernel.pdf.PdfDocument;
import com.itextpdf.kernel.pdf.PdfName;
import com.itextpdf.kernel.pdf.PdfObject;
import com.itextpdf.kernel.pdf.PdfString;
import com.itextpdf.kernel.pdf.tagging.IStructureNode;
import com.itextpdf.kernel.pdf.tagging.PdfObjRef;
import com.itextpdf.kernel.pdf.tagging.PdfStructElem;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Utilities for navigating the PDF structure tree. */
public final class StructureTree {

    private static final PdfName USER_PROPERTIES = new PdfName("UserProperties");

    private StructureTree() {}

    /** Returns the PDF document for the given structure element. */
    public static PdfDocument pdfDocumentFor(PdfStructElem n) {
        return n.getPdfObject().getIndirectReference().getDocument();
    }

    /** Returns the PDF object number for a structure element, or -1 if unavailable. */
    public static int objNumber(PdfStructElem elem) {
        var ref = elem.getPdfObject().getIndirectReference();
        return ref != null ? ref.getObjNumber() : -1;
    }

    /** Finds the first child element with the given role. */
    public static PdfStructElem findFirstChild(PdfStructElem parent, PdfName role) {
        for (PdfStructElem kid : structKidsOf(parent)) {
            if (role.equals(kid.getRole())) {
                return kid;
            }
        }
        return null;
    }

    /** Finds the first OBJR (object reference) child of an element. */
    public static PdfObjRef findFirstObjRef(PdfStructElem elem) {
        List<IStructureNode> kids = elem.getKids();
        if (kids == null) return null;
        for (IStructureNode kid : kids) {
            if (kid instanceof PdfObjRef objRef) {
                return objRef;
            }
        }
        return null;
    }

    /**
     * Returns the mapped role for a structure element, or the raw role if no mapping is available.
     */
    public static String mappedRole(PdfStructElem n) {
        PdfDictionary roleMap = pdfDocumentFor(n).getStructTreeRoot().getRoleMap();
        PdfName role = n.getRole();

        if (roleMap != null) {
            PdfName mappedRole = roleMap.getAsName(role);
            return (mappedRole != null) ? mappedRole.getValue() : role.getValue();
        }
        return role.getValue();
    }

    /**
     * Returns the children of a structure node, or an empty list if no children are available.
     */
    public static List<PdfStructElem> structKidsOf(IStructureNode n) {
        List<IStructureNode> kids = n.getKids();
        if (kids == null) return List.of();

        List<PdfStructElem> out = new ArrayList<>();
        for (IStructureNode k : kids) {
            if (k instanceof PdfStructElem) {
                out.add((PdfStructElem) k);
            }
        }
        return out;
    }

    /**
     * Returns the attribute dictionaries of an element. The /A entry may hold a single dictionary
     * or an array of dictionaries interleaved with revision numbers.
     */
    public static List<PdfDictionary> attributesOf(PdfStructElem elem) {
        PdfObject attrs = elem.getPdfObject().get(PdfName.A);
        if (attrs == null) return List.of();

        if (attrs.isDictionary()) {
            return List.of((PdfDictionary) attrs);
        }
        List<PdfDictionary> out = new ArrayList<>();
        if (attrs.isArray()) {
            PdfArray array = (PdfArray) attrs;
            for (int i = 0; i < array.size(); i++) {
                PdfObject entry = array.get(i);
                if (entry != null && entry.isDictionary()) {
                    out.add((PdfDictionary) entry);
                }
            }
        }
        return out;
    }

    /**
     * Returns the entries of the element's {@code UserProperties} attribute dictionaries, keyed by
     * property name. Later entries win.
     */
    public static Map<String, PdfObject> userProperties(PdfStructElem elem) {
        Map<String, PdfObject> out = new LinkedHashMap<>();
        for (PdfDictionary attrs : attributesOf(elem)) {
            if (!USER_PROPERTIES.equals(attrs.getAsName(PdfName.O))) {
                continue;
            }
            PdfArray properties = attrs.getAsArray(PdfName.P);
            if (properties == null) {
                continue;
            }
            for (int i = 0; i < properties.size(); i++) {
                PdfDictionary property = properties.getAsDictionary(i);
                if (property == null) {
                    continue;
                }
                PdfString name = property.getAsString(PdfName.N);
                PdfObject value = property.get(PdfName.V);
                if (name != null && value != null) {
                    out.put(name.toUnicodeString(), value);
                }
            }
        }
        return out;
    }
}
