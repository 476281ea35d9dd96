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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Maps element ids to their cross-reference targets. Built during allocation, read-only after. */
public final class ElementIdIndex {
    private final Map<String, IdTarget> targets;

    ElementIdIndex(Map<String, IdTarget> targets) {
        this.targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }

    public static ElementIdIndex empty() {
        return new ElementIdIndex(Map.of());
    }

    /** Returns the target for an id, or null. */
    public IdTarget lookup(String id) {
        return id != null ? targets.get(id) : null;
    }

    public boolean contains(String id) {
        return targets.containsKey(id);
    }

    public int size() {
        return targets.size();
    }
}
