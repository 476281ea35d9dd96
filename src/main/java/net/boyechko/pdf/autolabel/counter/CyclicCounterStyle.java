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
package net.boyechko.pdf.autolabel.counter;

import java.util.List;

/** Cycles through a fixed list of markers; a single marker gives a constant bullet. */
public class CyclicCounterStyle extends CounterStyle {
    private final List<String> markers;

    public CyclicCounterStyle(String name, String markers) {
        super(name, null, Integer.MIN_VALUE, Integer.MAX_VALUE, null, 0, "");
        this.markers = symbols(markers);
    }

    @Override
    protected String renderValue(int n) {
        return markers.get(Math.floorMod(n - 1, markers.size()));
    }
}
