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

/**
 * Bijective numbering over an alphabet: with "a".."z", 1 is "a", 26 is "z" and 27 is "aa". Defined
 * for positive values only.
 */
public class AlphabeticCounterStyle extends CounterStyle {
    private final List<String> letters;

    public AlphabeticCounterStyle(String name, String letters) {
        super(name, null, 1, Integer.MAX_VALUE, "-", 0, "");
        this.letters = symbols(letters);
    }

    @Override
    protected String renderValue(int n) {
        int base = letters.size();
        StringBuilder out = new StringBuilder();
        while (n > 0) {
            n--;
            out.insert(0, letters.get(n % base));
            n /= base;
        }
        return out.toString();
    }
}
