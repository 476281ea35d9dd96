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

/** Positional notation over a digit alphabet (decimal, binary, hexadecimal, ...). */
public class NumericCounterStyle extends CounterStyle {
    private final List<String> digits;

    public NumericCounterStyle(String name, String digits) {
        this(name, digits, 0);
    }

    public NumericCounterStyle(String name, String digits, int padWidth) {
        super(name, null, Integer.MIN_VALUE, Integer.MAX_VALUE, "-", padWidth, "0");
        this.digits = symbols(digits);
    }

    @Override
    protected String renderValue(int n) {
        if (n == 0) {
            return digits.get(0);
        }
        int base = digits.size();
        StringBuilder out = new StringBuilder();
        while (n > 0) {
            out.insert(0, digits.get(n % base));
            n /= base;
        }
        return out.toString();
    }
}
