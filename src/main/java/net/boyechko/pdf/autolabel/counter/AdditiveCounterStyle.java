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

/** Sign-value notation built greedily from weighted symbols, as used for roman numerals. */
public class AdditiveCounterStyle extends CounterStyle {
    private final int[] weights;
    private final String[] symbols;

    /** Weights must be given in descending order, paired index-wise with their symbols. */
    public AdditiveCounterStyle(
            String name, int rangeMin, int rangeMax, int[] weights, String[] symbols) {
        super(name, null, rangeMin, rangeMax, "-", 0, "");
        if (weights.length != symbols.length) {
            throw new IllegalArgumentException("Each weight needs exactly one symbol");
        }
        this.weights = weights.clone();
        this.symbols = symbols.clone();
    }

    @Override
    protected String renderValue(int n) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < weights.length && n > 0; i++) {
            while (n >= weights[i]) {
                out.append(symbols[i]);
                n -= weights[i];
            }
        }
        return n == 0 && out.length() > 0 ? out.toString() : null;
    }
}
