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
 * Chinese numbering limited to -9999..9999. Zero digits between non-zero digits collapse into a
 * single zero glyph, trailing zeros are dropped, and values from ten to nineteen omit the leading
 * "one" before the tens marker.
 */
public class ChineseCounterStyle extends CounterStyle {
    private static final int LIMIT = 9999;

    private final List<String> digits;
    private final List<String> powers;

    public ChineseCounterStyle(
            String name, String digits, String powers, String negative, CounterStyle fallback) {
        super(name, fallback, -LIMIT, LIMIT, negative, 0, "");
        this.digits = symbols(digits);
        this.powers = symbols(powers);
        if (this.digits.size() != 10 || this.powers.size() != 3) {
            throw new IllegalArgumentException(
                    "Expected 10 digit glyphs and 3 power glyphs for " + name);
        }
    }

    @Override
    protected String renderValue(int n) {
        if (n == 0) {
            return digits.get(0);
        }

        StringBuilder out = new StringBuilder();
        boolean started = false;
        boolean pendingZero = false;
        int divisor = 1000;
        for (int power = 3; power >= 0; power--, divisor /= 10) {
            int digit = (n / divisor) % 10;
            if (digit == 0) {
                pendingZero = started;
                continue;
            }
            if (pendingZero) {
                out.append(digits.get(0));
                pendingZero = false;
            }
            // 10..19 is written with the tens marker alone.
            if (!(power == 1 && digit == 1 && n < 20)) {
                out.append(digits.get(digit));
            }
            if (power > 0) {
                out.append(powers.get(power - 1));
            }
            started = true;
        }
        return out.toString();
    }
}
