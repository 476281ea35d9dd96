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

import java.util.ArrayList;
import java.util.List;

/**
 * The ethiopic-numeric system: the value is split into two-digit groups; odd groups are followed
 * by ፻ (hundred) and even groups other than the last by ፼ (ten thousand).
 */
public class EthiopicCounterStyle extends CounterStyle {
    private static final List<String> ONES = symbols("፩፪፫፬፭፮፯፰፱");
    private static final List<String> TENS = symbols("፲፳፴፵፶፷፸፹፺");
    private static final String HUNDRED = "፻";
    private static final String TEN_THOUSAND = "፼";

    public EthiopicCounterStyle() {
        super("ethiopic-numeric", null, 1, Integer.MAX_VALUE, null, 0, "");
    }

    @Override
    protected String renderValue(int n) {
        if (n == 1) {
            return ONES.get(0);
        }

        List<Integer> groups = new ArrayList<>();
        for (int rest = n; rest > 0; rest /= 100) {
            groups.add(rest % 100);
        }

        StringBuilder out = new StringBuilder();
        for (int i = groups.size() - 1; i >= 0; i--) {
            int group = groups.get(i);
            boolean odd = i % 2 == 1;
            boolean mostSignificant = i == groups.size() - 1;
            boolean dropDigits = group == 0 || (group == 1 && (odd || mostSignificant));

            if (!dropDigits) {
                if (group / 10 > 0) out.append(TENS.get(group / 10 - 1));
                if (group % 10 > 0) out.append(ONES.get(group % 10 - 1));
            }
            if (odd && group != 0) {
                out.append(HUNDRED);
            } else if (!odd && i > 0) {
                out.append(TEN_THOUSAND);
            }
        }
        return out.toString();
    }
}
