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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/** Registry of the built-in counter styles, including the single-character shorthands. */
public final class CounterStyles {
    private static final Map<String, String> SHORTHANDS =
            Map.of(
                    "1", "decimal",
                    "a", "lower-alpha",
                    "A", "upper-alpha",
                    "i", "lower-roman",
                    "I", "upper-roman");

    private static final String LOWER_LATIN = "abcdefghijklmnopqrstuvwxyz";
    private static final String UPPER_LATIN = "ABCDEFGHIJKLMNOPQRSTUVWXYZ";
    private static final int[] ROMAN_WEIGHTS = {
        1000, 900, 500, 400, 100, 90, 50, 40, 10, 9, 5, 4, 1
    };

    private static final Map<String, CounterStyle> STYLES = new LinkedHashMap<>();

    static {
        register(new NumericCounterStyle("decimal", "0123456789"));
        register(new NumericCounterStyle("decimal-leading-zero", "0123456789", 2));
        register(new NumericCounterStyle("binary", "01"));
        register(new NumericCounterStyle("octal", "01234567"));
        register(new NumericCounterStyle("lower-hexadecimal", "0123456789abcdef"));
        register(new NumericCounterStyle("upper-hexadecimal", "0123456789ABCDEF"));

        register(new AlphabeticCounterStyle("lower-alpha", LOWER_LATIN));
        register(new AlphabeticCounterStyle("lower-latin", LOWER_LATIN));
        register(new AlphabeticCounterStyle("upper-alpha", UPPER_LATIN));
        register(new AlphabeticCounterStyle("upper-latin", UPPER_LATIN));
        register(new AlphabeticCounterStyle("lower-greek", "αβγδεζηθικλμνξοπρστυφχψω"));

        register(
                new AdditiveCounterStyle(
                        "lower-roman",
                        1,
                        3999,
                        ROMAN_WEIGHTS,
                        new String[] {
                            "m", "cm", "d", "cd", "c", "xc", "l", "xl", "x", "ix", "v", "iv", "i"
                        }));
        register(
                new AdditiveCounterStyle(
                        "upper-roman",
                        1,
                        3999,
                        ROMAN_WEIGHTS,
                        new String[] {
                            "M", "CM", "D", "CD", "C", "XC", "L", "XL", "X", "IX", "V", "IV", "I"
                        }));

        register(new CyclicCounterStyle("disc", "•"));
        register(new CyclicCounterStyle("circle", "◦"));
        register(new CyclicCounterStyle("square", "▪"));

        CounterStyle cjkDecimal = new NumericCounterStyle("cjk-decimal", "〇一二三四五六七八九");
        register(cjkDecimal);
        register(
                new ChineseCounterStyle(
                        "simp-chinese-informal", "零一二三四五六七八九", "十百千", "负", cjkDecimal));
        register(
                new ChineseCounterStyle(
                        "simp-chinese-formal", "零壹贰叁肆伍陆柒捌玖", "拾佰仟", "负", cjkDecimal));
        register(
                new ChineseCounterStyle(
                        "trad-chinese-informal", "零一二三四五六七八九", "十百千", "負", cjkDecimal));
        register(
                new ChineseCounterStyle(
                        "trad-chinese-formal", "零壹貳參肆伍陸柒捌玖", "拾佰仟", "負", cjkDecimal));
        STYLES.put("cjk-ideographic", STYLES.get("trad-chinese-informal"));

        register(new EthiopicCounterStyle());
    }

    private CounterStyles() {}

    private static void register(CounterStyle style) {
        STYLES.put(style.name(), style);
    }

    /** Expands a single-character shorthand ({@code 1}, {@code a}, {@code I}, ...). */
    public static String canonicalName(String name) {
        return SHORTHANDS.getOrDefault(name, name);
    }

    public static boolean isSupported(String name) {
        return name != null && STYLES.containsKey(canonicalName(name));
    }

    public static CounterStyle lookup(String name) throws UnsupportedStyleException {
        CounterStyle style = name != null ? STYLES.get(canonicalName(name)) : null;
        if (style == null) {
            throw new UnsupportedStyleException(name);
        }
        return style;
    }

    /** All registered style names, shorthands excluded. */
    public static Set<String> names() {
        return Collections.unmodifiableSet(STYLES.keySet());
    }
}
