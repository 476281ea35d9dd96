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
 * A named algorithm that turns a counter value into display text, following the counter-style
 * systems of CSS. Values outside the style's range, or values the algorithm cannot represent, are
 * rendered by the fallback style, so {@link #render(int)} never fails.
 */
public abstract class CounterStyle {
    private final String name;
    private final CounterStyle fallback;
    private final int rangeMin;
    private final int rangeMax;
    private final String negativePrefix;
    private final int padWidth;
    private final String padSymbol;

    protected CounterStyle(
            String name,
            CounterStyle fallback,
            int rangeMin,
            int rangeMax,
            String negativePrefix,
            int padWidth,
            String padSymbol) {
        this.name = name;
        this.fallback = fallback;
        this.rangeMin = rangeMin;
        this.rangeMax = rangeMax;
        this.negativePrefix = negativePrefix;
        this.padWidth = padWidth;
        this.padSymbol = padSymbol;
    }

    /** The CSS keyword for this style, as used in {@code counter(name, style)}. */
    public String name() {
        return name;
    }

    public final String render(int n) {
        if (n < rangeMin || n > rangeMax) {
            return renderFallback(n);
        }

        String text;
        if (n < 0 && negativePrefix != null) {
            if (n == Integer.MIN_VALUE) {
                return renderFallback(n);
            }
            String magnitude = renderValue(-n);
            text =
                    magnitude == null
                            ? null
                            : negativePrefix + pad(magnitude, padWidth - negativePrefix.length());
        } else {
            String value = renderValue(n);
            text = value == null ? null : pad(value, padWidth);
        }
        return text != null ? text : renderFallback(n);
    }

    /**
     * Renders a value inside this style's range. Receives the magnitude of negative values when
     * the style has a negative prefix. Returns null when the value cannot be represented.
     */
    protected abstract String renderValue(int n);

    private String renderFallback(int n) {
        return fallback != null ? fallback.render(n) : Integer.toString(n);
    }

    private String pad(String text, int width) {
        int missing = width - text.codePointCount(0, text.length());
        return missing > 0 ? padSymbol.repeat(missing) + text : text;
    }

    /** Splits a string of glyphs into one symbol per code point. */
    protected static List<String> symbols(String glyphs) {
        List<String> out = new ArrayList<>();
        glyphs.codePoints().forEach(cp -> out.add(new String(Character.toChars(cp))));
        return List.copyOf(out);
    }

    @Override
    public String toString() {
        return "CounterStyle[" + name + "]";
    }
}
