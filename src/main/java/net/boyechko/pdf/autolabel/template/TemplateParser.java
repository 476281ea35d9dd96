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
package net.boyechko.pdf.autolabel.template;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import net.boyechko.pdf.autolabel.counter.CounterStyle;
import net.boyechko.pdf.autolabel.counter.CounterStyles;
import net.boyechko.pdf.autolabel.counter.UnsupportedStyleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses label templates such as {@code "1. ,(a) ,(i) "} or {@code "H.1 ,*"}.
 *
 * <p>A template is a comma-separated list of components, one per nesting depth. A final segment
 * consisting of {@code *} makes the last component repeat for all deeper levels. Each component
 * reads, in order: literal prefix, optional parent indicator ({@code X}, {@code L}, {@code H},
 * {@code H1}..{@code H6}) followed by its separator, optional counter style, literal suffix.
 * Letters and digits form words; the first word of a component is a parent indicator only when
 * no letter or digit immediately follows it, and any other word must name a counter style.
 * Quoted text ({@code "..."} or {@code '...'}, with a doubled quote standing for itself) is
 * always literal.
 *
 * <p>Parsed templates are cached by source text, so repeated directives share one instance.
 */
public class TemplateParser {
    private static final Logger logger = LoggerFactory.getLogger(TemplateParser.class);

    private static final Pattern PARENT_TOKEN = Pattern.compile("(X|L|H[1-6]?)(?![A-Za-z0-9])");

    private final Map<String, LabelTemplate> cache = new HashMap<>();

    public LabelTemplate parse(String source) throws TemplateSyntaxException {
        if (source == null) {
            throw new IllegalArgumentException("Template source must not be null");
        }
        LabelTemplate cached = cache.get(source);
        if (cached != null) {
            return cached;
        }

        LabelTemplate template = new Cursor(source).template();
        cache.put(source, template);
        logger.debug(
                "Parsed label template \"{}\" into {} component(s){}",
                source,
                template.parts().size(),
                template.repeatIndefinitely() ? ", repeating" : "");
        return template;
    }

    /** Number of distinct templates parsed so far. */
    public int cachedCount() {
        return cache.size();
    }

    private static boolean isWordChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9');
    }

    /** Single-use parsing state over one source string. */
    private static final class Cursor {
        private final String source;
        private final int length;
        private int pos;

        Cursor(String source) {
            this.source = source;
            this.length = source.length();
        }

        LabelTemplate template() throws TemplateSyntaxException {
            if (source.isBlank()) {
                return new LabelTemplate(source, List.of(), false);
            }

            List<TemplateComponent> parts = new ArrayList<>();
            boolean repeat = false;
            while (true) {
                skipWhitespace();
                if (atRepeatMarker()) {
                    int markerIndex = pos;
                    pos++;
                    skipWhitespace();
                    if (pos < length) {
                        throw new TemplateSyntaxException(
                                "\"*\" is only allowed as the last segment", source, markerIndex);
                    }
                    if (parts.isEmpty()) {
                        throw new TemplateSyntaxException(
                                "\"*\" must follow a component to repeat", source, markerIndex);
                    }
                    repeat = true;
                    break;
                }
                parts.add(component());
                if (pos >= length) {
                    break;
                }
                pos++; // ','
                skipWhitespace();
                if (pos >= length) {
                    // A dangling comma adds no component
                    break;
                }
            }
            return new LabelTemplate(source, parts, repeat);
        }

        /** True if the rest of the current segment is a lone {@code *}. */
        private boolean atRepeatMarker() {
            if (pos >= length || source.charAt(pos) != '*') {
                return false;
            }
            for (int i = pos + 1; i < length && source.charAt(i) != ','; i++) {
                if (!Character.isWhitespace(source.charAt(i))) {
                    return false;
                }
            }
            return true;
        }

        private TemplateComponent component() throws TemplateSyntaxException {
            StringBuilder prefix = new StringBuilder();
            StringBuilder separator = new StringBuilder();
            StringBuilder suffix = new StringBuilder();
            ParentIndicator parent = null;
            CounterStyle style = null;
            boolean seenWord = false;

            StringBuilder literal = prefix;
            while (pos < length && source.charAt(pos) != ',') {
                char c = source.charAt(pos);
                if (c == '"' || c == '\'') {
                    literal.append(quoted());
                } else if (isWordChar(c)) {
                    if (!seenWord && parent == null) {
                        Matcher m = PARENT_TOKEN.matcher(source).region(pos, length);
                        if (m.lookingAt()) {
                            parent = ParentIndicator.fromToken(m.group(1));
                            pos = m.end();
                            literal = separator;
                            continue;
                        }
                    }
                    int wordIndex = pos;
                    String word = word();
                    if (style != null) {
                        throw new TemplateSyntaxException(
                                "Unexpected \"" + word + "\" after counter style", source, wordIndex);
                    }
                    style = lookupStyle(word, wordIndex);
                    seenWord = true;
                    literal = suffix;
                } else {
                    literal.append(c);
                    pos++;
                }
            }

            return new TemplateComponent(
                    prefix.toString(),
                    style,
                    suffix.toString(),
                    parent,
                    separator.toString());
        }

        private CounterStyle lookupStyle(String word, int wordIndex)
                throws TemplateSyntaxException {
            try {
                return CounterStyles.lookup(word);
            } catch (UnsupportedStyleException e) {
                throw new TemplateSyntaxException(
                        "Unknown counter style \"" + word + "\"", source, wordIndex, e);
            }
        }

        /** Reads {@code [A-Za-z0-9]+(-[A-Za-z0-9]+)*}. */
        private String word() {
            int start = pos;
            while (pos < length && isWordChar(source.charAt(pos))) {
                pos++;
            }
            while (pos + 1 < length
                    && source.charAt(pos) == '-'
                    && isWordChar(source.charAt(pos + 1))) {
                pos++;
                while (pos < length && isWordChar(source.charAt(pos))) {
                    pos++;
                }
            }
            return source.substring(start, pos);
        }

        private String quoted() throws TemplateSyntaxException {
            int open = pos;
            char quote = source.charAt(pos++);
            StringBuilder text = new StringBuilder();
            while (pos < length) {
                char c = source.charAt(pos);
                if (c == quote) {
                    if (pos + 1 < length && source.charAt(pos + 1) == quote) {
                        text.append(quote);
                        pos += 2;
                        continue;
                    }
                    pos++;
                    return text.toString();
                }
                text.append(c);
                pos++;
            }
            throw new TemplateSyntaxException("Unterminated quote", source, open);
        }

        private void skipWhitespace() {
            while (pos < length && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
        }
    }
}
