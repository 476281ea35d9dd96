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
package net.boyechko.pdf.autolabel.render;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import net.boyechko.pdf.autolabel.config.LabelConfig;
import net.boyechko.pdf.autolabel.document.ElementKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses per element kind whether labels are written as text or left to stylesheet counters.
 * Only lists can be rendered with CSS; asking for CSS elsewhere falls back to text.
 */
public final class RenderingStrategy {
    private static final Logger logger = LoggerFactory.getLogger(RenderingStrategy.class);

    private static final Set<ElementKind> CONFIGURABLE =
            EnumSet.of(
                    ElementKind.HEADING,
                    ElementKind.ORDERED_LIST,
                    ElementKind.UNORDERED_LIST,
                    ElementKind.FIGURE,
                    ElementKind.TABLE);

    private final Map<ElementKind, RenderMode> modes = new EnumMap<>(ElementKind.class);
    private final Set<ElementKind> downgraded = EnumSet.noneOf(ElementKind.class);

    public static RenderingStrategy textOnly() {
        return new RenderingStrategy();
    }

    public static RenderingStrategy fromConfig(LabelConfig config) {
        RenderingStrategy strategy = new RenderingStrategy();
        for (ElementKind kind : CONFIGURABLE) {
            strategy.with(kind, RenderMode.fromConfig(config.renderFor(kind)));
        }
        return strategy;
    }

    /** Sets the mode for a kind. Returns this strategy. */
    public RenderingStrategy with(ElementKind kind, RenderMode mode) {
        if (!CONFIGURABLE.contains(kind)) {
            throw new IllegalArgumentException(kind + " labels are rendered with their series");
        }
        if (mode == RenderMode.CSS && !kind.isList()) {
            logger.warn(
                    "CSS rendering is only available for lists; {} labels are rendered as text",
                    kind.displayName());
            downgraded.add(kind);
            mode = RenderMode.TEXT;
        } else {
            downgraded.remove(kind);
        }
        modes.put(kind, mode);
        return this;
    }

    /** The mode for a series kind (list items follow their list). */
    public RenderMode modeFor(ElementKind kind) {
        return modes.getOrDefault(kind, RenderMode.TEXT);
    }

    /** Kinds for which CSS was requested but text is used. */
    public Set<ElementKind> downgradedKinds() {
        return Collections.unmodifiableSet(downgraded);
    }
}
