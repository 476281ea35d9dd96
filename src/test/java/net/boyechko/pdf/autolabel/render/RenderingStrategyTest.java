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

import static org.junit.jupiter.api.Assertions.*;

import java.util.Set;
import net.boyechko.pdf.autolabel.config.LabelConfig;
import net.boyechko.pdf.autolabel.document.ElementKind;
import org.junit.jupiter.api.Test;

class RenderingStrategyTest {

    @Test
    void textIsTheDefault() {
        RenderingStrategy strategy = RenderingStrategy.textOnly();
        for (ElementKind kind : ElementKind.values()) {
            assertEquals(RenderMode.TEXT, strategy.modeFor(kind));
        }
    }

    @Test
    void listsMayUseCss() {
        LabelConfig config =
                LabelConfig.loadDefault().withRender(ElementKind.ORDERED_LIST, "CSS");

        RenderingStrategy strategy = RenderingStrategy.fromConfig(config);

        assertEquals(RenderMode.CSS, strategy.modeFor(ElementKind.ORDERED_LIST));
        assertEquals(RenderMode.TEXT, strategy.modeFor(ElementKind.UNORDERED_LIST));
        assertTrue(strategy.downgradedKinds().isEmpty());
    }

    @Test
    void cssForOtherKindsFallsBackToText() {
        RenderingStrategy strategy =
                RenderingStrategy.textOnly()
                        .with(ElementKind.FIGURE, RenderMode.CSS)
                        .with(ElementKind.HEADING, RenderMode.CSS);

        assertEquals(RenderMode.TEXT, strategy.modeFor(ElementKind.FIGURE));
        assertEquals(Set.of(ElementKind.FIGURE, ElementKind.HEADING), strategy.downgradedKinds());

        strategy.with(ElementKind.FIGURE, RenderMode.TEXT);
        assertEquals(Set.of(ElementKind.HEADING), strategy.downgradedKinds());
    }

    @Test
    void listItemsAreNotConfiguredDirectly() {
        assertThrows(
                IllegalArgumentException.class,
                () -> RenderingStrategy.textOnly().with(ElementKind.LIST_ITEM, RenderMode.CSS));
    }

    @Test
    void unknownRenderModeIsRejected() {
        assertEquals(RenderMode.TEXT, RenderMode.fromConfig(null));
        assertEquals(RenderMode.CSS, RenderMode.fromConfig(" css "));
        assertThrows(IllegalArgumentException.class, () -> RenderMode.fromConfig("html"));
    }
}
