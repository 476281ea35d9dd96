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

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TemplateParserTest {
    private final TemplateParser parser = new TemplateParser();

    @Test
    void parsesMultilevelListTemplate() throws Exception {
        LabelTemplate template = parser.parse("1. ,(a) ,(i) ");

        assertEquals(3, template.parts().size());
        assertFalse(template.repeatIndefinitely());

        TemplateComponent first = template.componentAt(0);
        assertEquals("", first.prefix());
        assertEquals("decimal", first.style().name());
        assertEquals(". ", first.suffix());

        TemplateComponent second = template.componentAt(1);
        assertEquals("(", second.prefix());
        assertEquals("lower-alpha", second.style().name());
        assertEquals(") ", second.suffix());

        assertEquals("lower-roman", template.componentAt(2).style().name());
        assertNull(template.componentAt(3));
    }

    @Test
    void parentIndicatorWithSeparatorAndRepeat() throws Exception {
        LabelTemplate template = parser.parse("H.1. ,*");

        assertEquals(1, template.parts().size());
        assertTrue(template.repeatIndefinitely());
        TemplateComponent component = template.componentAt(5);
        assertSame(template.parts().get(0), component);
        assertEquals(new ParentIndicator.HeadingLabel(), component.parent());
        assertEquals(".", component.parentSeparator());
        assertEquals("decimal", component.style().name());
        assertEquals(". ", component.suffix());
    }

    @Test
    void levelledHeadingIndicator() throws Exception {
        TemplateComponent component = parser.parse("H2-a").componentAt(0);
        assertEquals(new ParentIndicator.HeadingLabelAtLevel(2), component.parent());
        assertEquals("-", component.parentSeparator());
        assertEquals("lower-alpha", component.style().name());
    }

    @Test
    void indicatorWithoutStyleKeepsTrailingTextAsSeparator() throws Exception {
        TemplateComponent component = parser.parse("L)").componentAt(0);
        assertEquals(new ParentIndicator.ListLabel(), component.parent());
        assertNull(component.style());
        assertEquals(")", component.parentSeparator());
        assertFalse(component.isLiteralOnly());
    }

    @Test
    void quotedTextIsLiteral() throws Exception {
        TemplateComponent component = parser.parse("\"Figure \"1 'A' ").componentAt(0);
        assertEquals("Figure ", component.prefix());
        assertEquals("decimal", component.style().name());
        assertEquals(" A ", component.suffix());
    }

    @Test
    void doubledQuoteStandsForItself() throws Exception {
        TemplateComponent component = parser.parse("'It''s '1").componentAt(0);
        assertEquals("It's ", component.prefix());
    }

    @Test
    void commasInsideQuotesDoNotSplit() throws Exception {
        LabelTemplate template = parser.parse("\"a,b\"1");
        assertEquals(1, template.parts().size());
        assertEquals("a,b", template.componentAt(0).prefix());
    }

    @Test
    void bulletsAreLiteralOnlyComponents() throws Exception {
        LabelTemplate template = parser.parse("•,◦,▪,*");
        assertEquals(3, template.parts().size());
        assertTrue(template.componentAt(0).isLiteralOnly());
        assertEquals("▪", template.componentAt(7).prefix());
    }

    @Test
    void asteriskInsideComponentIsLiteral() throws Exception {
        TemplateComponent component = parser.parse("*1*").componentAt(0);
        assertEquals("*", component.prefix());
        assertEquals("*", component.suffix());
    }

    @Test
    void leadingWhitespaceOfSegmentIsIgnored() throws Exception {
        LabelTemplate template = parser.parse("1.,   a)");
        assertEquals("", template.componentAt(1).prefix());
        assertEquals(")", template.componentAt(1).suffix());
    }

    @Test
    void danglingCommaAddsNoComponent() throws Exception {
        LabelTemplate template = parser.parse("1.,");
        assertEquals(1, template.parts().size());
        assertNull(template.componentAt(1));
        assertEquals(1, parser.parse("(a) , ").parts().size());
    }

    @Test
    void emptyTemplateHasNoParts() throws Exception {
        assertTrue(parser.parse("").isEmpty());
        assertTrue(parser.parse("   ").isEmpty());
    }

    @Test
    void lowercaseLettersAreStylesNotIndicators() throws Exception {
        TemplateComponent component = parser.parse("i.").componentAt(0);
        assertNull(component.parent());
        assertEquals("lower-roman", component.style().name());
    }

    @Test
    void repeatedSourcesShareOneTemplate() throws Exception {
        LabelTemplate first = parser.parse("1. ,a) ");
        LabelTemplate second = parser.parse("1. ,a) ");
        parser.parse("A. ");

        assertSame(first, second);
        assertEquals(2, parser.cachedCount());
    }

    @Test
    void unknownStyleReportsPosition() {
        TemplateSyntaxException e =
                assertThrows(TemplateSyntaxException.class, () -> parser.parse("(roman)"));
        assertEquals(1, e.index());
        assertEquals("(roman)", e.source());
        assertTrue(e.getMessage().contains("roman"));
    }

    @Test
    void unquotedWordBeforeStyleIsRejected() {
        TemplateSyntaxException e =
                assertThrows(TemplateSyntaxException.class, () -> parser.parse("Figure 1"));
        assertEquals(0, e.index());
    }

    @Test
    void secondStyleIsRejected() {
        TemplateSyntaxException e =
                assertThrows(TemplateSyntaxException.class, () -> parser.parse("1.a"));
        assertEquals(2, e.index());
    }

    @ParameterizedTest
    @ValueSource(strings = {"*", "1,*,a", " * ", "'unterminated 1", "1.\"x"})
    void malformedTemplatesAreRejected(String source) {
        assertThrows(TemplateSyntaxException.class, () -> parser.parse(source));
    }

    @Test
    void nullSourceIsAContractViolation() {
        assertThrows(IllegalArgumentException.class, () -> parser.parse(null));
    }
}
