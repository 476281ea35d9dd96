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
package net.boyechko.pdf.autolabel.label;

import static org.junit.jupiter.api.Assertions.*;

import net.boyechko.pdf.autolabel.config.LabelConfig;
import net.boyechko.pdf.autolabel.document.DocNode;
import net.boyechko.pdf.autolabel.document.ElementKind;
import net.boyechko.pdf.autolabel.issue.IssueSev;
import net.boyechko.pdf.autolabel.issue.IssueType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CrossReferenceResolverTest {
    private final LabelConfig config =
            LabelConfig.none()
                    .withTemplate(ElementKind.HEADING, "1,H.1")
                    .withTemplate(ElementKind.FIGURE, "'Figure 'H1.1")
                    .withTemplate(ElementKind.ORDERED_LIST, "1.,L.a");
    private final CrossReferenceResolver resolver = new CrossReferenceResolver();

    private DocNode root;
    private DocNode figure;
    private DocNode step;

    @BeforeEach
    void buildDocument() {
        root = DocNode.other("Document");
        root.addChild(DocNode.heading(1));
        root.addChild(DocNode.heading(1));
        root.addChild(DocNode.heading(1).withId("results"));
        figure = root.addChild(DocNode.figure().withId("fig"));
        root.addChild(DocNode.heading(2).withId("method"));
        DocNode list = root.addChild(DocNode.orderedList());
        list.addChild(DocNode.listItem());
        DocNode nested = list.addChild(DocNode.listItem()).addChild(DocNode.orderedList());
        nested.addChild(DocNode.listItem());
        step = nested.addChild(DocNode.listItem().withId("step"));
    }

    private String resolve(String href, String text) {
        DocNode link = root.addChild(DocNode.link(href, text));
        Allocation allocation = new LabelAllocator(config).allocate(root);
        resolver.resolve(allocation);
        return link.text();
    }

    @Test
    void headingQualifierInsertsEnclosingHeadingNumber() {
        assertEquals("see 3.", resolve("#fig", "see ##H."));
    }

    @Test
    void barePlaceholderInsertsFullLabel() {
        assertEquals("see Figure 3.1", resolve("#fig", "see ##"));
        assertNull(figure.label());
    }

    @Test
    void levelledAndBracedQualifiers() {
        assertEquals("3 / 3.1", resolve("#method", "##{h1} / ##H2"));
        assertEquals("3", resolve("#fig", "##h"));
    }

    @Test
    void anyQualifierTakesNearestLabelIncludingTarget() {
        assertEquals("3.1", resolve("#fig", "##X"));
    }

    @Test
    void listQualifierUsesItemLabels() {
        assertEquals("step 2.b under 3.1", resolve("#step", "step ## under ##H"));
        assertEquals("2.b", resolve("#step", "##L"));
    }

    @Test
    void escapedPlaceholderIsKept() {
        assertEquals("use ## for labels, see 3.1", resolve("#method", "use \\## for labels, see ##"));
    }

    @Test
    void unknownTargetRemovesPlaceholderAndWarns() {
        DocNode link = root.addChild(DocNode.link("#nowhere", "see ##."));
        Allocation allocation = new LabelAllocator(config).allocate(root);

        int changed = resolver.resolve(allocation);

        assertEquals(1, changed);
        assertEquals("see .", link.text());
        assertEquals(1, allocation.issues().ofType(IssueType.UNRESOLVED_REFERENCE).size());
        assertEquals(IssueSev.WARNING, allocation.issues().get(0).severity());
    }

    @Test
    void missingQualifiedLabelIsUnresolved() {
        assertEquals("item ", resolve("#fig", "item ##L"));
    }

    @Test
    void textWithoutPlaceholdersIsUntouched() {
        DocNode link = root.addChild(DocNode.link("#fig", "Figure one"));
        Allocation allocation = new LabelAllocator(config).allocate(root);

        assertEquals(0, resolver.resolve(allocation));
        assertEquals("Figure one", link.text());
    }

    @Test
    void suppressedTargetInsertsNothing() {
        DocNode list = root.addChild(DocNode.orderedList());
        list.addChild(DocNode.listItem());
        DocNode sub = list.addChild(DocNode.listItem()).addChild(DocNode.orderedList());
        sub.addChild(DocNode.listItem().withNoLabel().withId("sub"));

        assertEquals("see ", resolve("#sub", "see ##"));
    }

    @Test
    void unlabelledFigureInsideItemInsertsNothing() {
        DocNode list = root.addChild(DocNode.orderedList());
        list.addChild(DocNode.listItem())
                .addChild(DocNode.figure().withTemplate("").withId("plain"));

        assertEquals("see ", resolve("#plain", "see ##"));
        assertEquals("1", resolve("#plain", "##L"));
    }

    @Test
    void wordsAfterQualifierLetterAreNotQualifiers() {
        assertEquals("Figure 3.1Hello", resolve("#fig", "##Hello"));
    }
}
