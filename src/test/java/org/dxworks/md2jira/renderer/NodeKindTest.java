package org.dxworks.md2jira.renderer;

import org.commonmark.node.Image;
import org.commonmark.node.Link;
import org.commonmark.node.Paragraph;
import org.commonmark.node.Text;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class NodeKindTest {

    @Test
    void linkWithUrlAsTextIsAutolink() {
        Link link = new Link("https://x.org", null);
        link.appendChild(new Text("https://x.org"));
        assertEquals(NodeKind.AUTOLINK, NodeKind.of(link));

        Link mail = new Link("mailto:a@x.org", null);
        mail.appendChild(new Text("a@x.org"));
        assertEquals(NodeKind.AUTOLINK, NodeKind.of(mail));

        Link labelled = new Link("https://x.org", null);
        labelled.appendChild(new Text("docs"));
        assertEquals(NodeKind.LINK, NodeKind.of(labelled));
    }

    @Test
    void shapesDecideWhoWalksChildren() {
        assertTrue(NodeKind.of(new Text("x")).isLeaf());
        assertTrue(NodeKind.of(new Image("i.png", null)).isSelfManaging());

        NodeKind paragraph = NodeKind.of(new Paragraph());
        assertFalse(paragraph.isLeaf());
        assertFalse(paragraph.isSelfManaging());
    }

}
