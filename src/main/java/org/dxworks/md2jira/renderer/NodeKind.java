package org.dxworks.md2jira.renderer;

import org.commonmark.ext.front.matter.YamlFrontMatterBlock;
import org.commonmark.ext.gfm.strikethrough.Strikethrough;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TableBody;
import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.gfm.tables.TableHead;
import org.commonmark.ext.gfm.tables.TableRow;
import org.commonmark.ext.task.list.items.TaskListItemMarker;
import org.commonmark.node.BlockQuote;
import org.commonmark.node.Code;
import org.commonmark.node.Document;
import org.commonmark.node.Emphasis;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.HardLineBreak;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.LinkReferenceDefinition;
import org.commonmark.node.ListBlock;
import org.commonmark.node.ListItem;
import org.commonmark.node.Node;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SoftLineBreak;
import org.commonmark.node.StrongEmphasis;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;

/**
 * Closed set of node kinds the renderer knows how to emit.
 * Every commonmark node maps to exactly one kind; anything not recognized is {@link #UNKNOWN}.
 */
public enum NodeKind {
    DOCUMENT(Shape.CONTAINER),
    HEADING(Shape.CONTAINER),
    PARAGRAPH(Shape.CONTAINER),
    TEXT(Shape.LEAF),
    SOFT_LINE_BREAK(Shape.LEAF),
    HARD_LINE_BREAK(Shape.LEAF),
    EMPHASIS(Shape.CONTAINER),
    STRONG_EMPHASIS(Shape.CONTAINER),
    CODE_SPAN(Shape.LEAF),
    FENCED_CODE_BLOCK(Shape.LEAF),
    INDENTED_CODE_BLOCK(Shape.LEAF),
    LINK(Shape.SELF_MANAGING),
    AUTOLINK(Shape.SELF_MANAGING),
    IMAGE(Shape.SELF_MANAGING),
    LIST(Shape.CONTAINER),
    LIST_ITEM(Shape.CONTAINER),
    THEMATIC_BREAK(Shape.LEAF),
    BLOCK_QUOTE(Shape.CONTAINER),
    HTML_BLOCK(Shape.LEAF),
    HTML_INLINE(Shape.LEAF),
    TABLE(Shape.CONTAINER),
    TABLE_SECTION(Shape.CONTAINER),
    TABLE_ROW(Shape.CONTAINER),
    TABLE_CELL(Shape.CONTAINER),
    STRIKETHROUGH(Shape.CONTAINER),
    TASK_CHECKBOX(Shape.LEAF),
    FRONT_MATTER(Shape.LEAF),
    LINK_REFERENCE_DEFINITION(Shape.LEAF),
    UNKNOWN(Shape.CONTAINER);

    private enum Shape { LEAF, CONTAINER, SELF_MANAGING }

    private final Shape shape;

    NodeKind(Shape shape) {
        this.shape = shape;
    }

    /** Leaf kinds take their content straight from the node, even when it has children. */
    public boolean isLeaf() {
        return shape == Shape.LEAF;
    }

    /** Self-managing kinds render their own children with a restricted rule set. */
    public boolean isSelfManaging() {
        return shape == Shape.SELF_MANAGING;
    }

    public static NodeKind of(Node node) {
        if (node instanceof Document) return DOCUMENT;
        if (node instanceof Heading) return HEADING;
        if (node instanceof Paragraph) return PARAGRAPH;
        if (node instanceof Text) return TEXT;
        if (node instanceof SoftLineBreak) return SOFT_LINE_BREAK;
        if (node instanceof HardLineBreak) return HARD_LINE_BREAK;
        if (node instanceof Emphasis) return EMPHASIS;
        if (node instanceof StrongEmphasis) return STRONG_EMPHASIS;
        if (node instanceof Code) return CODE_SPAN;
        if (node instanceof FencedCodeBlock) return FENCED_CODE_BLOCK;
        if (node instanceof IndentedCodeBlock) return INDENTED_CODE_BLOCK;
        if (node instanceof Link link) return isAutolink(link) ? AUTOLINK : LINK;
        if (node instanceof Image) return IMAGE;
        if (node instanceof ListBlock) return LIST;
        if (node instanceof ListItem) return LIST_ITEM;
        if (node instanceof ThematicBreak) return THEMATIC_BREAK;
        if (node instanceof BlockQuote) return BLOCK_QUOTE;
        if (node instanceof HtmlBlock) return HTML_BLOCK;
        if (node instanceof HtmlInline) return HTML_INLINE;
        if (node instanceof TableBlock) return TABLE;
        if (node instanceof TableHead || node instanceof TableBody) return TABLE_SECTION;
        if (node instanceof TableRow) return TABLE_ROW;
        if (node instanceof TableCell) return TABLE_CELL;
        if (node instanceof Strikethrough) return STRIKETHROUGH;
        if (node instanceof TaskListItemMarker) return TASK_CHECKBOX;
        if (node instanceof YamlFrontMatterBlock) return FRONT_MATTER;
        if (node instanceof LinkReferenceDefinition) return LINK_REFERENCE_DEFINITION;
        return UNKNOWN;
    }

    /**
     * commonmark has no dedicated autolink node: both {@code <https://...>} and bare URLs
     * become a link whose only child is the URL text (or the address, for mailto links).
     */
    private static boolean isAutolink(Link link) {
        Node child = link.getFirstChild();
        if (!(child instanceof Text) || child.getNext() != null) {
            return false;
        }
        String label = ((Text) child).getLiteral();
        String destination = link.getDestination();
        return label.equals(destination) || ("mailto:" + label).equals(destination);
    }
}
