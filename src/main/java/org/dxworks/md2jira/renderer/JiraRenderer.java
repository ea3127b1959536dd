package org.dxworks.md2jira.renderer;

import org.commonmark.ext.gfm.tables.TableCell;
import org.commonmark.ext.task.list.items.TaskListItemMarker;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.HtmlBlock;
import org.commonmark.node.HtmlInline;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Link;
import org.commonmark.node.ListBlock;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Text;

import java.util.Optional;

/**
 * Renders a commonmark document tree as JIRA text formatting notation.
 *
 * Depth-first walk: every node gets an enter action, then its children (unless its
 * {@link NodeKind} is a leaf or renders its children itself), then an exit action.
 * The renderer holds no state of its own; everything mutable lives in the {@link RenderContext}
 * of the current call, so one instance can serve any number of threads.
 */
public final class JiraRenderer {

    static final String HTML_BLOCK_WARNING = "HTML block found - converted with best effort";
    static final String FRONT_MATTER_WARNING = "YAML front matter is not supported by JIRA and was dropped";
    static final String NESTED_QUOTE_WARNING = "Nested blockquote flattened into the enclosing {quote}";

    public void render(Node document, RenderContext ctx) {
        walk(document, ctx);
    }

    private void walk(Node node, RenderContext ctx) {
        NodeKind kind = NodeKind.of(node);
        enter(kind, node, ctx);
        if (!kind.isLeaf() && !kind.isSelfManaging()) {
            renderChildren(node, ctx);
        }
        exit(kind, node, ctx);
    }

    private void renderChildren(Node node, RenderContext ctx) {
        for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
            walk(child, ctx);
        }
    }

    private void enter(NodeKind kind, Node node, RenderContext ctx) {
        switch (kind) {
            case HEADING -> ctx.append("h" + ((Heading) node).getLevel() + ". ");
            case TEXT -> ctx.append(ctx.textOf((Text) node));
            case SOFT_LINE_BREAK -> ctx.append("\n");
            case HARD_LINE_BREAK -> ctx.append("\\\\\n");
            case EMPHASIS -> ctx.append("_");
            case STRONG_EMPHASIS -> ctx.append("*");
            case STRIKETHROUGH -> ctx.append("-");
            case CODE_SPAN -> ctx.append("{{").append(((Code) node).getLiteral()).append("}}");
            case FENCED_CODE_BLOCK -> {
                FencedCodeBlock block = (FencedCodeBlock) node;
                renderCodeBlock(ctx, ctx.languages().codeMacroLanguage(block.getInfo()), block.getLiteral());
            }
            case INDENTED_CODE_BLOCK ->
                    renderCodeBlock(ctx, Optional.empty(), ((IndentedCodeBlock) node).getLiteral());
            case LINK -> renderLink(ctx, (Link) node);
            case AUTOLINK -> ctx.append("[").append(((Link) node).getDestination()).append("]");
            case IMAGE -> renderImage(ctx, (Image) node);
            case LIST -> {
                ListBlock list = (ListBlock) node;
                if (ctx.lists().enter(list instanceof OrderedList, list.isTight())) {
                    ctx.append("\n");
                }
            }
            case LIST_ITEM -> ctx.append(ctx.lists().itemPrefix()).append(" ");
            case TASK_CHECKBOX -> ctx.append(((TaskListItemMarker) node).isChecked() ? "(/) " : "( ) ");
            case THEMATIC_BREAK -> ctx.append("----\n\n");
            case BLOCK_QUOTE -> {
                if (ctx.enterBlockquote()) {
                    ctx.append("{quote}\n");
                } else {
                    ctx.warnUnsupported(NESTED_QUOTE_WARNING);
                }
            }
            case HTML_BLOCK -> renderHtmlBlock(ctx, (HtmlBlock) node);
            case HTML_INLINE -> ctx.append(InlineHtmlDowngrader.downgrade(((HtmlInline) node).getLiteral()));
            case TABLE_CELL -> ctx.append(cellMarker((TableCell) node));
            case FRONT_MATTER -> ctx.warnUnsupported(FRONT_MATTER_WARNING);
            case UNKNOWN -> ctx.warnUnsupported("Unsupported element " + node.getClass().getSimpleName()
                    + " rendered as plain content");
            default -> {
                // nothing on enter
            }
        }
    }

    private void exit(NodeKind kind, Node node, RenderContext ctx) {
        switch (kind) {
            case HEADING -> ctx.append("\n\n");
            case PARAGRAPH -> {
                if (!ctx.lists().isInTightList()) {
                    ctx.append("\n\n");
                }
            }
            case EMPHASIS -> ctx.append("_");
            case STRONG_EMPHASIS -> ctx.append("*");
            case STRIKETHROUGH -> ctx.append("-");
            case LIST -> {
                if (ctx.lists().exit()) {
                    ctx.append("\n");
                }
            }
            case LIST_ITEM, TABLE, TABLE_ROW -> ctx.append("\n");
            case TABLE_CELL -> {
                if (node.getNext() == null) {
                    ctx.append(cellMarker((TableCell) node));
                }
            }
            case BLOCK_QUOTE -> {
                if (ctx.exitBlockquote()) {
                    ctx.append("{quote}\n\n");
                }
            }
            default -> {
                // nothing on exit
            }
        }
    }

    private static String cellMarker(TableCell cell) {
        return cell.isHeader() ? "||" : "|";
    }

    private static void renderCodeBlock(RenderContext ctx, Optional<String> language, String literal) {
        ctx.append(language.map(lang -> "{code:" + lang + "}\n").orElse("{code}\n"));
        if (literal != null && !literal.isEmpty()) {
            ctx.append(literal);
            if (!literal.endsWith("\n")) {
                ctx.append("\n");
            }
        }
        ctx.append("{code}\n\n");
    }

    private static void renderHtmlBlock(RenderContext ctx, HtmlBlock block) {
        String html = block.getLiteral() == null ? "" : block.getLiteral();
        if (ctx.options().isPreserveRawHtml()) {
            ctx.append(html);
        } else {
            ctx.append(InlineHtmlDowngrader.downgrade(html));
        }
        ctx.append("\n\n");
        ctx.warnUnsupported(HTML_BLOCK_WARNING);
    }

    private static void renderLink(RenderContext ctx, Link link) {
        StringBuilder text = new StringBuilder();
        for (Node child = link.getFirstChild(); child != null; child = child.getNext()) {
            renderLinkContent(ctx, text, child);
        }

        String url = link.getDestination();
        String label = text.toString();
        if (label.isEmpty() || label.equals(url)) {
            ctx.append("[").append(url).append("]");
        } else {
            ctx.append("[").append(label).append("|").append(url).append("]");
        }
    }

    // Link text only knows about text, code spans and emphasis; everything else is unwrapped.
    private static void renderLinkContent(RenderContext ctx, StringBuilder buf, Node node) {
        switch (NodeKind.of(node)) {
            case TEXT -> buf.append(ctx.textOf((Text) node));
            case CODE_SPAN -> buf.append("{{").append(((Code) node).getLiteral()).append("}}");
            case EMPHASIS -> wrapLinkContent(ctx, buf, node, "_");
            case STRONG_EMPHASIS -> wrapLinkContent(ctx, buf, node, "*");
            default -> {
                for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
                    renderLinkContent(ctx, buf, child);
                }
            }
        }
    }

    private static void wrapLinkContent(RenderContext ctx, StringBuilder buf, Node node, String delimiter) {
        buf.append(delimiter);
        for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
            renderLinkContent(ctx, buf, child);
        }
        buf.append(delimiter);
    }

    private static void renderImage(RenderContext ctx, Image image) {
        StringBuilder alt = new StringBuilder();
        for (Node child = image.getFirstChild(); child != null; child = child.getNext()) {
            if (child instanceof Text text) {
                alt.append(ctx.textOf(text));
            }
        }

        String url = image.getDestination();
        if (alt.length() > 0) {
            ctx.append("!").append(url).append("|alt=").append(alt.toString()).append("!");
        } else {
            ctx.append("!").append(url).append("!");
        }
    }
}
