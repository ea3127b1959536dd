package org.dxworks.md2jira.converter;

import org.commonmark.ext.autolink.AutolinkExtension;
import org.commonmark.ext.front.matter.YamlFrontMatterExtension;
import org.commonmark.ext.gfm.strikethrough.StrikethroughExtension;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.task.list.items.TaskListItemsExtension;
import org.commonmark.node.Node;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.dxworks.md2jira.model.ConversionResult;
import org.dxworks.md2jira.renderer.JiraRenderer;
import org.dxworks.md2jira.renderer.OutputNormalizer;
import org.dxworks.md2jira.renderer.RenderContext;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the library: Markdown (CommonMark + GFM tables, strikethrough, task lists,
 * autolinks, YAML front matter) in, JIRA text formatting notation out.
 *
 * Conversion never fails on content. Constructs JIRA cannot express are approximated and,
 * when {@link ConversionOptions#isWarnOnUnsupported()} is set, reported as warnings.
 * Instances are immutable and may be shared between threads.
 */
public class MarkdownToJiraConverter {

    private static final Parser PARSER = Parser.builder()
            .extensions(List.of(
                    TablesExtension.create(),
                    StrikethroughExtension.create(),
                    TaskListItemsExtension.create(),
                    AutolinkExtension.create(),
                    YamlFrontMatterExtension.create()
            ))
            .includeSourceSpans(IncludeSourceSpans.BLOCKS_AND_INLINES)
            .build();

    private static final JiraRenderer RENDERER = new JiraRenderer();

    private final ConversionOptions options;

    public MarkdownToJiraConverter() {
        this(ConversionOptions.defaults());
    }

    public MarkdownToJiraConverter(ConversionOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public ConversionOptions getOptions() {
        return options;
    }

    /** Converts with default options; warnings are discarded. */
    public static String convert(String markdown) {
        return convertWithOptions(markdown, ConversionOptions.defaults()).getOutput();
    }

    public static ConversionResult convertWithOptions(String markdown, ConversionOptions options) {
        String source = markdown == null ? "" : stripBom(markdown);
        Node document = PARSER.parse(source);

        RenderContext ctx = new RenderContext(options, source);
        RENDERER.render(document, ctx);

        return new ConversionResult(OutputNormalizer.normalize(ctx.output()), ctx.warnings());
    }

    /** Converts with this converter's options. */
    public ConversionResult convertWithWarnings(String markdown) {
        return convertWithOptions(markdown, options);
    }

    public void convertReader(Reader in, Writer out) throws IOException {
        StringWriter buffer = new StringWriter();
        in.transferTo(buffer);
        out.write(convertWithWarnings(buffer.toString()).getOutput());
        out.flush();
    }

    public ConversionResult convertFile(Path input) throws IOException {
        return convertWithWarnings(decode(Files.readAllBytes(input)));
    }

    public ConversionResult convertFileToFile(Path input, Path output) throws IOException {
        ConversionResult result = convertFile(input);
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        Files.writeString(output, result.getOutput(), StandardCharsets.UTF_8);
        return result;
    }

    /** UTF-8 decoding shared by every input source; malformed bytes become U+FFFD instead of failing. */
    public static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private static String stripBom(String text) {
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }
}
