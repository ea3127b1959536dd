package org.dxworks.md2jira.renderer;

import org.commonmark.node.Text;
import org.dxworks.md2jira.LanguageNormalizer;
import org.dxworks.md2jira.converter.ConversionOptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Mutable state of a single conversion. Never shared between calls or threads.
 */
public final class RenderContext {

    private final StringBuilder out = new StringBuilder();
    private final ListNestingTracker lists = new ListNestingTracker();
    private final List<String> warnings = new ArrayList<>();
    private final ConversionOptions options;
    private final LanguageNormalizer languages;
    private final SourceText source;
    private int blockquoteDepth;

    /** Context for a tree built without source text: text nodes render their literals. */
    public RenderContext(ConversionOptions options) {
        this(options, null);
    }

    /**
     * @param markdown the exact string the document was parsed from, with source spans enabled
     */
    public RenderContext(ConversionOptions options, String markdown) {
        this.options = Objects.requireNonNull(options, "options");
        this.languages = LanguageNormalizer.withAliases(options.getLanguageAliases());
        this.source = markdown == null ? SourceText.none() : SourceText.of(markdown);
    }

    RenderContext append(String text) {
        out.append(text);
        return this;
    }

    ListNestingTracker lists() {
        return lists;
    }

    ConversionOptions options() {
        return options;
    }

    LanguageNormalizer languages() {
        return languages;
    }

    String textOf(Text text) {
        return source.verbatim(text);
    }

    /** @return true if this is the outermost blockquote */
    boolean enterBlockquote() {
        return ++blockquoteDepth == 1;
    }

    /** @return true if the outermost blockquote was just left */
    boolean exitBlockquote() {
        blockquoteDepth = Math.max(0, blockquoteDepth - 1);
        return blockquoteDepth == 0;
    }

    /** Records a warning, only if the caller asked for them. */
    void warnUnsupported(String message) {
        if (options.isWarnOnUnsupported()) {
            warnings.add(message);
        }
    }

    public String output() {
        return out.toString();
    }

    public List<String> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    public int openLists() {
        return lists.depth();
    }
}
