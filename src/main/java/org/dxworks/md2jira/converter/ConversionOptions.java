package org.dxworks.md2jira.converter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Read-only settings of a conversion call.
 */
public final class ConversionOptions {

    private static final ConversionOptions DEFAULTS = new ConversionOptions(false, false, false, Map.of());

    private final boolean preserveRawHtml;
    private final boolean warnOnUnsupported;
    private final boolean verbose;
    private final Map<String, String> languageAliases;

    private ConversionOptions(boolean preserveRawHtml, boolean warnOnUnsupported, boolean verbose,
                              Map<String, String> languageAliases) {
        this.preserveRawHtml = preserveRawHtml;
        this.warnOnUnsupported = warnOnUnsupported;
        this.verbose = verbose;
        this.languageAliases = languageAliases;
    }

    public static ConversionOptions defaults() {
        return DEFAULTS;
    }

    public static ConversionOptions with(boolean preserveRawHtml, boolean warnOnUnsupported, boolean verbose) {
        return new ConversionOptions(preserveRawHtml, warnOnUnsupported, verbose, Map.of());
    }

    public ConversionOptions withLanguageAliases(Map<String, String> aliases) {
        Map<String, String> copy = aliases == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        return new ConversionOptions(preserveRawHtml, warnOnUnsupported, verbose, copy);
    }

    /** Keep HTML verbatim instead of downgrading it to JIRA markup. */
    public boolean isPreserveRawHtml() {
        return preserveRawHtml;
    }

    /** Collect warnings for constructs that were only approximated. */
    public boolean isWarnOnUnsupported() {
        return warnOnUnsupported;
    }

    /** For callers only; has no effect on the output. */
    public boolean isVerbose() {
        return verbose;
    }

    public Map<String, String> getLanguageAliases() {
        return languageAliases;
    }

    @Override
    public String toString() {
        return "ConversionOptions{preserveRawHtml=" + preserveRawHtml
                + ", warnOnUnsupported=" + warnOnUnsupported
                + ", verbose=" + verbose
                + ", languageAliases=" + languageAliases + '}';
    }
}
