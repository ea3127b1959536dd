package org.dxworks.md2jira.renderer;

import java.util.regex.Pattern;

/**
 * Final clean-up of rendered JIRA text: no trailing whitespace on any line, at most one
 * blank line in a row, nothing leading or trailing. Applying it twice changes nothing.
 */
public final class OutputNormalizer {

    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("[ \\t]+$", Pattern.MULTILINE);
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\n{3,}");

    private OutputNormalizer() {}

    public static String normalize(String text) {
        if (text == null) return "";
        // lines are trimmed first so that whitespace-only lines cannot re-form a run afterwards
        String result = TRAILING_WHITESPACE.matcher(text).replaceAll("");
        result = BLANK_LINE_RUN.matcher(result).replaceAll("\n\n");
        return result.strip();
    }
}
