package org.dxworks.md2jira.renderer;

import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The Markdown a document was parsed from, used to recover text exactly as it was written.
 *
 * commonmark resolves backslash escapes and entity references in {@link Text#getLiteral()};
 * JIRA output keeps them as typed. The source slice is only trusted when resolving its escapes
 * and entities yields the node's literal again; otherwise the literal is used.
 */
final class SourceText {

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");
    private static final Pattern TASK_MARKER = Pattern.compile("^\\[[ xX]\\]\\s+");
    private static final Pattern TRAILING_SPACES = Pattern.compile(" +$");
    private static final Pattern ENTITY =
            Pattern.compile("&(?:#[xX]([0-9a-fA-F]{1,6})|#([0-9]{1,7})|[A-Za-z][A-Za-z0-9]{1,31});");
    private static final String ESCAPABLE = "!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~";

    private static final SourceText NONE = new SourceText(new String[0]);

    private final String[] lines;

    private SourceText(String[] lines) {
        this.lines = lines;
    }

    static SourceText of(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return NONE;
        }
        return new SourceText(LINE_BREAK.split(markdown, -1));
    }

    static SourceText none() {
        return NONE;
    }

    /** Text of the node as written in the source, or its literal when the source cannot be matched. */
    String verbatim(Text text) {
        String literal = text.getLiteral() == null ? "" : text.getLiteral();
        String raw = slice(text.getSourceSpans());
        if (raw == null || raw.equals(literal)) {
            return literal;
        }

        // Task list markers and spaces before a hard break are cut from the literal, not the span.
        String withoutMarker = TASK_MARKER.matcher(raw).replaceFirst("");
        String[] candidates = {
                raw,
                withoutMarker,
                TRAILING_SPACES.matcher(raw).replaceFirst(""),
                TRAILING_SPACES.matcher(withoutMarker).replaceFirst("")
        };
        for (String candidate : candidates) {
            if (resolvesTo(candidate, 0, literal, 0)) {
                return candidate;
            }
        }
        return literal;
    }

    private String slice(List<SourceSpan> spans) {
        if (spans == null || spans.isEmpty()) {
            return null;
        }
        StringBuilder raw = new StringBuilder();
        for (SourceSpan span : spans) {
            if (span.getLineIndex() < 0 || span.getLineIndex() >= lines.length) {
                return null;
            }
            String line = lines[span.getLineIndex()];
            int start = span.getColumnIndex();
            int end = start + span.getLength();
            if (start < 0 || end > line.length()) {
                return null;
            }
            raw.append(line, start, end);
        }
        return raw.toString();
    }

    /** Whether resolving the escapes and entities of {@code raw} from {@code r} on yields {@code literal} from {@code l} on. */
    private static boolean resolvesTo(String raw, int r, String literal, int l) {
        while (r < raw.length()) {
            char c = raw.charAt(r);
            if (c == '\\' && r + 1 < raw.length() && ESCAPABLE.indexOf(raw.charAt(r + 1)) >= 0) {
                if (l >= literal.length() || literal.charAt(l) != raw.charAt(r + 1)) {
                    return false;
                }
                r += 2;
                l++;
                continue;
            }
            if (c == '&') {
                Matcher entity = ENTITY.matcher(raw).region(r, raw.length());
                if (entity.lookingAt()) {
                    return resolvesEntity(raw, entity, literal, l);
                }
            }
            if (l >= literal.length() || literal.charAt(l) != c) {
                return false;
            }
            r++;
            l++;
        }
        return l == literal.length();
    }

    private static boolean resolvesEntity(String raw, Matcher entity, String literal, int l) {
        int next = entity.end();
        String numeric = decodeNumeric(entity);
        if (numeric != null) {
            return literal.startsWith(numeric, l) && resolvesTo(raw, next, literal, l + numeric.length());
        }
        // Unknown names stay as written, known ones become one or two chars.
        String name = entity.group();
        if (literal.startsWith(name, l) && resolvesTo(raw, next, literal, l + name.length())) {
            return true;
        }
        for (int width = 1; width <= 2 && l + width <= literal.length(); width++) {
            if (resolvesTo(raw, next, literal, l + width)) {
                return true;
            }
        }
        return false;
    }

    private static String decodeNumeric(Matcher entity) {
        int codePoint;
        if (entity.group(1) != null) {
            codePoint = Integer.parseInt(entity.group(1), 16);
        } else if (entity.group(2) != null) {
            codePoint = Integer.parseInt(entity.group(2));
        } else {
            return null;
        }
        if (codePoint == 0 || !Character.isValidCodePoint(codePoint)) {
            return "\uFFFD";
        }
        return new String(Character.toChars(codePoint));
    }
}
