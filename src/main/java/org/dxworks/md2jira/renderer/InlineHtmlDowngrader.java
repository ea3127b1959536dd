package org.dxworks.md2jira.renderer;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Downgrades a fixed set of inline HTML tags to JIRA markup and strips every other tag.
 *
 * Stages run strictly in declaration order. The generic tag stripper must stay last,
 * otherwise the recognized tags lose their wrappers before they are converted.
 */
public final class InlineHtmlDowngrader {

    private static final List<Stage> STAGES = List.of(
            new Stage("<sup>([^<]*)</sup>", "^$1^"),
            new Stage("<sub>([^<]*)</sub>", "~$1~"),
            new Stage("<br\\s*/?>", Matcher.quoteReplacement("\\\\")),
            new Stage("<(?:strong|b)>([^<]*)</(?:strong|b)>", "*$1*"),
            new Stage("<(?:em|i)>([^<]*)</(?:em|i)>", "_$1_"),
            new Stage("<code>([^<]*)</code>", "{{$1}}"),
            new Stage("<(?:del|s)>([^<]*)</(?:del|s)>", "-$1-"),
            new Stage("<u>([^<]*)</u>", "+$1+"),
            new Stage("<[^>]+>", "")
    );

    private InlineHtmlDowngrader() {}

    public static String downgrade(String html) {
        if (html == null || html.isEmpty()) {
            return "";
        }
        String result = html;
        for (Stage stage : STAGES) {
            result = stage.apply(result);
        }
        return result;
    }

    private static final class Stage {
        private final Pattern pattern;
        private final String replacement;

        Stage(String regex, String replacement) {
            this.pattern = Pattern.compile(regex);
            this.replacement = replacement;
        }

        String apply(String input) {
            return pattern.matcher(input).replaceAll(replacement);
        }
    }
}
