package org.dxworks.md2jira.renderer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class OutputNormalizerTest {

    @Test
    void collapsesBlankLineRuns() {
        assertEquals("a\n\nb", OutputNormalizer.normalize("a\n\n\n\nb"));
    }

    @Test
    void keepsSingleBlankLine() {
        assertEquals("a\n\nb\nc", OutputNormalizer.normalize("a\n\nb\nc"));
    }

    @Test
    void trimsTrailingWhitespacePerLine() {
        assertEquals("a\n  b", OutputNormalizer.normalize("a  \t\n  b   "));
    }

    @Test
    void trimsWholeResult() {
        assertEquals("a", OutputNormalizer.normalize("\n\n  a\n\n\n"));
    }

    @Test
    void whitespaceOnlyLinesDoNotLeaveRuns() {
        assertEquals("a\n\nb", OutputNormalizer.normalize("a\n\n \n\nb"));
    }

    @Test
    void idempotent() {
        String[] inputs = {"a\n\n \n\nb  ", "x\n\n\n\n\ny\t\n", "  lead\n\n\n", "", "h1. T\n\n* a\n* b\n\n\n"};
        for (String input : inputs) {
            String once = OutputNormalizer.normalize(input);
            assertEquals(once, OutputNormalizer.normalize(once));
        }
    }

    @Test
    void nullIsEmpty() {
        assertEquals("", OutputNormalizer.normalize(null));
    }
}
