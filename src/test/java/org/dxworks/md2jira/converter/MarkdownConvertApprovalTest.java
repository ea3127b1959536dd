package org.dxworks.md2jira.converter;

import org.approvaltests.Approvals;
import org.dxworks.md2jira.TestUtils;
import org.dxworks.md2jira.model.ConversionResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;

public class MarkdownConvertApprovalTest {

    @Test
    void convert_Basic() throws IOException {
        verify("Basic.md");
    }

    @Test
    void convert_FrontMatter() throws IOException {
        verify("FrontMatter.md");
    }

    private static void verify(String fileName) throws IOException {
        MarkdownToJiraConverter converter = new MarkdownToJiraConverter(ConversionOptions.with(false, true, false));
        ConversionResult result = converter.convertFile(TestUtils.sample(fileName));
        Approvals.verify(describe(result));
    }

    private static String describe(ConversionResult result) {
        StringBuilder text = new StringBuilder(result.getOutput()).append("\n");
        if (result.hasWarnings()) {
            text.append("\n--- warnings ---\n");
            result.getWarnings().forEach(warning -> text.append("- ").append(warning).append("\n"));
        }
        return text.toString();
    }
}
