package org.dxworks.md2jira;

import org.dxworks.md2jira.converter.ConversionOptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class Md2JiraConfigTest {

    @Test
    void load_MissingFileGivesDefaults(@TempDir Path dir) {
        Md2JiraConfig config = Md2JiraConfig.load(dir.resolve("absent.yml"));
        assertFalse(config.isPreserveRawHtml());
        assertFalse(config.isWarnOnUnsupported());
        assertTrue(config.getLanguageAliases().isEmpty());
    }

    @Test
    void load_ReadsAllKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("md2jira-config.yml");
        Files.writeString(file, "preserveRawHtml: true\n"
                + "warnOnUnsupported: true\n"
                + "languageAliases:\n"
                + "  tf: hcl\n"
                + "  zsh: bash\n");

        Md2JiraConfig config = Md2JiraConfig.load(file);

        assertTrue(config.isPreserveRawHtml());
        assertTrue(config.isWarnOnUnsupported());
        assertEquals(Map.of("tf", "hcl", "zsh", "bash"), config.getLanguageAliases());
    }

    @Test
    void load_PartialFileKeepsDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("config.yml");
        Files.writeString(file, "warnOnUnsupported: true\nsomethingElse: 3\n");

        Md2JiraConfig config = Md2JiraConfig.load(file);

        assertFalse(config.isPreserveRawHtml());
        assertTrue(config.isWarnOnUnsupported());
    }

    @Test
    void load_MalformedFileFallsBackToDefaults(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "preserveRawHtml: [unclosed\n");

        Md2JiraConfig config = Md2JiraConfig.load(file);

        assertFalse(config.isPreserveRawHtml());
    }

    @Test
    void toOptions_FlagsOnlyEnableFeatures() {
        ConversionOptions options = Md2JiraConfig.defaults().toOptions(true, true);
        assertTrue(options.isPreserveRawHtml());
        assertTrue(options.isWarnOnUnsupported());
        assertTrue(options.isVerbose());

        ConversionOptions none = Md2JiraConfig.defaults().toOptions(false, false);
        assertFalse(none.isPreserveRawHtml());
        assertFalse(none.isWarnOnUnsupported());
        assertFalse(none.isVerbose());
    }
}
