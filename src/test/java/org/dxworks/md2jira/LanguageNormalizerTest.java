package org.dxworks.md2jira;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

public class LanguageNormalizerTest {

    private final LanguageNormalizer languages = LanguageNormalizer.defaults();

    @Test
    void map_KnownAliases() {
        assertEquals("javascript", languages.map("js"));
        assertEquals("typescript", languages.map("ts"));
        assertEquals("bash", languages.map("shell"));
        assertEquals("cpp", languages.map("c++"));
        assertEquals("go", languages.map("golang"));
        assertEquals("powershell", languages.map("ps1"));
        assertEquals("yaml", languages.map("yml"));
    }

    @Test
    void map_CaseAndWhitespaceInsensitive() {
        assertEquals("python", languages.map("  PY "));
    }

    @Test
    void map_UnknownPassesThrough() {
        assertEquals("haskell", languages.map("Haskell"));
    }

    @Test
    void map_PlainTextIsNone() {
        assertEquals(LanguageNormalizer.NO_LANGUAGE, languages.map("txt"));
        assertEquals(LanguageNormalizer.NO_LANGUAGE, languages.map("markdown"));
    }

    @Test
    void codeMacroLanguage() {
        assertEquals(Optional.of("javascript"), languages.codeMacroLanguage("js"));
        assertEquals(Optional.of("ruby"), languages.codeMacroLanguage("rb linenums"));
        assertEquals(Optional.empty(), languages.codeMacroLanguage("plaintext"));
        assertEquals(Optional.empty(), languages.codeMacroLanguage("   "));
        assertEquals(Optional.empty(), languages.codeMacroLanguage(null));
    }

    @Test
    void withAliases_OverrideBuiltIns() {
        LanguageNormalizer custom = LanguageNormalizer.withAliases(Map.of("JS", "js", "tf", "hcl"));
        assertEquals("js", custom.map("js"));
        assertEquals("hcl", custom.map("TF"));
        assertEquals("python", custom.map("py"));
    }

    @Test
    void withAliases_EmptyIsDefault() {
        assertSame(LanguageNormalizer.defaults(), LanguageNormalizer.withAliases(Map.of()));
        assertSame(LanguageNormalizer.defaults(), LanguageNormalizer.withAliases(null));
    }
}
