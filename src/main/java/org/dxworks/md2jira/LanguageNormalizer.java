package org.dxworks.md2jira;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps informal code-fence language tags to the names the JIRA {code} macro understands.
 * Unknown tags pass through unchanged; {@value #NO_LANGUAGE} means "plain {code}, no tag".
 */
public final class LanguageNormalizer {

    public static final String NO_LANGUAGE = "none";

    private static final Map<String, String> BUILT_IN;

    static {
        Map<String, String> m = new HashMap<>();
        m.put("js", "javascript");
        m.put("javascript", "javascript");
        m.put("ts", "typescript");
        m.put("typescript", "typescript");
        m.put("py", "python");
        m.put("python", "python");
        m.put("rb", "ruby");
        m.put("ruby", "ruby");
        m.put("sh", "bash");
        m.put("bash", "bash");
        m.put("shell", "bash");
        m.put("json", "json");
        m.put("xml", "xml");
        m.put("html", "html");
        m.put("css", "css");
        m.put("sql", "sql");
        m.put("java", "java");
        m.put("go", "go");
        m.put("golang", "go");
        m.put("rust", "rust");
        m.put("c", "cpp");
        m.put("cpp", "cpp");
        m.put("c++", "cpp");
        m.put("yaml", "yaml");
        m.put("yml", "yaml");
        m.put("php", "php");
        m.put("swift", "swift");
        m.put("kotlin", "kotlin");
        m.put("scala", "scala");
        m.put("r", "r");
        m.put("perl", "perl");
        m.put("groovy", "groovy");
        m.put("powershell", "powershell");
        m.put("ps1", "powershell");
        m.put("dockerfile", "dockerfile");
        m.put("makefile", "makefile");
        m.put("markdown", NO_LANGUAGE);
        m.put("md", NO_LANGUAGE);
        m.put("text", NO_LANGUAGE);
        m.put("txt", NO_LANGUAGE);
        m.put("plaintext", NO_LANGUAGE);
        BUILT_IN = Collections.unmodifiableMap(m);
    }

    private static final LanguageNormalizer DEFAULT = new LanguageNormalizer(BUILT_IN);

    private final Map<String, String> mapping;

    private LanguageNormalizer(Map<String, String> mapping) {
        this.mapping = mapping;
    }

    public static LanguageNormalizer defaults() {
        return DEFAULT;
    }

    /**
     * Built-in table overlaid with user aliases. Alias keys are matched case-insensitively
     * and win over built-in entries.
     */
    public static LanguageNormalizer withAliases(Map<String, String> aliases) {
        if (aliases == null || aliases.isEmpty()) {
            return DEFAULT;
        }
        Map<String, String> merged = new HashMap<>(BUILT_IN);
        for (Map.Entry<String, String> e : aliases.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            merged.put(normalizeKey(e.getKey()), e.getValue().trim());
        }
        return new LanguageNormalizer(Collections.unmodifiableMap(merged));
    }

    /**
     * Maps a language name; names not in the table are returned lower-cased and trimmed.
     */
    public String map(String language) {
        String key = normalizeKey(language);
        return mapping.getOrDefault(key, key);
    }

    /**
     * Language for a {code:LANG} macro, taken from the first word of a fence info string.
     * Empty when the fence has no language or it maps to {@value #NO_LANGUAGE}.
     */
    public Optional<String> codeMacroLanguage(String fenceInfo) {
        if (fenceInfo == null || fenceInfo.isBlank()) {
            return Optional.empty();
        }
        String firstWord = fenceInfo.trim().split("\\s+", 2)[0];
        String mapped = map(firstWord);
        if (mapped.isEmpty() || NO_LANGUAGE.equals(mapped)) {
            return Optional.empty();
        }
        return Optional.of(mapped);
    }

    private static String normalizeKey(String language) {
        return language == null ? "" : language.trim().toLowerCase(Locale.ROOT);
    }
}
