package org.dxworks.md2jira;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.md2jira.converter.ConversionOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class Md2JiraConfig {

    static final String CONFIG_FILE_NAME = "md2jira-config.yml";
    private static final boolean DEFAULT_PRESERVE_RAW_HTML = false;
    private static final boolean DEFAULT_WARN_ON_UNSUPPORTED = false;

    private final boolean preserveRawHtml;
    private final boolean warnOnUnsupported;
    private final Map<String, String> languageAliases;

    private Md2JiraConfig(boolean preserveRawHtml, boolean warnOnUnsupported, Map<String, String> languageAliases) {
        this.preserveRawHtml = preserveRawHtml;
        this.warnOnUnsupported = warnOnUnsupported;
        this.languageAliases = languageAliases;
    }

    public boolean isPreserveRawHtml() {
        return preserveRawHtml;
    }

    public boolean isWarnOnUnsupported() {
        return warnOnUnsupported;
    }

    public Map<String, String> getLanguageAliases() {
        return languageAliases;
    }

    public static Md2JiraConfig defaults() {
        return new Md2JiraConfig(DEFAULT_PRESERVE_RAW_HTML, DEFAULT_WARN_ON_UNSUPPORTED, Map.of());
    }

    /**
     * Loads {@value #CONFIG_FILE_NAME} from the working directory, if present.
     */
    public static Md2JiraConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static Md2JiraConfig load(Path configPath) {
        if (configPath == null || !Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                    .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                boolean effectivePreserveRawHtml = (yamlConfig.preserveRawHtml != null)
                        ? yamlConfig.preserveRawHtml
                        : DEFAULT_PRESERVE_RAW_HTML;
                boolean effectiveWarnOnUnsupported = (yamlConfig.warnOnUnsupported != null)
                        ? yamlConfig.warnOnUnsupported
                        : DEFAULT_WARN_ON_UNSUPPORTED;
                Map<String, String> aliases = (yamlConfig.languageAliases != null)
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(yamlConfig.languageAliases))
                        : Map.of();

                return new Md2JiraConfig(effectivePreserveRawHtml, effectiveWarnOnUnsupported, aliases);
            }
        } catch (IOException e) {
            System.err.println("Warning: could not read " + configPath + ", using defaults: " + e.getMessage());
        }

        return defaults();
    }

    /**
     * Conversion options from this config; command-line switches can only turn features on.
     */
    public ConversionOptions toOptions(boolean preserveRawHtmlFlag, boolean verboseFlag) {
        return ConversionOptions.with(
                        preserveRawHtml || preserveRawHtmlFlag,
                        warnOnUnsupported || verboseFlag,
                        verboseFlag)
                .withLanguageAliases(languageAliases);
    }

    private static class YamlConfig {
        public Boolean preserveRawHtml;
        public Boolean warnOnUnsupported;
        public Map<String, String> languageAliases;
    }
}
