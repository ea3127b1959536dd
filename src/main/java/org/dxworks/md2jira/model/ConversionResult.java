package org.dxworks.md2jira.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JIRA text produced by one conversion, plus the warnings collected along the way.
 */
public final class ConversionResult {

    private final String output;
    private final List<String> warnings;

    @JsonCreator
    public ConversionResult(@JsonProperty("output") String output,
                            @JsonProperty("warnings") List<String> warnings) {
        this.output = output == null ? "" : output;
        this.warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public String getOutput() {
        return output;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
