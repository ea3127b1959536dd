package org.dxworks.md2jira.model;

import org.dxworks.md2jira.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConversionResultTest {

    @Test
    void warningsAreCopied() {
        List<String> warnings = new ArrayList<>(List.of("w1"));
        ConversionResult result = new ConversionResult("out", warnings);
        warnings.add("w2");

        assertEquals(List.of("w1"), result.getWarnings());
        assertTrue(result.hasWarnings());
        assertThrows(UnsupportedOperationException.class, () -> result.getWarnings().add("x"));
    }

    @Test
    void nullsBecomeEmpty() {
        ConversionResult result = new ConversionResult(null, null);
        assertEquals("", result.getOutput());
        assertFalse(result.hasWarnings());
    }

    @Test
    void json_HasOutputAndWarningsOnly() throws Exception {
        String json = TestUtils.JSON_MAPPER.writeValueAsString(new ConversionResult("h1. T", List.of("w")));
        assertEquals("{\"output\":\"h1. T\",\"warnings\":[\"w\"]}", json);
    }
}
