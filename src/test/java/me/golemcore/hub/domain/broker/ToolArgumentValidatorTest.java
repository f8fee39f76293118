package me.golemcore.hub.domain.broker;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolArgumentValidatorTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "required", List.of("path"),
            "additionalProperties", false,
            "properties", Map.of(
                    "path", Map.of("type", "string"),
                    "mode", Map.of("type", "string", "enum", List.of("r", "w")),
                    "lines", Map.of("type", "array", "items", Map.of("type", "integer"))));

    @Test
    void shouldAcceptConformingArguments() {
        assertTrue(ToolArgumentValidator.validate(SCHEMA,
                Map.of("path", "/tmp/a", "mode", "r", "lines", List.of(1, 2))).isEmpty());
    }

    @Test
    void shouldReportMissingRequiredProperty() {
        List<String> violations = ToolArgumentValidator.validate(SCHEMA, Map.of("mode", "r"));

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("path"));
    }

    @Test
    void shouldReportWrongTypesEnumAndUnknownProperties() {
        List<String> violations = ToolArgumentValidator.validate(SCHEMA,
                Map.of("path", 7, "mode", "x", "lines", List.of("one"), "force", true));

        assertEquals(4, violations.size());
    }

    @Test
    void shouldAcceptAnythingWithoutSchema() {
        assertTrue(ToolArgumentValidator.validate(null, Map.of("x", 1)).isEmpty());
    }
}
