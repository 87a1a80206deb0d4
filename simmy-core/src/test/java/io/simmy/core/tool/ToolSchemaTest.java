package io.simmy.core.tool;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ToolSchemaTest {

    private final ToolSchema schema = ToolSchema.builder()
        .string("description", "What to do", true)
        .stringArray("requirements", "Steps", true)
        .bool("completed", "Done already", false)
        .build();

    @Test
    void shouldRenderJsonSchemaObject() {
        Map<String, Object> rendered = schema.toMap();

        assertThat(rendered).containsEntry("type", "object");
        assertThat(rendered.get("required")).isEqualTo(List.of("description", "requirements"));
        @SuppressWarnings("unchecked")
        Map<String, Object> properties = (Map<String, Object>) rendered.get("properties");
        assertThat(properties).containsOnlyKeys("description", "requirements", "completed");
        assertThat(properties.get("requirements"))
            .isEqualTo(Map.of("type", "array", "description", "Steps", "items", Map.of("type", "string")));
    }

    @Test
    void shouldAcceptWellFormedArguments() {
        ToolArguments arguments = ToolArguments.of(Map.of(
            "description", "Write report",
            "requirements", List.of("outline", "draft")
        ));

        assertThat(schema.validate(arguments)).isEmpty();
    }

    @Test
    void shouldReportMissingAndMistypedArguments() {
        ToolArguments arguments = ToolArguments.of(Map.of(
            "requirements", "not a list",
            "completed", "yes"
        ));

        assertThat(schema.validate(arguments)).containsExactly(
            "Missing required argument 'description'",
            "Argument 'requirements' must be of type array",
            "Argument 'completed' must be of type boolean"
        );
    }

    @Test
    void shouldRejectNonStringArrayItems() {
        ToolArguments arguments = ToolArguments.of(Map.of(
            "description", "Write report",
            "requirements", Arrays.asList("outline", 3)
        ));

        assertThat(schema.validate(arguments)).containsExactly("Argument 'requirements' must only contain string items");
    }

    @Test
    void shouldTreatNullValuesAsMissing() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("description", null);
        raw.put("requirements", List.of("a"));

        assertThat(schema.validate(ToolArguments.of(raw))).containsExactly("Missing required argument 'description'");
    }

    @Test
    void shouldExposeTypedAccessors() {
        ToolArguments arguments = ToolArguments.of(Map.of(
            "text", "hi",
            "count", 3,
            "countText", "7",
            "flag", true,
            "items", List.of("a", "b")
        ));

        assertThat(arguments.string("text")).contains("hi");
        assertThat(arguments.string("count")).isEmpty();
        assertThat(arguments.integer("count")).contains(3);
        assertThat(arguments.integer("countText")).contains(7);
        assertThat(arguments.bool("flag")).contains(true);
        assertThat(arguments.stringList("items")).contains(List.of("a", "b"));
        assertThat(arguments.stringList("text")).isEmpty();
    }
}
