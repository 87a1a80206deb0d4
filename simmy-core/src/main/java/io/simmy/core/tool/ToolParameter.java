package io.simmy.core.tool;

import java.util.Objects;

public record ToolParameter(String name, ParameterType type, String description, ParameterType itemType) {

    public ToolParameter {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(type, "type must not be null");
        description = description == null ? "" : description;
        if (itemType != null && type != ParameterType.ARRAY) {
            throw new IllegalArgumentException("Only array parameters declare an item type: " + name);
        }
    }
}
