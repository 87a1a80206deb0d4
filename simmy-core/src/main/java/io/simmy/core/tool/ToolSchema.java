package io.simmy.core.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declared argument shape of a tool: a top-level object with typed properties and a required list.
 * The same declaration is advertised to the model and used to validate calls before execution.
 */
public final class ToolSchema {
    private static final ToolSchema EMPTY = new ToolSchema(List.of(), Set.of());

    private final List<ToolParameter> parameters;
    private final Set<String> required;

    private ToolSchema(List<ToolParameter> parameters, Set<String> required) {
        this.parameters = List.copyOf(parameters);
        this.required = Set.copyOf(required);
    }

    public static ToolSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ToolParameter> parameters() {
        return parameters;
    }

    public boolean isRequired(String name) {
        return required.contains(name);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (ToolParameter parameter : parameters) {
            Map<String, Object> property = new LinkedHashMap<>();
            property.put("type", parameter.type().wireName());
            property.put("description", parameter.description());
            if (parameter.itemType() != null) {
                property.put("items", Map.of("type", parameter.itemType().wireName()));
            }
            properties.put(parameter.name(), property);
        }

        List<String> requiredNames = new ArrayList<>();
        for (ToolParameter parameter : parameters) {
            if (required.contains(parameter.name())) {
                requiredNames.add(parameter.name());
            }
        }

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", requiredNames);
        return schema;
    }

    public List<String> validate(ToolArguments arguments) {
        List<String> violations = new ArrayList<>();
        for (ToolParameter parameter : parameters) {
            Object value = arguments.get(parameter.name()).orElse(null);
            if (value == null) {
                if (required.contains(parameter.name())) {
                    violations.add("Missing required argument '" + parameter.name() + "'");
                }
                continue;
            }
            if (!parameter.type().matches(value)) {
                violations.add("Argument '" + parameter.name() + "' must be of type " + parameter.type().wireName());
                continue;
            }
            if (parameter.itemType() != null && value instanceof List<?> items) {
                for (Object item : items) {
                    if (!parameter.itemType().matches(item)) {
                        violations.add("Argument '" + parameter.name() + "' must only contain "
                            + parameter.itemType().wireName() + " items");
                        break;
                    }
                }
            }
        }
        return violations;
    }

    public static final class Builder {
        private final Map<String, ToolParameter> parameters = new LinkedHashMap<>();
        private final Set<String> required = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder string(String name, String description, boolean isRequired) {
            return add(new ToolParameter(name, ParameterType.STRING, description, null), isRequired);
        }

        public Builder integer(String name, String description, boolean isRequired) {
            return add(new ToolParameter(name, ParameterType.INTEGER, description, null), isRequired);
        }

        public Builder bool(String name, String description, boolean isRequired) {
            return add(new ToolParameter(name, ParameterType.BOOLEAN, description, null), isRequired);
        }

        public Builder stringArray(String name, String description, boolean isRequired) {
            return add(new ToolParameter(name, ParameterType.ARRAY, description, ParameterType.STRING), isRequired);
        }

        public Builder add(ToolParameter parameter, boolean isRequired) {
            if (parameters.putIfAbsent(parameter.name(), parameter) != null) {
                throw new IllegalArgumentException("Duplicate parameter: " + parameter.name());
            }
            if (isRequired) {
                required.add(parameter.name());
            }
            return this;
        }

        public ToolSchema build() {
            return new ToolSchema(new ArrayList<>(parameters.values()), required);
        }
    }
}
