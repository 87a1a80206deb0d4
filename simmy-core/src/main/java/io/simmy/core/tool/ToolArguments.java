package io.simmy.core.tool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decoded arguments of one tool call. Accessors return empty when the value is absent
 * or does not have the requested shape.
 */
public final class ToolArguments {
    private static final ToolArguments EMPTY = new ToolArguments(Map.of());

    private final Map<String, Object> values;

    private ToolArguments(Map<String, Object> values) {
        this.values = values;
    }

    public static ToolArguments of(Map<String, ?> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        return new ToolArguments(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    public static ToolArguments empty() {
        return EMPTY;
    }

    public Optional<Object> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public Optional<String> string(String name) {
        Object value = values.get(name);
        return value instanceof String text ? Optional.of(text) : Optional.empty();
    }

    public Optional<Boolean> bool(String name) {
        Object value = values.get(name);
        return value instanceof Boolean flag ? Optional.of(flag) : Optional.empty();
    }

    public Optional<Integer> integer(String name) {
        Object value = values.get(name);
        if (value instanceof Number number) {
            return Optional.of(number.intValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Integer.parseInt(text.trim()));
            } catch (NumberFormatException ignored) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Optional<List<String>> stringList(String name) {
        Object value = values.get(name);
        if (!(value instanceof List<?> items)) {
            return Optional.empty();
        }
        List<String> strings = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof String text)) {
                return Optional.empty();
            }
            strings.add(text);
        }
        return Optional.of(List.copyOf(strings));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
