package io.simmy.core.tool;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only registry of tools, assembled once at startup from roles and standalone tools.
 */
public final class Toolbox {
    private final Map<String, Tool> tools;
    private final List<Role> roles;

    public Toolbox(List<Role> roles, List<Tool> extraTools) {
        Map<String, Tool> registry = new LinkedHashMap<>();
        List<Role> safeRoles = roles == null ? List.of() : List.copyOf(roles);
        for (Role role : safeRoles) {
            role.tools().forEach(tool -> register(registry, tool));
        }
        if (extraTools != null) {
            extraTools.forEach(tool -> register(registry, tool));
        }
        this.tools = Collections.unmodifiableMap(registry);
        this.roles = safeRoles;
    }

    public static Toolbox of(Tool... tools) {
        return new Toolbox(List.of(), List.of(tools));
    }

    public static Toolbox empty() {
        return new Toolbox(List.of(), List.of());
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> all() {
        return tools.values();
    }

    public List<Role> roles() {
        return roles;
    }

    public List<String> names() {
        return new ArrayList<>(tools.keySet());
    }

    private static void register(Map<String, Tool> registry, Tool tool) {
        if (registry.putIfAbsent(tool.name(), tool) != null) {
            throw new IllegalArgumentException("Duplicate tool name: " + tool.name());
        }
    }
}
