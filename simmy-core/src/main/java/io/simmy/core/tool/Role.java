package io.simmy.core.tool;

import java.util.List;
import java.util.Objects;

/**
 * A named bundle of tools with an identity line the agent can present in its system prompt.
 */
public record Role(String name, String identity, List<Tool> tools) {

    public Role {
        Objects.requireNonNull(name, "name must not be null");
        identity = identity == null ? "" : identity;
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
