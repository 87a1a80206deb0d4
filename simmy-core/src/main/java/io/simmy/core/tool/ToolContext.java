package io.simmy.core.tool;

import io.simmy.core.bus.EventBus;
import java.nio.file.Path;
import java.util.Objects;

public record ToolContext(EventBus bus, Path workspace) {

    public ToolContext {
        Objects.requireNonNull(bus, "bus must not be null");
    }

    public ToolContext(EventBus bus) {
        this(bus, null);
    }
}
