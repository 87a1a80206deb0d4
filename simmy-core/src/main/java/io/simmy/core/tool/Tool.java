package io.simmy.core.tool;

/**
 * A named capability the model can invoke. Implementations report failures as text
 * so the model always receives a coherent result.
 */
public interface Tool {
    String name();

    String description();

    default ToolSchema schema() {
        return ToolSchema.empty();
    }

    String execute(ToolArguments arguments, ToolContext context);
}
