package io.simmy.core.agency;

import io.simmy.core.tool.Tool;
import io.simmy.core.tool.ToolArguments;
import io.simmy.core.tool.ToolContext;
import io.simmy.core.tool.ToolSchema;
import java.util.List;
import java.util.Optional;

final class CreateTaskTool implements Tool {
    private static final ToolSchema SCHEMA = ToolSchema.builder()
        .string("description", "A description of the overall task.", true)
        .stringArray("requirements", "A list of requirements for the task.", true)
        .bool("completed", "Whether the task is currently completed. Defaults to false.", false)
        .build();

    private final TaskTracker tracker;

    CreateTaskTool(TaskTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public String name() {
        return "create_task";
    }

    @Override
    public String description() {
        return "Use this tool to create a new task.";
    }

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public String execute(ToolArguments arguments, ToolContext context) {
        String description = arguments.string("description").orElse("");
        if (description.isBlank()) {
            return "Error creating task: No description provided.";
        }
        if (!arguments.has("requirements")) {
            return "Error creating task: No requirements provided.";
        }
        Optional<List<String>> requirements = arguments.stringList("requirements");
        if (requirements.isEmpty()) {
            return "Error creating task: Requirements must be a list.";
        }
        if (requirements.get().isEmpty()) {
            return "Error creating task: No requirements provided.";
        }
        boolean completed = arguments.bool("completed").orElse(false);

        return tracker.createTask(description, requirements.get(), completed)
            .map(task -> "Task created with id " + task.id() + ".")
            .orElse("Error creating task.");
    }
}
