package io.simmy.core.agency;

import io.simmy.core.tool.Tool;
import io.simmy.core.tool.ToolArguments;
import io.simmy.core.tool.ToolContext;
import io.simmy.core.tool.ToolSchema;
import java.util.List;
import java.util.Optional;

final class ModifyTaskRequirementsTool implements Tool {
    private static final ToolSchema SCHEMA = ToolSchema.builder()
        .string("task_id", "The id of the task to modify.", true)
        .stringArray("requirements", "The new requirements for the task.", true)
        .build();

    private final TaskTracker tracker;

    ModifyTaskRequirementsTool(TaskTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public String name() {
        return "modify_task_requirements";
    }

    @Override
    public String description() {
        return "Use this to modify the requirements for a task.";
    }

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public String execute(ToolArguments arguments, ToolContext context) {
        String taskId = arguments.string("task_id").orElse("");
        if (taskId.isBlank()) {
            return "Error modifying task: No task_id provided.";
        }
        if (!arguments.has("requirements")) {
            return "Error modifying task: No requirements provided.";
        }
        Optional<List<String>> requirements = arguments.stringList("requirements");
        if (requirements.isEmpty()) {
            return "Error modifying task: Requirements must be a list.";
        }
        if (requirements.get().isEmpty()) {
            return "Error modifying task: No requirements provided.";
        }
        if (!tracker.modifyTaskRequirements(taskId, requirements.get())) {
            return "Error modifying requirements for task with id " + taskId + ".";
        }
        return "Requirements for task with id " + taskId + " modified.";
    }
}
