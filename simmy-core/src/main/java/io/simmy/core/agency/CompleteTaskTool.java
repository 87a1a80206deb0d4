package io.simmy.core.agency;

import io.simmy.core.tool.Tool;
import io.simmy.core.tool.ToolArguments;
import io.simmy.core.tool.ToolContext;
import io.simmy.core.tool.ToolSchema;

final class CompleteTaskTool implements Tool {
    private static final ToolSchema SCHEMA = ToolSchema.builder()
        .string("task_id", "The id of the task to complete.", true)
        .build();

    private final TaskTracker tracker;

    CompleteTaskTool(TaskTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public String name() {
        return "complete_task";
    }

    @Override
    public String description() {
        return "Use this to mark a task complete.";
    }

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public String execute(ToolArguments arguments, ToolContext context) {
        String taskId = arguments.string("task_id").orElse("");
        if (taskId.isBlank()) {
            return "Error completing task: No task_id provided.";
        }
        if (!tracker.completeTask(taskId)) {
            return "Error completing task with id " + taskId + ".";
        }
        return "Task with id " + taskId + " marked as complete.";
    }
}
