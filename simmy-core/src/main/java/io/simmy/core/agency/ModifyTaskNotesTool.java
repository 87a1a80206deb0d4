package io.simmy.core.agency;

import io.simmy.core.tool.Tool;
import io.simmy.core.tool.ToolArguments;
import io.simmy.core.tool.ToolContext;
import io.simmy.core.tool.ToolSchema;
import java.util.Optional;

final class ModifyTaskNotesTool implements Tool {
    private static final ToolSchema SCHEMA = ToolSchema.builder()
        .string("task_id", "The id of the task to modify.", true)
        .string("notes", "The new notes for the task.", true)
        .build();

    private final TaskTracker tracker;

    ModifyTaskNotesTool(TaskTracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public String name() {
        return "modify_task_notes";
    }

    @Override
    public String description() {
        return "Use this to modify the notes for a task.";
    }

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public String execute(ToolArguments arguments, ToolContext context) {
        String taskId = arguments.string("task_id").orElse("");
        if (taskId.isBlank()) {
            return "Error modifying notes: No task_id provided.";
        }
        Optional<String> notes = arguments.string("notes");
        if (notes.isEmpty()) {
            return "Error modifying notes: Notes must be a string.";
        }
        if (!tracker.modifyTaskNotes(taskId, notes.get())) {
            return "Error modifying notes for task with id " + taskId + ".";
        }
        return "Notes for task with id " + taskId + " modified.";
    }
}
