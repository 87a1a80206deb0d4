package io.simmy.core.agency;

import io.simmy.core.bus.EventBus;
import io.simmy.core.bus.Topics;
import io.simmy.core.tool.Tool;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory to-do list the agent manipulates through its generated tools.
 *
 * <p>Mutations are expected from the agent thread only. Task ids are ordinal ({@code task_1, task_2, ...})
 * and come from a counter, so they are never reused. Every successful mutation publishes the updated
 * {@link Task} on the bus; failures publish a message on {@link Topics#ERROR} and leave the list untouched.
 */
public final class TaskTracker {
    private static final Logger LOG = LoggerFactory.getLogger(TaskTracker.class);

    private final EventBus bus;
    private final boolean silenceActions;
    private final List<Task> tasks = new CopyOnWriteArrayList<>();
    private final List<Tool> tools;
    private int issuedIds;

    public TaskTracker(EventBus bus, boolean silenceActions) {
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.silenceActions = silenceActions;
        this.tools = List.of(
            new CreateTaskTool(this),
            new CompleteTaskTool(this),
            new ModifyTaskNotesTool(this),
            new ModifyTaskRequirementsTool(this)
        );
    }

    public String nextTaskId() {
        return "task_" + (issuedIds + 1);
    }

    public Optional<Task> createTask(String description, List<String> requirements, boolean completed) {
        if (description == null || description.isBlank()) {
            return fail("Error creating task: No description provided.");
        }
        if (!isValidRequirements(requirements)) {
            return fail("Error creating task: Requirements must be a non-empty list of strings.");
        }

        Task task = new Task(nextTaskId(), description, requirements, completed, "");
        issuedIds++;
        tasks.add(task);
        LOG.debug("Created task {}", task.id());
        notice("Created task: " + task.description());
        bus.publish(Topics.TASK_CREATED, task);
        return Optional.of(task);
    }

    public boolean completeTask(String taskId) {
        return update(taskId, task -> task.withCompleted(true), Topics.TASK_COMPLETED, "Completed task: ");
    }

    public boolean modifyTaskNotes(String taskId, String notes) {
        return update(taskId, task -> task.withNotes(notes), Topics.TASK_NOTES_MODIFIED, "Modified notes for task: ");
    }

    public boolean modifyTaskRequirements(String taskId, List<String> requirements) {
        if (!isValidRequirements(requirements)) {
            fail("Error modifying task: Requirements must be a non-empty list of strings.");
            return false;
        }
        return update(
            taskId,
            task -> task.withRequirements(requirements),
            Topics.TASK_REQUIREMENTS_MODIFIED,
            "Modified requirements for task: "
        );
    }

    public List<Task> tasks() {
        return List.copyOf(tasks);
    }

    public Optional<Task> find(String taskId) {
        return tasks.stream().filter(task -> task.id().equals(taskId)).findFirst();
    }

    public List<Task> incompleteTasks() {
        return tasks.stream().filter(task -> !task.completed()).toList();
    }

    public List<Task> completedTasks() {
        return tasks.stream().filter(Task::completed).toList();
    }

    public boolean hasIncompleteTasks() {
        return tasks.stream().anyMatch(task -> !task.completed());
    }

    public String describe(List<Task> selection) {
        StringBuilder description = new StringBuilder();
        for (Task task : selection) {
            description.append("---\n");
            description.append("Task ID: ").append(task.id()).append('\n');
            description.append("Description: ").append(task.description()).append('\n');
            description.append("Requirements:\n");
            for (String requirement : task.requirements()) {
                description.append("- ").append(requirement).append('\n');
            }
            description.append("Notes:\n").append(task.notes()).append('\n');
            description.append("Completed: ").append(task.completed()).append('\n');
            description.append("---\n");
        }
        return description.toString();
    }

    public String describeIncompleteTasks() {
        return describe(incompleteTasks());
    }

    public List<Tool> tools() {
        return tools;
    }

    public Optional<Tool> findTool(String name) {
        return tools.stream().filter(tool -> tool.name().equals(name)).findFirst();
    }

    private boolean update(String taskId, UnaryOperator<Task> change, String topic, String noticePrefix) {
        for (int i = 0; i < tasks.size(); i++) {
            Task current = tasks.get(i);
            if (current.id().equals(taskId)) {
                Task updated = change.apply(current);
                tasks.set(i, updated);
                LOG.debug("Task {} updated ({})", taskId, topic);
                notice(noticePrefix + updated.description());
                bus.publish(topic, updated);
                return true;
            }
        }
        fail("Task " + taskId + " not found.");
        return false;
    }

    private boolean isValidRequirements(List<String> requirements) {
        return requirements != null && !requirements.isEmpty() && requirements.stream().allMatch(Objects::nonNull);
    }

    private Optional<Task> fail(String message) {
        LOG.debug(message);
        bus.publish(Topics.ERROR, message);
        return Optional.empty();
    }

    private void notice(String message) {
        if (!silenceActions) {
            bus.publish(Topics.ACTION_NOTICE, message);
        }
    }
}
