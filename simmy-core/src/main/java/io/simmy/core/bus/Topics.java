package io.simmy.core.bus;

public final class Topics {
    public static final String NEW_USER_MESSAGE = "new_user_message";
    public static final String NEW_AGENT_MESSAGE = "new_agent_message";

    public static final String TASK_CREATED = "task_created";
    public static final String TASK_COMPLETED = "task_completed";
    public static final String TASK_NOTES_MODIFIED = "task_notes_modified";
    public static final String TASK_REQUIREMENTS_MODIFIED = "task_requirements_modified";

    public static final String ERROR = "error";
    public static final String AGENT_ERROR = "agent_error";

    public static final String AGENT_LOG = "agent_log";
    public static final String GENERAL_LOG = "general_log";
    public static final String TOOLBOX_LOG = "toolbox_log";

    public static final String ACTION_NOTICE = "action_notice";
    public static final String EXIT_SIGNAL = "exit_signal";

    private Topics() {
    }
}
