package io.simmy.core.agent;

import io.simmy.core.agency.TaskTracker;
import io.simmy.core.bus.EventBus;
import io.simmy.core.bus.Subscription;
import io.simmy.core.bus.Topics;
import io.simmy.core.model.AgentResult;
import io.simmy.core.model.ChatMessage;
import io.simmy.core.model.ToolCall;
import io.simmy.core.provider.LlmException;
import io.simmy.core.provider.ModelClient;
import io.simmy.core.tool.Role;
import io.simmy.core.tool.Tool;
import io.simmy.core.tool.ToolArguments;
import io.simmy.core.tool.ToolContext;
import io.simmy.core.tool.Toolbox;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turn-taking orchestrator. Each user message is appended to the transcript and the model is called
 * repeatedly, dispatching requested tools in order, until it produces a terminal reply, which is then
 * published on {@link Topics#NEW_AGENT_MESSAGE}.
 *
 * <p>{@link #start()} runs turns on a single background thread fed by {@link Topics#NEW_USER_MESSAGE};
 * that thread is the only writer of the transcript and of the task list. A backend failure aborts the
 * turn, is reported on {@link Topics#AGENT_ERROR} and leaves the agent idle.
 */
public final class Agent {
    private static final Logger LOG = LoggerFactory.getLogger(Agent.class);
    private static final long POLL_MILLIS = 200;

    private final EventBus bus;
    private final ModelClient modelClient;
    private final Toolbox toolbox;
    private final TaskTracker taskTracker;
    private final AgentSettings settings;
    private final ToolContext toolContext;
    private final List<Tool> advertisedTools;

    private final List<ChatMessage> transcript = new CopyOnWriteArrayList<>();
    private final BlockingQueue<String> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean();
    private final Object turnLock = new Object();
    private volatile AgentState state = AgentState.IDLE;
    private volatile boolean initialized;
    private Subscription inboxSubscription;
    private Thread worker;

    public Agent(
        EventBus bus,
        ModelClient modelClient,
        Toolbox toolbox,
        TaskTracker taskTracker,
        AgentSettings settings,
        Path workspace
    ) {
        this.bus = Objects.requireNonNull(bus, "bus must not be null");
        this.modelClient = Objects.requireNonNull(modelClient, "modelClient must not be null");
        this.toolbox = toolbox == null ? Toolbox.empty() : toolbox;
        this.taskTracker = Objects.requireNonNull(taskTracker, "taskTracker must not be null");
        this.settings = settings == null ? AgentSettings.defaults() : settings;
        this.toolContext = new ToolContext(bus, workspace);
        this.advertisedTools = collectTools(this.toolbox, taskTracker);
    }

    /**
     * Starts the model client with the composed system prompt. Safe to call more than once.
     */
    public synchronized void initialize() throws LlmException {
        if (initialized) {
            return;
        }
        modelClient.startup(buildSystemPrompt());
        initialized = true;
    }

    public synchronized void start() throws LlmException {
        if (running.get()) {
            throw new IllegalStateException("Agent is already running");
        }
        initialize();
        running.set(true);
        inboxSubscription = bus.subscribe(Topics.NEW_USER_MESSAGE, String.class, inbox::add);
        worker = new Thread(this::runLoop, "simmy-agent");
        worker.setDaemon(true);
        worker.start();
        LOG.info("Agent started with {} tools", advertisedTools.size());
    }

    /**
     * Stops accepting turns. An in-flight turn is allowed to finish; no new turn starts afterwards.
     */
    public void stop() {
        Thread current;
        synchronized (this) {
            if (!running.compareAndSet(true, false)) {
                return;
            }
            inboxSubscription.unsubscribe();
            current = worker;
        }
        inbox.clear();
        if (current != null && current != Thread.currentThread()) {
            try {
                current.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        LOG.info("Agent stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public AgentState state() {
        return state;
    }

    public List<ChatMessage> transcript() {
        return List.copyOf(transcript);
    }

    public List<Tool> tools() {
        return advertisedTools;
    }

    public TaskTracker taskTracker() {
        return taskTracker;
    }

    /**
     * Runs one complete turn on the calling thread. While the background loop is running,
     * publish on {@link Topics#NEW_USER_MESSAGE} instead.
     */
    public AgentResult respond(String userMessage) {
        synchronized (turnLock) {
            try {
                return runTurn(userMessage == null ? "" : userMessage);
            } finally {
                state = AgentState.IDLE;
            }
        }
    }

    private void runLoop() {
        while (running.get()) {
            String message;
            try {
                message = inbox.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (message == null || !running.get()) {
                continue;
            }
            try {
                respond(message);
            } catch (RuntimeException e) {
                LOG.error("Turn failed", e);
                bus.publish(Topics.AGENT_ERROR, "Turn failed: " + e.getMessage());
            }
        }
    }

    private AgentResult runTurn(String userMessage) {
        transcript.add(ChatMessage.user(userMessage));
        agentLog("User: " + userMessage);

        int dispatched = 0;
        for (int iteration = 0; iteration < settings.maxToolIterations(); iteration++) {
            state = AgentState.THINKING;
            ChatMessage reply;
            try {
                reply = modelClient.getResponse(List.copyOf(transcript), advertisedTools, openTasksContext());
            } catch (LlmException e) {
                LOG.warn("Model call failed: {}", e.getMessage());
                String error = "Model call failed: " + e.getMessage();
                state = AgentState.IDLE;
                agentLog(error);
                bus.publish(Topics.AGENT_ERROR, error);
                return AgentResult.aborted(error, dispatched);
            }

            transcript.add(reply);
            if (!reply.hasToolCalls()) {
                agentLog(settings.verbose() ? "Agent: " + reply.content() : "Agent replied (" + reply.content().length() + " chars)");
                state = AgentState.IDLE;
                bus.publish(Topics.NEW_AGENT_MESSAGE, reply.content());
                return AgentResult.reply(reply.content(), dispatched);
            }

            state = AgentState.ACTING;
            agentLog("Model requested " + reply.toolCalls().size() + " tool call(s)");
            for (ToolCall call : reply.toolCalls()) {
                String output = dispatch(call);
                transcript.add(ChatMessage.tool(output, call.id()));
                dispatched++;
            }
        }

        String stopped = "Stopped after " + settings.maxToolIterations() + " tool iterations without a final reply.";
        LOG.warn("Tool chain budget exhausted after {} iterations", settings.maxToolIterations());
        transcript.add(ChatMessage.assistant(stopped));
        agentLog(stopped);
        state = AgentState.IDLE;
        bus.publish(Topics.NEW_AGENT_MESSAGE, stopped);
        return AgentResult.reply(stopped, dispatched);
    }

    private String dispatch(ToolCall call) {
        Optional<Tool> resolved = toolbox.find(call.name()).or(() -> taskTracker.findTool(call.name()));
        if (resolved.isEmpty()) {
            String error = "Error: Tool '" + call.name() + "' not found";
            toolboxLog(error);
            bus.publish(Topics.ERROR, error);
            return error;
        }

        Tool tool = resolved.get();
        ToolArguments arguments = ToolArguments.of(call.arguments());
        List<String> violations = tool.schema().validate(arguments);
        if (!violations.isEmpty()) {
            String error = "Error: invalid arguments for tool '" + tool.name() + "': " + String.join("; ", violations);
            toolboxLog(error);
            return error;
        }

        if (!settings.silenceActions()) {
            bus.publish(Topics.ACTION_NOTICE, "Using tool: " + tool.name());
        }
        toolboxLog("Calling " + tool.name() + " with " + arguments);
        try {
            String output = tool.execute(arguments, toolContext);
            output = output == null ? "" : output;
            toolboxLog(settings.verbose()
                ? tool.name() + " returned: " + output
                : tool.name() + " returned " + output.length() + " chars");
            return output;
        } catch (RuntimeException ex) {
            LOG.warn("Tool {} failed", tool.name(), ex);
            String error = "Error executing tool '" + tool.name() + "': " + ex.getMessage();
            toolboxLog(error);
            return error;
        }
    }

    private String openTasksContext() {
        if (!taskTracker.hasIncompleteTasks()) {
            return "";
        }
        return "## Open Tasks\n\nThese tasks are not complete yet. Continue them where relevant and mark them "
            + "complete once every requirement is met.\n\n" + taskTracker.describeIncompleteTasks();
    }

    private String buildSystemPrompt() {
        StringBuilder prompt = new StringBuilder(settings.systemPrompt());
        List<Role> roles = toolbox.roles();
        if (!roles.isEmpty()) {
            prompt.append("\n\n## Roles\n");
            for (Role role : roles) {
                prompt.append("\n- ").append(role.name()).append(": ").append(role.identity());
                List<String> names = role.tools().stream().map(Tool::name).toList();
                if (!names.isEmpty()) {
                    prompt.append(" Tools: ").append(String.join(", ", names)).append('.');
                }
            }
        }
        return prompt.toString();
    }

    private void agentLog(String line) {
        bus.publish(Topics.AGENT_LOG, line);
    }

    private void toolboxLog(String line) {
        bus.publish(Topics.TOOLBOX_LOG, line);
    }

    private static List<Tool> collectTools(Toolbox toolbox, TaskTracker taskTracker) {
        Map<String, Tool> byName = new LinkedHashMap<>();
        toolbox.all().forEach(tool -> byName.put(tool.name(), tool));
        for (Tool tool : taskTracker.tools()) {
            if (byName.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalArgumentException("Tool name '" + tool.name() + "' is reserved for task tracking");
            }
        }
        return List.copyOf(byName.values());
    }
}
