package io.simmy.cli;

import io.simmy.core.bus.EventBus;
import io.simmy.core.bus.Subscription;
import io.simmy.core.bus.Topics;
import java.io.PrintStream;
import java.util.List;
import picocli.CommandLine.Help.Ansi;

/**
 * Renders bus traffic for a human at the terminal.
 */
public final class ConsolePresenter {
    private final PrintStream out;
    private final Ansi ansi;

    public ConsolePresenter(PrintStream out, Ansi ansi) {
        this.out = out;
        this.ansi = ansi;
    }

    public List<Subscription> attach(EventBus bus) {
        return List.of(
            bus.subscribe(Topics.NEW_AGENT_MESSAGE, String.class, this::agentMessage),
            bus.subscribe(Topics.ERROR, String.class, error -> line("@|red Error:|@ ", error)),
            bus.subscribe(Topics.AGENT_ERROR, String.class, error -> line("@|red Agent Error:|@ ", error)),
            bus.subscribe(Topics.ACTION_NOTICE, String.class, notice -> line("@|faint   > |@", notice))
        );
    }

    public void greet() {
        line("@|bold,blue Simmy:|@ ", "Hello and welcome! My name is Simmy!");
    }

    public void goodbye() {
        line("@|bold,blue Simmy:|@ ", "Goodbye!");
    }

    public void prompt() {
        out.print(ansi.string("@|bold,cyan You:|@ "));
        out.flush();
    }

    private void agentMessage(String message) {
        out.println(ansi.string("@|bold,blue Simmy:|@"));
        out.println(message);
        out.flush();
    }

    private void line(String label, String text) {
        out.println(ansi.string(label) + text);
        out.flush();
    }
}
