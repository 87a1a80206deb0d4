package io.simmy.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

@Command(
    name = "simmy",
    mixinStandardHelpOptions = true,
    version = "simmy 0.1.0",
    description = "Simmy, a conversational agent that plans its work as tracked tasks"
)
public final class SimmyCliCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
