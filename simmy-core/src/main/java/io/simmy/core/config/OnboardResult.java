package io.simmy.core.config;

import java.nio.file.Path;

public record OnboardResult(Path configPath, Path workspacePath, Path logDirectory, Outcome outcome) {

    /** What happened to the config file. */
    public enum Outcome {
        CREATED,
        OVERWRITTEN,
        /** Existing values kept, defaults added for anything missing. */
        REFRESHED
    }
}
