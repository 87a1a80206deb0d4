package io.simmy.core.agency;

import java.util.List;
import java.util.Objects;

/**
 * A tracked unit of work. Instances are immutable; {@link TaskTracker} replaces them with updated copies.
 */
public record Task(String id, String description, List<String> requirements, boolean completed, String notes) {

    public Task {
        Objects.requireNonNull(id, "id must not be null");
        description = description == null ? "" : description;
        requirements = requirements == null ? List.of() : List.copyOf(requirements);
        notes = notes == null ? "" : notes;
    }

    public Task withCompleted(boolean newCompleted) {
        return new Task(id, description, requirements, newCompleted, notes);
    }

    public Task withNotes(String newNotes) {
        return new Task(id, description, requirements, completed, newNotes);
    }

    public Task withRequirements(List<String> newRequirements) {
        return new Task(id, description, newRequirements, completed, notes);
    }
}
