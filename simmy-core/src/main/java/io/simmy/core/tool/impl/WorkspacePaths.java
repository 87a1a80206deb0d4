package io.simmy.core.tool.impl;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Maps paths supplied by the model onto the agent workspace. Containment is checked against the real
 * path of the deepest existing ancestor, so a symlink inside the workspace cannot lead a write outside it.
 */
final class WorkspacePaths {

    private WorkspacePaths() {
    }

    static Path resolveForWrite(Path workspace, String requested) throws IOException {
        if (workspace == null) {
            throw new IllegalArgumentException("Workspace is not configured");
        }
        Files.createDirectories(workspace);
        Path root = workspace.toRealPath();

        Path candidate = Path.of(requested);
        Path target = (candidate.isAbsolute() ? candidate : root.resolve(candidate)).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes workspace: " + requested);
        }

        Path existing = target;
        while (!Files.exists(existing)) {
            existing = existing.getParent();
        }
        if (!existing.toRealPath().startsWith(root)) {
            throw new IllegalArgumentException("Path escapes workspace: " + requested);
        }
        return target;
    }
}
