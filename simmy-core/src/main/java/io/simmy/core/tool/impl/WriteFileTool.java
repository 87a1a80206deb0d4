package io.simmy.core.tool.impl;

import io.simmy.core.tool.Tool;
import io.simmy.core.tool.ToolArguments;
import io.simmy.core.tool.ToolContext;
import io.simmy.core.tool.ToolSchema;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public final class WriteFileTool implements Tool {
    private static final ToolSchema SCHEMA = ToolSchema.builder()
        .string("path", "Path of the file to write, relative to the workspace.", true)
        .string("content", "The full content to write.", true)
        .build();

    @Override
    public String name() {
        return "write_file";
    }

    @Override
    public String description() {
        return "Write text content to a file in the workspace, replacing any existing content.";
    }

    @Override
    public ToolSchema schema() {
        return SCHEMA;
    }

    @Override
    public String execute(ToolArguments arguments, ToolContext context) {
        String pathArg = arguments.string("path").orElse("").trim();
        if (pathArg.isBlank()) {
            return "Error running write_file: No path provided.";
        }
        String content = arguments.string("content").orElse("");

        try {
            Path target = WorkspacePaths.resolveForWrite(context.workspace(), pathArg);
            if (Files.isDirectory(target)) {
                return "Error running write_file: path is a directory: " + pathArg;
            }
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
            return "Wrote " + content.length() + " characters to " + pathArg;
        } catch (Exception e) {
            return "Error running write_file: " + e.getMessage();
        }
    }
}
