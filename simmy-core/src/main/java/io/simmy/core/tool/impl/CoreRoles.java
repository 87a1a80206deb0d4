package io.simmy.core.tool.impl;

import io.simmy.core.tool.Role;
import java.util.List;

public final class CoreRoles {

    private CoreRoles() {
    }

    public static Role researcher(int maxChars, boolean allowPrivateAddresses) {
        return new Role(
            "Researcher",
            "A dedicated researcher with specialized tools for web research, data analysis, and documentation.",
            List.of(
                new WebRequestTool(maxChars, allowPrivateAddresses),
                new WriteFileTool(),
                new ScraperTool(maxChars, allowPrivateAddresses)
            )
        );
    }
}
