package org.driftlens.workspace;

import java.util.Objects;
import org.driftlens.dashboard.DashboardConfig;

/**
 * Project name, description and dashboard as read from a configuration file.
 */
public record ProjectConfig(String name, String description, DashboardConfig dashboard) {
    public ProjectConfig {
        Objects.requireNonNull(name, "name");
        description = description == null ? "" : description;
        Objects.requireNonNull(dashboard, "dashboard");
    }
}
