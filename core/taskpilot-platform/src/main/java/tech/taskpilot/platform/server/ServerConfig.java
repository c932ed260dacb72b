package tech.taskpilot.platform.server;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

/**
 * Identity this server reports to MCP clients.
 */
@ConfigMapping(prefix = "taskpilot.server")
public interface ServerConfig {

    @WithDefault("Task Manager MCP Server")
    String name();

    @WithDefault("0.1.0")
    String version();

    @WithName("protocol-version")
    @WithDefault("2025-06-18")
    String protocolVersion();
}
