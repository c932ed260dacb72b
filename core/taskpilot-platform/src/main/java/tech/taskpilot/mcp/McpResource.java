package tech.taskpilot.mcp;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import com.fasterxml.jackson.databind.JsonNode;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.taskpilot.platform.server.ServerConfig;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * MCP endpoints: handshake, tool discovery and tool invocation.
 */
@Path("/mcp")
@Tag(name = "MCP", description = "Tool discovery and invocation")
@Produces(MediaType.APPLICATION_JSON)
public class McpResource {

    @Inject
    ToolDispatcher dispatcher;

    @Inject
    ToolSchemaRegistry schemaRegistry;

    @Inject
    ServerConfig serverConfig;

    @POST
    @Path("/initialize")
    @Operation(summary = "Protocol handshake")
    @APIResponse(responseCode = "200", description = "Server capabilities")
    public InitializeResponse initialize() {
        return new InitializeResponse(
            serverConfig.protocolVersion(),
            Map.of("tools", Map.of()),
            new ServerInfo(serverConfig.name(), serverConfig.version()));
    }

    @POST
    @Path("/tools/list")
    @Operation(summary = "List available tools")
    @APIResponse(responseCode = "200", description = "Tool definitions with input schemas")
    public ToolListResponse listTools() {
        List<ToolDefinition> tools = Arrays.stream(TaskTool.values())
            .map(t -> new ToolDefinition(t.toolName(), t.description(), schemaRegistry.inputSchema(t)))
            .toList();
        return new ToolListResponse(tools);
    }

    @POST
    @Path("/tools/call")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Invoke a tool",
        description = "Tool-level failures (validation, not found, calendar errors) are returned inside the content block")
    @APIResponse(responseCode = "200", description = "Tool result or tool error")
    @APIResponse(responseCode = "400", description = "Tool name missing")
    @APIResponse(responseCode = "401", description = "Missing or invalid bearer session")
    @APIResponse(responseCode = "404", description = "Unknown tool")
    public ToolResponse callTool(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
            ToolCallRequest request) {
        return dispatcher.dispatch(authorization, request);
    }

    public record InitializeResponse(String protocolVersion, Map<String, Object> capabilities, ServerInfo serverInfo) {}

    public record ServerInfo(String name, String version) {}

    public record ToolDefinition(String name, String description, JsonNode inputSchema) {}

    public record ToolListResponse(List<ToolDefinition> tools) {}
}
