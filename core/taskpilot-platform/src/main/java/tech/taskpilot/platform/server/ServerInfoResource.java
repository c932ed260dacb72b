package tech.taskpilot.platform.server;

import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HEAD;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.LinkedHashMap;
import java.util.Map;

@Path("/")
@Tag(name = "Server", description = "Server discovery")
@Produces(MediaType.APPLICATION_JSON)
public class ServerInfoResource {

    static final String PROTOCOL_HEADER = "MCP-Protocol-Version";

    @Inject
    ServerConfig serverConfig;

    @GET
    @Operation(summary = "Server information and endpoint listing")
    public ServerInfoResponse info() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("initialize", "/mcp/initialize");
        endpoints.put("tools_list", "/mcp/tools/list");
        endpoints.put("tools_call", "/mcp/tools/call");
        endpoints.put("oauth_authorize", "/oauth/authorize");
        endpoints.put("oauth_callback", "/oauth/callback");
        endpoints.put("oauth_refresh", "/oauth/refresh");
        endpoints.put("register_client", "/clients/register");
        endpoints.put("health", "/health");
        return new ServerInfoResponse(
            serverConfig.name(), serverConfig.version(), serverConfig.protocolVersion(), "operational", endpoints);
    }

    @HEAD
    @Operation(summary = "Protocol version probe")
    public Response probe() {
        return Response.ok().header(PROTOCOL_HEADER, serverConfig.protocolVersion()).build();
    }

    public record ServerInfoResponse(
        String name,
        String version,
        String protocol,
        String status,
        Map<String, String> endpoints
    ) {}
}
