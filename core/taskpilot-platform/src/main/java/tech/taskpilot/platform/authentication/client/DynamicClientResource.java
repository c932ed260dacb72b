package tech.taskpilot.platform.authentication.client;

import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.taskpilot.platform.authentication.AuthConfig;
import tech.taskpilot.platform.common.api.ApiResponses;
import tech.taskpilot.platform.common.errors.ClientRegistrationException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Dynamic client registration endpoints.
 *
 * <p>Registration input is validated here, before it reaches
 * {@link ClientRegistrationService}.
 */
@Path("/clients")
@Tag(name = "Clients", description = "Dynamic client registration")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class DynamicClientResource {

    @Inject
    ClientRegistrationService registrationService;

    @Inject
    AuthConfig authConfig;

    @POST
    @Path("/register")
    @Operation(summary = "Register a client", description = "Returns the client secret exactly once")
    @APIResponse(responseCode = "201", description = "Client registered")
    @APIResponse(responseCode = "400", description = "Invalid platform or redirect URIs")
    public Response register(ClientResponses.RegisterClientRequest request) {
        if (request == null) {
            throw new ClientRegistrationException(ClientRegistrationException.INVALID_CLIENT_METADATA,
                "Request body is required");
        }
        ClientPlatform platform = ClientPlatform.fromWireValue(request.platform())
            .orElseThrow(() -> new ClientRegistrationException(ClientRegistrationException.INVALID_CLIENT_METADATA,
                "Invalid platform: " + request.platform() + ". Must be one of: " + ClientPlatform.allowedValues()));
        Set<String> redirectUris = validateRedirectUris(request.redirectUris());

        var registered = registrationService.register(platform, redirectUris);
        return Response.status(Response.Status.CREATED)
            .entity(ClientResponses.RegisteredClientResponse.from(registered))
            .build();
    }

    @GET
    @Path("/{clientId}")
    @Operation(summary = "Get client information")
    @APIResponse(responseCode = "200", description = "Client found")
    @APIResponse(responseCode = "404", description = "Client not found")
    public ClientResponses.ClientInfoResponse get(
            @Parameter(description = "Client id", example = "client_abc") @PathParam("clientId") String clientId) {
        return registrationService.find(clientId)
            .map(ClientResponses.ClientInfoResponse::from)
            .orElseThrow(DynamicClientResource::notFound);
    }

    @DELETE
    @Path("/{clientId}")
    @Operation(summary = "Revoke a client registration")
    @APIResponse(responseCode = "200", description = "Client revoked")
    @APIResponse(responseCode = "404", description = "Client not found")
    public ApiResponses.MessageResponse revoke(@PathParam("clientId") String clientId) {
        if (!registrationService.revoke(clientId)) {
            throw notFound();
        }
        return new ApiResponses.MessageResponse("Client registration revoked");
    }

    @GET
    @Operation(summary = "List registered clients", description = "Newest first")
    public ClientResponses.ClientListResponse list(
            @Parameter(description = "Platform filter", example = "ios") @QueryParam("platform") String platform) {
        ClientPlatform filter = null;
        if (platform != null && !platform.isBlank()) {
            filter = ClientPlatform.fromWireValue(platform)
                .orElseThrow(() -> new ClientRegistrationException(
                    ClientRegistrationException.INVALID_CLIENT_METADATA, "Invalid platform: " + platform));
        }
        List<ClientResponses.ClientInfoResponse> clients = registrationService.list(filter).stream()
            .map(ClientResponses.ClientInfoResponse::from)
            .toList();
        return new ClientResponses.ClientListResponse(clients);
    }

    Set<String> validateRedirectUris(List<String> uris) {
        if (uris == null || uris.isEmpty()) {
            throw new ClientRegistrationException(ClientRegistrationException.INVALID_REDIRECT_URI,
                "At least one redirect URI is required");
        }
        int max = authConfig.clients().maxRedirectUris();
        if (uris.size() > max) {
            throw new ClientRegistrationException(ClientRegistrationException.INVALID_REDIRECT_URI,
                "At most " + max + " redirect URIs may be registered");
        }
        Set<String> result = new LinkedHashSet<>();
        for (String uri : uris) {
            if (!isAbsoluteUri(uri)) {
                throw new ClientRegistrationException(ClientRegistrationException.INVALID_REDIRECT_URI,
                    "Invalid redirect URI: " + uri);
            }
            result.add(uri);
        }
        return result;
    }

    /**
     * http, https or a custom scheme (com.example.app://callback). Fragments are not allowed.
     */
    private static boolean isAbsoluteUri(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(value);
            if (uri.getScheme() == null || uri.getFragment() != null) {
                return false;
            }
            String scheme = uri.getScheme().toLowerCase();
            if (scheme.equals("http") || scheme.equals("https")) {
                return uri.getHost() != null;
            }
            return uri.getRawSchemeSpecificPart() != null && !uri.getRawSchemeSpecificPart().isEmpty();
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static ClientRegistrationException notFound() {
        return new ClientRegistrationException(ClientRegistrationException.CLIENT_NOT_FOUND, "Client not found");
    }
}
