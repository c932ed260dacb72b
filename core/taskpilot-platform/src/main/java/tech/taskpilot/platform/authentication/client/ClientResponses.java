package tech.taskpilot.platform.authentication.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Request and response bodies for the dynamic client endpoints.
 */
public final class ClientResponses {

    private ClientResponses() {}

    @Schema(description = "Dynamic client registration request")
    public record RegisterClientRequest(
        @Schema(description = "Client platform", example = "ios",
            enumeration = {"ios", "android", "macos", "windows", "linux", "cli"})
        String platform,
        @JsonProperty("redirect_uris")
        @Schema(description = "Allowed redirect URIs (1-5)", example = "[\"com.example.tasks://oauth/callback\"]")
        List<String> redirectUris
    ) {}

    @Schema(description = "Registered client. The secret is only ever returned here.")
    public record RegisteredClientResponse(
        @JsonProperty("client_id") String clientId,
        @JsonProperty("client_secret") String clientSecret,
        String platform,
        @JsonProperty("redirect_uris") List<String> redirectUris,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("expires_at") Instant expiresAt
    ) {
        static RegisteredClientResponse from(ClientRegistrationService.RegisteredClient registered) {
            DynamicClient c = registered.client();
            return new RegisteredClientResponse(c.clientId, registered.clientSecret(), c.platform.wireValue(),
                c.redirectUris.stream().sorted().toList(), c.createdAt, c.expiresAt);
        }
    }

    @Schema(description = "Client information (no secret)")
    public record ClientInfoResponse(
        @JsonProperty("client_id") String clientId,
        String platform,
        @JsonProperty("redirect_uris") List<String> redirectUris,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("expires_at") Instant expiresAt,
        @JsonProperty("last_used") Instant lastUsed
    ) {
        static ClientInfoResponse from(DynamicClient c) {
            return new ClientInfoResponse(c.clientId, c.platform.wireValue(),
                c.redirectUris.stream().sorted().toList(), c.createdAt, c.expiresAt, c.lastUsed);
        }
    }

    @Schema(description = "Client list")
    public record ClientListResponse(List<ClientInfoResponse> clients) {}
}
