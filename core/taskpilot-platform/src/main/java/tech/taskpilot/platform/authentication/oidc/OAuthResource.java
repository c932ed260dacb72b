package tech.taskpilot.platform.authentication.oidc;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import tech.taskpilot.platform.authentication.BearerAuthenticator;
import tech.taskpilot.platform.authentication.session.SessionService;
import tech.taskpilot.platform.common.api.ApiResponses;
import tech.taskpilot.platform.common.errors.AuthenticationException;

/**
 * OAuth endpoints: authorize, callback, refresh, logout.
 */
@Path("/oauth")
@Tag(name = "OAuth", description = "Google sign-in and session lifecycle")
@Produces(MediaType.APPLICATION_JSON)
public class OAuthResource {

    @Inject
    AuthorizationFlowService flowService;

    @Inject
    BearerAuthenticator bearerAuthenticator;

    @Inject
    SessionService sessionService;

    @GET
    @Path("/authorize")
    @Operation(summary = "Start sign-in", description = "Redirects to the Google consent screen")
    @APIResponse(responseCode = "303", description = "Redirect to identity provider")
    @APIResponse(responseCode = "400", description = "Invalid dynamic client or redirect URI")
    public Response authorize(
            @Parameter(description = "Dynamic client id") @QueryParam("client_id") String clientId,
            @Parameter(description = "Registered redirect URI of the dynamic client") @QueryParam("redirect_uri") String redirectUri) {
        return Response.seeOther(flowService.beginAuthorization(clientId, redirectUri)).build();
    }

    @GET
    @Path("/callback")
    @Operation(summary = "Provider callback", description = "Exchanges the code and creates a session")
    @APIResponse(responseCode = "200", description = "Session created")
    @APIResponse(responseCode = "400", description = "Invalid state, code or identity token")
    public TokenResponse callback(
            @QueryParam("code") String code,
            @QueryParam("state") String state,
            @QueryParam("scope") String scope,
            @QueryParam("error") String error,
            @HeaderParam(HttpHeaders.USER_AGENT) String userAgent) {
        if (error != null && !error.isBlank()) {
            throw flowService.abandonAuthorization(state, error);
        }
        return TokenResponse.from(flowService.completeAuthorization(code, state, scope, userAgent));
    }

    @POST
    @Path("/refresh")
    @Consumes(MediaType.APPLICATION_JSON)
    @Operation(summary = "Refresh the access token of a session")
    @APIResponse(responseCode = "200", description = "Token refreshed")
    @APIResponse(responseCode = "401", description = "Refresh token does not match the session")
    @APIResponse(responseCode = "404", description = "Session not found")
    public TokenResponse refresh(RefreshRequest request) {
        if (request == null) {
            return TokenResponse.from(flowService.refreshAuthorization(null, null));
        }
        return TokenResponse.from(flowService.refreshAuthorization(request.sessionId(), request.refreshToken()));
    }

    @POST
    @Path("/logout")
    @Operation(summary = "End the caller's session",
        description = "Idempotent. Expired or already removed sessions are accepted.")
    @APIResponse(responseCode = "200", description = "Session removed, or already gone")
    @APIResponse(responseCode = "401", description = "Missing or malformed bearer header")
    public ApiResponses.MessageResponse logout(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
        String sessionId = bearerAuthenticator.extractSessionId(authorization)
            .orElseThrow(() -> new AuthenticationException("Authentication required"));
        sessionService.delete(sessionId);
        return new ApiResponses.MessageResponse("Logged out");
    }

    @Schema(description = "Refresh request")
    public record RefreshRequest(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("refresh_token") String refreshToken
    ) {}

    @Schema(description = "Session token response")
    public record TokenResponse(
        @JsonProperty("session_id") String sessionId,
        @JsonProperty("access_token") String accessToken,
        @JsonProperty("refresh_token") String refreshToken,
        @JsonProperty("expires_in") long expiresIn,
        @JsonProperty("token_type") String tokenType
    ) {
        static TokenResponse from(AuthorizationFlowService.TokenGrant grant) {
            return new TokenResponse(grant.sessionId(), grant.accessToken(), grant.refreshToken(),
                grant.expiresIn(), grant.tokenType());
        }
    }
}
