package tech.taskpilot.platform.common.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Standard API response DTOs shared by the REST resources.
 */
public final class ApiResponses {

    private ApiResponses() {}

    // ========================================================================
    // Success Responses
    // ========================================================================

    @Schema(description = "Simple message response")
    public record MessageResponse(
        @Schema(description = "Human-readable message", example = "Client registration revoked")
        String message
    ) {}

    // ========================================================================
    // Error Responses
    // ========================================================================

    /**
     * Error body used by everything except the OAuth endpoints.
     */
    @Schema(description = "Error response")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
        @Schema(description = "Human-readable error message", example = "Invalid or expired session")
        String error,
        @Schema(description = "Machine-readable error code", example = "UNAUTHORIZED")
        String code
    ) {}

    /**
     * OAuth 2.0 style error body (RFC 6749 section 5.2).
     */
    @Schema(description = "OAuth error response")
    public record OAuthErrorResponse(
        @Schema(description = "OAuth error code", example = "invalid_state")
        String error,
        @JsonProperty("error_description")
        @Schema(description = "Human-readable description", example = "Invalid state parameter")
        String errorDescription
    ) {}
}
