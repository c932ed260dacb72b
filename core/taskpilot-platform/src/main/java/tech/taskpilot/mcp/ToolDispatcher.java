package tech.taskpilot.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.taskpilot.platform.authentication.AuthenticatedUser;
import tech.taskpilot.platform.authentication.BearerAuthenticator;
import tech.taskpilot.platform.common.Result;
import tech.taskpilot.platform.common.errors.InfrastructureException;
import tech.taskpilot.platform.common.errors.UseCaseError;

import java.util.List;

/**
 * Runs a tool call: resolve the tool, authenticate the caller, validate the
 * parameters, then invoke the handler.
 *
 * <p>Transport-level problems (bad request, unknown tool, bad credentials) are
 * thrown. Everything after authentication is reported as data inside the
 * response envelope.
 */
@ApplicationScoped
public class ToolDispatcher {

    private static final Logger LOG = Logger.getLogger(ToolDispatcher.class);

    @Inject
    BearerAuthenticator bearerAuthenticator;

    @Inject
    ToolSchemaRegistry schemaRegistry;

    @Inject
    TaskToolHandlers handlers;

    @Inject
    ObjectMapper objectMapper;

    public ToolResponse dispatch(String authorizationHeader, ToolCallRequest request) {
        if (request == null || request.name() == null || request.name().isBlank()) {
            throw ToolRequestException.missingName();
        }
        TaskTool tool = TaskTool.fromName(request.name())
            .orElseThrow(() -> ToolRequestException.unknownTool(request.name()));

        AuthenticatedUser caller = bearerAuthenticator.authenticate(authorizationHeader);

        JsonNode params = request.params() == null || request.params().isNull()
            ? objectMapper.createObjectNode()
            : request.params();

        List<String> violations = schemaRegistry.validate(tool, params);
        if (!violations.isEmpty()) {
            LOG.debugf("Rejected %s parameters: %s", tool.toolName(), violations);
            return error("VALIDATION_ERROR", "Invalid parameters: " + String.join("; ", violations));
        }

        Result<Object> result = handlers.handle(tool, caller, params);
        if (result instanceof Result.Failure<Object> f) {
            UseCaseError failure = f.error();
            LOG.infof("Tool %s failed for user %s: %s", tool.toolName(), caller.userId(), failure.code());
            return error(failure.code(), failure.message());
        }
        return ToolResponse.text(write(((Result.Success<Object>) result).value()));
    }

    private ToolResponse error(String code, String message) {
        return ToolResponse.text(write(new TaskPayloads.ToolError(message, code)));
    }

    private String write(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new InfrastructureException("Failed to serialize tool result", e);
        }
    }
}
