package tech.taskpilot.mcp;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import tech.taskpilot.platform.common.api.ApiResponses;

@Provider
public class ToolRequestExceptionMapper implements ExceptionMapper<ToolRequestException> {

    @Override
    public Response toResponse(ToolRequestException exception) {
        String code = exception.getStatus() == 404 ? "TOOL_NOT_FOUND" : "INVALID_REQUEST";
        return Response.status(exception.getStatus())
            .type(MediaType.APPLICATION_JSON)
            .entity(new ApiResponses.ErrorResponse(exception.getMessage(), code))
            .build();
    }
}
