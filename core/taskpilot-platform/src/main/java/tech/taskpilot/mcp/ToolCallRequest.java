package tech.taskpilot.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Tool call request")
public record ToolCallRequest(
    @Schema(description = "Tool name", example = "task_create")
    String name,
    @Schema(description = "Tool parameters, validated against the tool's input schema")
    JsonNode params
) {}
