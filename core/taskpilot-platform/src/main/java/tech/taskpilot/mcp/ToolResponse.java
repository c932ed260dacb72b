package tech.taskpilot.mcp;

import org.eclipse.microprofile.openapi.annotations.media.Schema;

import java.util.List;

/**
 * Uniform tool response envelope. Both results and tool-level errors travel
 * as JSON text inside a single content block.
 */
@Schema(description = "Tool response envelope")
public record ToolResponse(List<ContentBlock> content) {

    public static ToolResponse text(String json) {
        return new ToolResponse(List.of(new ContentBlock("text", json)));
    }

    @Schema(description = "Typed content block")
    public record ContentBlock(
        @Schema(example = "text") String type,
        @Schema(description = "JSON-encoded payload") String text
    ) {}
}
