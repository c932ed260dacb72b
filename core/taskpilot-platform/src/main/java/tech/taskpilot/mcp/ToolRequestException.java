package tech.taskpilot.mcp;

/**
 * The tool call itself is malformed: no name (400) or unknown tool (404).
 */
public class ToolRequestException extends RuntimeException {

    private final int status;

    public ToolRequestException(int status, String message) {
        super(message);
        this.status = status;
    }

    public static ToolRequestException missingName() {
        return new ToolRequestException(400, "Tool name is required");
    }

    public static ToolRequestException unknownTool(String name) {
        return new ToolRequestException(404, "Tool '" + name + "' not found");
    }

    public int getStatus() {
        return status;
    }
}
