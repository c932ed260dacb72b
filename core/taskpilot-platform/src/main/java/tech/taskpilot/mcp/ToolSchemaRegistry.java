package tech.taskpilot.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads every tool's input schema from {@code classpath:tools/<name>.json} and
 * validates call parameters against it.
 */
@ApplicationScoped
public class ToolSchemaRegistry {

    private static final Logger LOG = Logger.getLogger(ToolSchemaRegistry.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<TaskTool, JsonNode> schemaNodes = new EnumMap<>(TaskTool.class);
    private final Map<TaskTool, JsonSchema> schemas = new EnumMap<>(TaskTool.class);

    @PostConstruct
    void loadSchemas() {
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);
        for (TaskTool tool : TaskTool.values()) {
            JsonNode node = readSchema(tool);
            schemaNodes.put(tool, node);
            schemas.put(tool, factory.getSchema(node));
        }
        LOG.infof("Loaded %d tool schemas", schemas.size());
    }

    /**
     * Build a registry outside of CDI.
     */
    public static ToolSchemaRegistry load() {
        ToolSchemaRegistry registry = new ToolSchemaRegistry();
        registry.loadSchemas();
        return registry;
    }

    public JsonNode inputSchema(TaskTool tool) {
        return schemaNodes.get(tool);
    }

    /**
     * @return violation messages, empty when the parameters are valid
     */
    public List<String> validate(TaskTool tool, JsonNode params) {
        Set<ValidationMessage> messages = schemas.get(tool).validate(params);
        return messages.stream()
            .map(ValidationMessage::getMessage)
            .sorted(Comparator.naturalOrder())
            .toList();
    }

    private static JsonNode readSchema(TaskTool tool) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ToolSchemaRegistry.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(tool.schemaResource())) {
            if (in == null) {
                throw new IllegalStateException("Missing schema resource " + tool.schemaResource());
            }
            return MAPPER.readTree(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unreadable schema resource " + tool.schemaResource(), e);
        }
    }
}
