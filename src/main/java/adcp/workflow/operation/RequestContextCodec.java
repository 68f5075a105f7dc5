package adcp.workflow.operation;

import adcp.workflow.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes an operation and its action details into a task's request_context,
 * and reads them back by tool name when the task is resumed.
 */
public final class RequestContextCodec {

    private static final String OPERATION = "operation";
    private static final String ACTION_DETAILS = "action_details";

    private final ObjectMapper mapper;

    public RequestContextCodec() {
        this(Json.mapper());
    }

    public RequestContextCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(Operation operation, ActionDetails details) {
        ObjectNode root = mapper.createObjectNode();
        root.set(OPERATION, mapper.valueToTree(operation));
        root.set(ACTION_DETAILS, mapper.valueToTree(details));
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request context for " + operation.kind(), e);
        }
    }

    /**
     * @throws IllegalStateException if the stored context is unreadable or has no operation
     */
    public Operation decodeOperation(String requestContext, String toolName) {
        OperationKind kind = OperationKind.fromToolName(toolName);
        JsonNode node = read(requestContext).get(OPERATION);
        if (node == null || node.isNull()) {
            throw new IllegalStateException("request_context has no operation");
        }
        try {
            return mapper.treeToValue(node, kind.operationType());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read " + toolName + " operation: " + e.getOriginalMessage(), e);
        }
    }

    public ActionDetails decodeActionDetails(String requestContext) {
        JsonNode node = read(requestContext).get(ACTION_DETAILS);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, ActionDetails.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to read action details: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode read(String requestContext) {
        if (requestContext == null || requestContext.isBlank()) {
            throw new IllegalStateException("request_context is empty");
        }
        try {
            return mapper.readTree(requestContext);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("request_context is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
