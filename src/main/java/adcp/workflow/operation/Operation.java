package adcp.workflow.operation;

import adcp.workflow.model.TaskAction;

/**
 * An advertising operation as received from a protocol surface.
 * Implementations are Jackson records; their JSON form is what gets stored in request_context.
 */
public interface Operation {

    OperationKind kind();

    /**
     * Media buy this operation targets, or null before one exists.
     */
    String mediaBuyId();

    TaskAction taskAction();

    /**
     * @throws IllegalArgumentException if the operation cannot be executed as given
     */
    void validate();
}
