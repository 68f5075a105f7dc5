package adcp.workflow.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable domain model of a workflow task: one deferred operation awaiting
 * review, executing, or being polled for asynchronous platform completion.
 * Updates go through {@link #toBuilder()} and the repository's atomic transitions.
 */
public final class Task {
    private final String id;
    private final String tenantId;
    private final String principalId;
    private final StepType stepType;
    private final String toolName;
    private final TaskStatus status;
    private final TaskOwner owner;
    private final TaskAction action;
    private final String mediaBuyId;
    private final String requestContext; // JSON: operation + action details, never rewritten
    private final String assignedTo;
    private final String parentTaskId;
    private final Instant createdAt;
    private final Instant dueAt;
    private final Instant resolvedAt;
    private final String resolvedBy;
    private final Resolution resolution;
    private final String resolutionDetail;
    private final long version;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.tenantId = Objects.requireNonNull(builder.tenantId, "tenantId is required");
        this.principalId = builder.principalId;
        this.stepType = Objects.requireNonNull(builder.stepType, "stepType is required");
        this.toolName = Objects.requireNonNull(builder.toolName, "toolName is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.owner = Objects.requireNonNull(builder.owner, "owner is required");
        this.action = Objects.requireNonNull(builder.action, "action is required");
        this.mediaBuyId = builder.mediaBuyId;
        this.requestContext = Objects.requireNonNull(builder.requestContext, "requestContext is required");
        this.assignedTo = builder.assignedTo;
        this.parentTaskId = builder.parentTaskId;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt is required");
        this.dueAt = Objects.requireNonNull(builder.dueAt, "dueAt is required");
        this.resolvedAt = builder.resolvedAt;
        this.resolvedBy = builder.resolvedBy;
        this.resolution = builder.resolution;
        this.resolutionDetail = builder.resolutionDetail;
        this.version = builder.version;

        if (!dueAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("dueAt must be after createdAt for task " + id);
        }
        if (stepType == StepType.BACKGROUND_TASK && owner != TaskOwner.SYSTEM) {
            throw new IllegalArgumentException("background tasks are system-owned: " + id);
        }
    }

    // Getters
    public String id() {
        return id;
    }

    public String tenantId() {
        return tenantId;
    }

    public String principalId() {
        return principalId;
    }

    public StepType stepType() {
        return stepType;
    }

    public String toolName() {
        return toolName;
    }

    public TaskStatus status() {
        return status;
    }

    public TaskOwner owner() {
        return owner;
    }

    public TaskAction action() {
        return action;
    }

    public String mediaBuyId() {
        return mediaBuyId;
    }

    public String requestContext() {
        return requestContext;
    }

    public String assignedTo() {
        return assignedTo;
    }

    public String parentTaskId() {
        return parentTaskId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant dueAt() {
        return dueAt;
    }

    public Instant resolvedAt() {
        return resolvedAt;
    }

    public String resolvedBy() {
        return resolvedBy;
    }

    public Resolution resolution() {
        return resolution;
    }

    public String resolutionDetail() {
        return resolutionDetail;
    }

    public long version() {
        return version;
    }

    public boolean isBackground() {
        return stepType == StepType.BACKGROUND_TASK;
    }

    public boolean isResolved() {
        return resolution != null;
    }

    /** Past due and still waiting on a reviewer. Advisory only. */
    public boolean isOverdue(Instant now) {
        return status == TaskStatus.PENDING_APPROVAL && dueAt.isBefore(now);
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .tenantId(tenantId)
                .principalId(principalId)
                .stepType(stepType)
                .toolName(toolName)
                .status(status)
                .owner(owner)
                .action(action)
                .mediaBuyId(mediaBuyId)
                .requestContext(requestContext)
                .assignedTo(assignedTo)
                .parentTaskId(parentTaskId)
                .createdAt(createdAt)
                .dueAt(dueAt)
                .resolvedAt(resolvedAt)
                .resolvedBy(resolvedBy)
                .resolution(resolution)
                .resolutionDetail(resolutionDetail)
                .version(version);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return id.equals(task.id) && version == task.version;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", stepType=" + stepType +
                ", toolName='" + toolName + '\'' +
                ", status=" + status +
                ", mediaBuyId='" + mediaBuyId + '\'' +
                ", resolution=" + resolution +
                '}';
    }

    public static final class Builder {
        private String id;
        private String tenantId;
        private String principalId;
        private StepType stepType = StepType.APPROVAL;
        private String toolName;
        private TaskStatus status = TaskStatus.PENDING_APPROVAL;
        private TaskOwner owner = TaskOwner.PUBLISHER;
        private TaskAction action;
        private String mediaBuyId;
        private String requestContext;
        private String assignedTo;
        private String parentTaskId;
        private Instant createdAt;
        private Instant dueAt;
        private Instant resolvedAt;
        private String resolvedBy;
        private Resolution resolution;
        private String resolutionDetail;
        private long version;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder principalId(String principalId) {
            this.principalId = principalId;
            return this;
        }

        public Builder stepType(StepType stepType) {
            this.stepType = stepType;
            return this;
        }

        public Builder toolName(String toolName) {
            this.toolName = toolName;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder owner(TaskOwner owner) {
            this.owner = owner;
            return this;
        }

        public Builder action(TaskAction action) {
            this.action = action;
            return this;
        }

        public Builder mediaBuyId(String mediaBuyId) {
            this.mediaBuyId = mediaBuyId;
            return this;
        }

        public Builder requestContext(String requestContext) {
            this.requestContext = requestContext;
            return this;
        }

        public Builder assignedTo(String assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public Builder parentTaskId(String parentTaskId) {
            this.parentTaskId = parentTaskId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder dueAt(Instant dueAt) {
            this.dueAt = dueAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder resolvedBy(String resolvedBy) {
            this.resolvedBy = resolvedBy;
            return this;
        }

        public Builder resolution(Resolution resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder resolutionDetail(String resolutionDetail) {
            this.resolutionDetail = resolutionDetail;
            return this;
        }

        public Builder version(long version) {
            this.version = version;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }
}
