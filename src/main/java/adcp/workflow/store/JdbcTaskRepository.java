package adcp.workflow.store;

import adcp.workflow.model.Resolution;
import adcp.workflow.model.ResolveOutcome;
import adcp.workflow.model.StepType;
import adcp.workflow.model.Task;
import adcp.workflow.model.TaskAction;
import adcp.workflow.model.TaskOwner;
import adcp.workflow.model.TaskQuery;
import adcp.workflow.model.TaskStatus;
import adcp.workflow.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * JDBC implementation of TaskRepository.
 * State changes are guarded UPDATEs (compare-and-set on status/resolution); request_context
 * is written once by {@link #create} and never appears in an UPDATE.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public String create(Task task) {
        String sql = """
                    INSERT INTO tasks (id, tenant_id, principal_id, step_type, tool_name, status, owner, action,
                                       media_buy_id, request_context, assigned_to, parent_task_id,
                                       created_at, due_at, resolved_at, resolved_by, resolution,
                                       resolution_detail, version)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 0)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, task.id());
            ps.setString(2, task.tenantId());
            ps.setString(3, task.principalId());
            ps.setString(4, task.stepType().name());
            ps.setString(5, task.toolName());
            ps.setString(6, task.status().name());
            ps.setString(7, task.owner().name());
            ps.setString(8, task.action().name());
            ps.setString(9, task.mediaBuyId());
            ps.setString(10, task.requestContext());
            ps.setString(11, task.assignedTo());
            ps.setString(12, task.parentTaskId());
            setTimestamp(ps, 13, task.createdAt());
            setTimestamp(ps, 14, task.dueAt());
            setTimestamp(ps, 15, task.resolvedAt());
            ps.setString(16, task.resolvedBy());
            ps.setString(17, task.resolution() != null ? task.resolution().name() : null);
            ps.setString(18, task.resolutionDetail());

            ps.executeUpdate();
            conn.commit();

            log.debug("Task {} created ({} {}, tenant {})", task.id(), task.stepType(), task.toolName(),
                    task.tenantId());
            return task.id();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(String taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<Task> list(TaskQuery query, Instant now) {
        StringBuilder sql = new StringBuilder("SELECT * FROM tasks WHERE 1 = 1");
        List<Object> params = new ArrayList<>();

        if (query.tenantId() != null) {
            sql.append(" AND tenant_id = ?");
            params.add(query.tenantId());
        }
        if (query.status() != null) {
            sql.append(" AND status = ?");
            params.add(query.status().name());
        }
        if (!query.includeBackground()) {
            sql.append(" AND step_type <> ?");
            params.add(StepType.BACKGROUND_TASK.name());
        }
        if (query.overdue() != null) {
            sql.append(query.overdue()
                    ? " AND (status = ? AND due_at < ?)"
                    : " AND NOT (status = ? AND due_at < ?)");
            params.add(TaskStatus.PENDING_APPROVAL.name());
            params.add(Timestamp.from(now));
        }
        sql.append(" ORDER BY created_at, id LIMIT ?");
        params.add(query.limit() > 0 ? query.limit() : TaskQuery.DEFAULT_LIMIT);

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            for (int i = 0; i < params.size(); i++) {
                ps.setObject(i + 1, params.get(i));
            }
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list tasks", e);
        }
    }

    @Override
    public ResolveOutcome resolve(String taskId, Resolution resolution, String detail, String resolvedBy,
            Instant at) {
        Optional<Task> taskOpt = findById(taskId);
        if (taskOpt.isEmpty()) {
            return ResolveOutcome.notFound();
        }

        Task task = taskOpt.get();
        if (task.isResolved() || task.status().isTerminal()) {
            return ResolveOutcome.alreadyResolved(task);
        }

        TaskStatus target = targetStatus(task, resolution);

        // The WHERE clause is the real guard: a concurrent resolve or transition makes this a no-op.
        String sql = """
                    UPDATE tasks
                    SET status = ?, resolution = ?, resolution_detail = ?, resolved_by = ?, resolved_at = ?,
                        version = version + 1
                    WHERE id = ? AND resolution IS NULL AND status = ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, target.name());
            ps.setString(2, resolution.name());
            ps.setString(3, detail);
            ps.setString(4, resolvedBy);
            setTimestamp(ps, 5, at);
            ps.setString(6, taskId);
            ps.setString(7, task.status().name());

            int updated = ps.executeUpdate();
            conn.commit();

            Task stored = findById(taskId).orElseThrow(
                    () -> new IllegalStateException("Task disappeared during resolve: " + taskId));
            if (updated == 0) {
                return ResolveOutcome.alreadyResolved(stored);
            }

            log.debug("Task {} resolved {} by {} -> {}", taskId, resolution, resolvedBy, target);
            return ResolveOutcome.resolved(stored);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to resolve task: " + taskId, e);
        }
    }

    private static TaskStatus targetStatus(Task task, Resolution resolution) {
        if (resolution == Resolution.REJECTED) {
            return TaskStatus.REJECTED;
        }
        // Approved: a reviewer's approval starts execution, a background task's approval completes it
        return task.status() == TaskStatus.PENDING_APPROVAL ? TaskStatus.WORKING : TaskStatus.COMPLETED;
    }

    @Override
    public boolean transition(String taskId, TaskStatus from, TaskStatus to, String detail, Instant at) {
        StringBuilder sql = new StringBuilder("UPDATE tasks SET status = ?, version = version + 1");
        if (detail != null) {
            sql.append(", resolution_detail = ?");
        }
        if (to.isTerminal()) {
            sql.append(", resolved_at = COALESCE(resolved_at, ?)");
        }
        sql.append(" WHERE id = ? AND status = ?");

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql.toString())) {

            int i = 1;
            ps.setString(i++, to.name());
            if (detail != null) {
                ps.setString(i++, detail);
            }
            if (to.isTerminal()) {
                setTimestamp(ps, i++, at);
            }
            ps.setString(i++, taskId);
            ps.setString(i, from.name());

            int updated = ps.executeUpdate();
            conn.commit();

            if (updated > 0) {
                log.debug("Task {} {} -> {}", taskId, from, to);
            }
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to transition task: " + taskId, e);
        }
    }

    @Override
    public boolean assignMediaBuy(String taskId, String mediaBuyId) {
        String sql = """
                    UPDATE tasks
                    SET media_buy_id = ?, version = version + 1
                    WHERE id = ? AND media_buy_id IS NULL
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, mediaBuyId);
            ps.setString(2, taskId);

            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to assign media buy to task: " + taskId, e);
        }
    }

    @Override
    public List<Task> findWorkingBackgroundTasks() {
        String sql = """
                    SELECT * FROM tasks
                    WHERE step_type = 'BACKGROUND_TASK' AND status = 'WORKING'
                    ORDER BY created_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find working background tasks", e);
        }
    }

    @Override
    public List<Task> findStaleExecutions(Instant resolvedBefore) {
        String sql = """
                    SELECT * FROM tasks t
                    WHERE t.status = 'WORKING'
                      AND t.step_type <> 'BACKGROUND_TASK'
                      AND t.resolved_at < ?
                      AND NOT EXISTS (
                          SELECT 1 FROM tasks c
                          WHERE c.parent_task_id = t.id AND c.status = 'WORKING'
                      )
                    ORDER BY t.resolved_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(resolvedBefore));
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find stale executions", e);
        }
    }

    @Override
    public List<Task> findByParentId(String parentTaskId) {
        String sql = "SELECT * FROM tasks WHERE parent_task_id = ? ORDER BY created_at";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, parentTaskId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to find child tasks of: " + parentTaskId, e);
        }
    }

    // Helper methods

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        String resolution = rs.getString("resolution");
        return Task.builder()
                .id(rs.getString("id"))
                .tenantId(rs.getString("tenant_id"))
                .principalId(rs.getString("principal_id"))
                .stepType(StepType.valueOf(rs.getString("step_type")))
                .toolName(rs.getString("tool_name"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .owner(TaskOwner.valueOf(rs.getString("owner")))
                .action(TaskAction.valueOf(rs.getString("action")))
                .mediaBuyId(rs.getString("media_buy_id"))
                .requestContext(rs.getString("request_context"))
                .assignedTo(rs.getString("assigned_to"))
                .parentTaskId(rs.getString("parent_task_id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .dueAt(toInstant(rs.getTimestamp("due_at")))
                .resolvedAt(toInstant(rs.getTimestamp("resolved_at")))
                .resolvedBy(rs.getString("resolved_by"))
                .resolution(resolution != null ? Resolution.valueOf(resolution) : null)
                .resolutionDetail(rs.getString("resolution_detail"))
                .version(rs.getLong("version"))
                .build();
    }

    private static void setTimestamp(PreparedStatement ps, int index, Instant instant) throws SQLException {
        if (instant != null) {
            ps.setTimestamp(index, Timestamp.from(instant));
        } else {
            ps.setNull(index, Types.TIMESTAMP);
        }
    }

    private static Instant toInstant(Timestamp ts) {
        return ts != null ? ts.toInstant() : null;
    }
}
