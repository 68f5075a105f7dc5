package adcp.workflow.store;

import adcp.workflow.audit.AuditEntry;
import adcp.workflow.testing.Fixtures;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAuditSinkTest {

    private static Database db;
    private static JdbcAuditSink sink;

    @BeforeAll
    static void setup() {
        db = new Database(Fixtures.h2Url("audit"), 3);
        sink = new JdbcAuditSink(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @Test
    void entriesAreReturnedOldestFirst() {
        sink.record(AuditEntry.of("tenant-1", "a_audit", AuditEntry.TASK_EXECUTED, "system", "active",
                Fixtures.NOW.plusSeconds(10)));
        sink.record(AuditEntry.of("tenant-1", "a_audit", AuditEntry.TASK_CREATED, "principal-1", "awaiting",
                Fixtures.NOW));
        sink.record(AuditEntry.of("tenant-1", "a_other", AuditEntry.TASK_CREATED, "principal-1", null,
                Fixtures.NOW));

        List<AuditEntry> entries = sink.findByTaskId("a_audit");

        assertEquals(2, entries.size());
        assertEquals(AuditEntry.TASK_CREATED, entries.get(0).event());
        assertEquals("principal-1", entries.get(0).actor());
        assertEquals(Fixtures.NOW, entries.get(0).createdAt());
        assertEquals(AuditEntry.TASK_EXECUTED, entries.get(1).event());
        assertEquals("active", entries.get(1).detail());
    }

    @Test
    void eventIsRequired() {
        assertThrows(NullPointerException.class,
                () -> AuditEntry.of("tenant-1", "a_1", null, "x", null, Fixtures.NOW));
    }
}
