package adcp.workflow.store;

import adcp.workflow.model.TenantPolicy;
import adcp.workflow.operation.OperationKind;
import adcp.workflow.testing.Fixtures;
import org.junit.jupiter.api.*;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcTenantPolicyRepositoryTest {

    private static Database db;
    private static JdbcTenantPolicyRepository repo;

    @BeforeAll
    static void setup() {
        db = new Database(Fixtures.h2Url("policies"), 3);
        repo = new JdbcTenantPolicyRepository(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM tenant_policies");
            conn.commit();
        }
    }

    @Test
    void saveAndFind() {
        repo.save(new TenantPolicy("tenant-1", true,
                EnumSet.of(OperationKind.CREATE_MEDIA_BUY, OperationKind.ADD_CREATIVE_ASSETS), "gam"));

        TenantPolicy policy = repo.findByTenantId("tenant-1").orElseThrow();
        assertTrue(policy.manualApprovalRequired());
        assertEquals(Set.of(OperationKind.CREATE_MEDIA_BUY, OperationKind.ADD_CREATIVE_ASSETS),
                policy.approvalRequiredOperations());
        assertEquals("gam", policy.adServer());
        assertTrue(policy.requiresApproval(OperationKind.CREATE_MEDIA_BUY));
        assertFalse(policy.requiresApproval(OperationKind.UPDATE_MEDIA_BUY));
    }

    @Test
    void saveReplacesExistingPolicy() {
        repo.save(TenantPolicy.reviewAll("tenant-1", "mock"));
        repo.save(TenantPolicy.autoApprove("tenant-1", "kevel"));

        TenantPolicy policy = repo.findByTenantId("tenant-1").orElseThrow();
        assertFalse(policy.manualApprovalRequired());
        assertTrue(policy.approvalRequiredOperations().isEmpty());
        assertEquals("kevel", policy.adServer());
    }

    @Test
    void unknownOperationNamesAreIgnored() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("INSERT INTO tenant_policies (tenant_id, manual_approval_required, "
                    + "approval_required_operations, ad_server) VALUES ('tenant-x', TRUE, "
                    + "'create_media_buy, launch_rocket', 'mock')");
            conn.commit();
        }

        TenantPolicy policy = repo.findByTenantId("tenant-x").orElseThrow();
        assertEquals(Set.of(OperationKind.CREATE_MEDIA_BUY), policy.approvalRequiredOperations());
    }

    @Test
    void missingTenant() {
        assertTrue(repo.findByTenantId("nobody").isEmpty());
    }

    @Test
    void switchOffMeansNoApprovalEvenForListedKinds() {
        TenantPolicy policy = new TenantPolicy("tenant-1", false, EnumSet.allOf(OperationKind.class), null);

        assertFalse(policy.requiresApproval(OperationKind.CREATE_MEDIA_BUY));
        assertEquals("mock", policy.adServer());
    }
}
