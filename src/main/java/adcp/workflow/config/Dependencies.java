package adcp.workflow.config;

import adcp.workflow.adapter.AdapterRegistry;
import adcp.workflow.adapter.MockAdServerAdapter;
import adcp.workflow.api.v1.HealthController;
import adcp.workflow.api.v1.TaskController;
import adcp.workflow.audit.AuditSink;
import adcp.workflow.delivery.DeliveryTracking;
import adcp.workflow.delivery.LiveDeliveryReporter;
import adcp.workflow.operation.OperationExecutor;
import adcp.workflow.operation.RequestContextCodec;
import adcp.workflow.repository.TaskRepository;
import adcp.workflow.repository.TenantPolicyRepository;
import adcp.workflow.scheduler.BackgroundPollerSupervisor;
import adcp.workflow.scheduler.Scheduler;
import adcp.workflow.scheduler.StaleExecutionReaper;
import adcp.workflow.server.RouterHandler;
import adcp.workflow.service.DeferredExecutionResumer;
import adcp.workflow.service.ExecutionLocks;
import adcp.workflow.service.OperationInterceptor;
import adcp.workflow.service.PolicyResolver;
import adcp.workflow.service.TaskFactory;
import adcp.workflow.service.TaskService;
import adcp.workflow.simulation.DeliverySimulator;
import adcp.workflow.store.Database;
import adcp.workflow.store.JdbcAuditSink;
import adcp.workflow.store.JdbcTaskRepository;
import adcp.workflow.store.JdbcTenantPolicyRepository;
import adcp.workflow.webhook.BackoffPolicy;
import adcp.workflow.webhook.HttpWebhookReceiver;
import adcp.workflow.webhook.WebhookDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(WorkflowConfig.fromEnv());
 * deps.startBackground(); // reaper + poller recovery
 * InterceptResult r = deps.interceptor().intercept(tenantId, principalId, operation);
 * // ... use services ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final WorkflowConfig config;
    private final Clock clock;
    private final Database database;

    // Stores
    private final TaskRepository taskRepository;
    private final TenantPolicyRepository tenantPolicyRepository;
    private final AuditSink auditSink;

    // Collaborators
    private final AdapterRegistry adapters;
    private final WebhookDispatcher webhookDispatcher;
    private final DeliveryTracking deliveryTracking;
    private final ExecutionLocks locks = new ExecutionLocks();
    private final RequestContextCodec codec = new RequestContextCodec();

    // Services
    private final TaskFactory taskFactory;
    private final PolicyResolver policyResolver;
    private final BackgroundPollerSupervisor supervisor;
    private final OperationInterceptor interceptor;
    private final DeferredExecutionResumer resumer;
    private final TaskService taskService;

    // Controllers
    private final HealthController healthController;
    private final TaskController taskController;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    // Scheduler (lazy-initialized)
    private Scheduler scheduler;

    private Dependencies(WorkflowConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);

        this.taskRepository = new JdbcTaskRepository(database);
        this.tenantPolicyRepository = new JdbcTenantPolicyRepository(database);
        this.auditSink = new JdbcAuditSink(database);

        this.adapters = new AdapterRegistry()
                .register(new MockAdServerAdapter(config.mockPollsUntilApproved()));

        this.webhookDispatcher = new WebhookDispatcher(
                BackoffPolicy.exponential(config.webhookMaxAttempts(), config.webhookInitialBackoff()));
        for (String url : config.webhookUrls()) {
            webhookDispatcher.register(new HttpWebhookReceiver(url, config.webhookToken(), config.webhookTimeout()));
        }

        this.deliveryTracking = new DeliveryTracking(
                new LiveDeliveryReporter(webhookDispatcher, clock, config.deliveryReportInterval()),
                new DeliverySimulator(webhookDispatcher, clock, config.simulationAcceleration(),
                        config.simulationInterval()));

        // Services
        OperationExecutor executor = new OperationExecutor(clock);
        this.taskFactory = new TaskFactory(taskRepository, auditSink, webhookDispatcher, codec, clock);
        this.policyResolver = new PolicyResolver(tenantPolicyRepository, adapters);
        this.supervisor = new BackgroundPollerSupervisor(taskRepository, policyResolver, locks, taskFactory, codec,
                deliveryTracking, clock, config.pollInterval(), config.maxPollingDuration(), config.pollerThreads());
        this.interceptor = new OperationInterceptor(policyResolver, taskFactory, executor, locks, supervisor,
                deliveryTracking, config.pollInterval(), config.maxPollingDuration());
        this.resumer = new DeferredExecutionResumer(taskRepository, taskFactory, policyResolver, codec, executor,
                locks, supervisor, deliveryTracking, clock, config.pollInterval(), config.maxPollingDuration());
        this.taskService = new TaskService(taskRepository, taskFactory, resumer, supervisor, clock);

        // Controllers
        this.healthController = new HealthController(database, taskService, supervisor, webhookDispatcher);
        this.taskController = new TaskController(taskService, clock);

        log.info("Dependencies initialized successfully");
    }

    public static Dependencies create(WorkflowConfig config) {
        return new Dependencies(config, Clock.systemUTC());
    }

    /**
     * Create dependencies with a custom clock (tests).
     */
    public static Dependencies create(WorkflowConfig config, Clock clock) {
        return new Dependencies(config, clock);
    }

    public static Dependencies create() {
        return create(WorkflowConfig.fromEnv());
    }

    // Getters
    public WorkflowConfig config() {
        return config;
    }

    public Clock clock() {
        return clock;
    }

    public Database database() {
        return database;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public TenantPolicyRepository tenantPolicyRepository() {
        return tenantPolicyRepository;
    }

    public AuditSink auditSink() {
        return auditSink;
    }

    public AdapterRegistry adapters() {
        return adapters;
    }

    public WebhookDispatcher webhookDispatcher() {
        return webhookDispatcher;
    }

    public DeliveryTracking deliveryTracking() {
        return deliveryTracking;
    }

    public ExecutionLocks locks() {
        return locks;
    }

    public RequestContextCodec codec() {
        return codec;
    }

    public TaskFactory taskFactory() {
        return taskFactory;
    }

    public PolicyResolver policyResolver() {
        return policyResolver;
    }

    public BackgroundPollerSupervisor supervisor() {
        return supervisor;
    }

    public OperationInterceptor interceptor() {
        return interceptor;
    }

    public DeferredExecutionResumer resumer() {
        return resumer;
    }

    public TaskService taskService() {
        return taskService;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     */
    public RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler()
                    .registerController(healthController)
                    .registerController(taskController);
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    public Scheduler scheduler() {
        if (scheduler == null) {
            scheduler = Scheduler.forReaper(
                    new StaleExecutionReaper(taskRepository, taskFactory, clock, config.staleExecutionThreshold()),
                    config);
        }
        return scheduler;
    }

    /**
     * Start the reaper and re-attach pollers to background tasks left WORKING by a previous run.
     * Should be called after server startup.
     */
    public void startBackground() {
        scheduler().start();
        supervisor.recover();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        if (scheduler != null) {
            try {
                scheduler.stop();
            } catch (Exception e) {
                log.warn("Error stopping scheduler: {}", e.getMessage());
            }
        }

        // Workers first: they write to the database and fire webhooks
        try {
            supervisor.stop();
        } catch (Exception e) {
            log.warn("Error stopping poller supervisor: {}", e.getMessage());
        }
        try {
            deliveryTracking.close();
        } catch (Exception e) {
            log.warn("Error stopping delivery tracking: {}", e.getMessage());
        }
        try {
            webhookDispatcher.close();
        } catch (Exception e) {
            log.warn("Error closing webhook dispatcher: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
