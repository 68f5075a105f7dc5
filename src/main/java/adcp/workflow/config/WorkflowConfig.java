package adcp.workflow.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration holder for the workflow engine.
 * All settings have sensible defaults.
 */
public final class WorkflowConfig {

    // Database settings
    private String databaseUrl = "jdbc:h2:file:./data/adcp-workflow;AUTO_SERVER=TRUE;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE";
    private int databasePoolSize = 10;

    // Server settings
    private int serverPort = 8080;
    private String serverHost = "0.0.0.0";

    // Background polling
    private Duration pollInterval = Duration.ofSeconds(30);
    private Duration maxPollingDuration = Duration.ofMinutes(15);
    private int pollerThreads = 4;

    // Stale execution reaper
    private Duration staleExecutionThreshold = Duration.ofMinutes(30);
    private Duration reaperInterval = Duration.ofMinutes(1);

    // Webhooks
    private List<String> webhookUrls = new ArrayList<>();
    private String webhookToken = null;
    private int webhookMaxAttempts = 3;
    private Duration webhookInitialBackoff = Duration.ofSeconds(1);
    private Duration webhookTimeout = Duration.ofSeconds(10);

    // Delivery simulation / reporting
    private double simulationAcceleration = 3600.0;
    private Duration simulationInterval = Duration.ofSeconds(1);
    private Duration deliveryReportInterval = Duration.ofHours(1);

    // Adapter
    private String defaultAdServer = "mock";
    private int mockPollsUntilApproved = 0;

    private WorkflowConfig() {
    }

    public static WorkflowConfig defaults() {
        return new WorkflowConfig();
    }

    public static WorkflowConfig fromEnv() {
        WorkflowConfig config = new WorkflowConfig();

        String dbUrl = System.getenv("ADCP_DB_URL");
        if (dbUrl != null && !dbUrl.isBlank()) {
            config.databaseUrl = dbUrl;
        }

        String port = System.getenv("ADCP_PORT");
        if (port != null && !port.isBlank()) {
            config.serverPort = Integer.parseInt(port);
        }

        String pollSeconds = System.getenv("ADCP_POLL_INTERVAL_SECONDS");
        if (pollSeconds != null && !pollSeconds.isBlank()) {
            config.pollInterval = Duration.ofSeconds(Long.parseLong(pollSeconds));
        }

        String maxPolling = System.getenv("ADCP_MAX_POLLING_MINUTES");
        if (maxPolling != null && !maxPolling.isBlank()) {
            config.maxPollingDuration = Duration.ofMinutes(Long.parseLong(maxPolling));
        }

        String urls = System.getenv("ADCP_WEBHOOK_URLS");
        if (urls != null && !urls.isBlank()) {
            config.webhookUrls = parseList(urls);
        }

        String token = System.getenv("ADCP_WEBHOOK_TOKEN");
        if (token != null && !token.isBlank()) {
            config.webhookToken = token;
        }

        String acceleration = System.getenv("ADCP_SIMULATION_ACCELERATION");
        if (acceleration != null && !acceleration.isBlank()) {
            config.simulationAcceleration = Double.parseDouble(acceleration);
        }

        String mockPolls = System.getenv("ADCP_MOCK_POLLS_UNTIL_APPROVED");
        if (mockPolls != null && !mockPolls.isBlank()) {
            config.mockPollsUntilApproved = Integer.parseInt(mockPolls);
        }

        return config;
    }

    private static List<String> parseList(String csv) {
        List<String> out = new ArrayList<>();
        for (String part : csv.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                out.add(trimmed);
            }
        }
        return out;
    }

    // Getters
    public String databaseUrl() {
        return databaseUrl;
    }

    public int databasePoolSize() {
        return databasePoolSize;
    }

    public int serverPort() {
        return serverPort;
    }

    public String serverHost() {
        return serverHost;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration maxPollingDuration() {
        return maxPollingDuration;
    }

    public int pollerThreads() {
        return pollerThreads;
    }

    public Duration staleExecutionThreshold() {
        return staleExecutionThreshold;
    }

    public Duration reaperInterval() {
        return reaperInterval;
    }

    public List<String> webhookUrls() {
        return List.copyOf(webhookUrls);
    }

    public String webhookToken() {
        return webhookToken;
    }

    public int webhookMaxAttempts() {
        return webhookMaxAttempts;
    }

    public Duration webhookInitialBackoff() {
        return webhookInitialBackoff;
    }

    public Duration webhookTimeout() {
        return webhookTimeout;
    }

    public double simulationAcceleration() {
        return simulationAcceleration;
    }

    public Duration simulationInterval() {
        return simulationInterval;
    }

    public Duration deliveryReportInterval() {
        return deliveryReportInterval;
    }

    public String defaultAdServer() {
        return defaultAdServer;
    }

    public int mockPollsUntilApproved() {
        return mockPollsUntilApproved;
    }

    // Fluent setters for testing/customization
    public WorkflowConfig withDatabaseUrl(String url) {
        this.databaseUrl = url;
        return this;
    }

    public WorkflowConfig withServerPort(int port) {
        this.serverPort = port;
        return this;
    }

    public WorkflowConfig withPollInterval(Duration interval) {
        this.pollInterval = interval;
        return this;
    }

    public WorkflowConfig withMaxPollingDuration(Duration duration) {
        this.maxPollingDuration = duration;
        return this;
    }

    public WorkflowConfig withStaleExecutionThreshold(Duration threshold) {
        this.staleExecutionThreshold = threshold;
        return this;
    }

    public WorkflowConfig withReaperInterval(Duration interval) {
        this.reaperInterval = interval;
        return this;
    }

    public WorkflowConfig withWebhookUrls(List<String> urls) {
        this.webhookUrls = new ArrayList<>(urls);
        return this;
    }

    public WorkflowConfig withWebhookToken(String token) {
        this.webhookToken = token;
        return this;
    }

    public WorkflowConfig withWebhookInitialBackoff(Duration backoff) {
        this.webhookInitialBackoff = backoff;
        return this;
    }

    public WorkflowConfig withSimulationAcceleration(double acceleration) {
        this.simulationAcceleration = acceleration;
        return this;
    }

    public WorkflowConfig withSimulationInterval(Duration interval) {
        this.simulationInterval = interval;
        return this;
    }

    public WorkflowConfig withMockPollsUntilApproved(int polls) {
        this.mockPollsUntilApproved = polls;
        return this;
    }

    @Override
    public String toString() {
        return "WorkflowConfig{" +
                "databaseUrl='" + databaseUrl + '\'' +
                ", serverPort=" + serverPort +
                ", pollInterval=" + pollInterval +
                ", maxPollingDuration=" + maxPollingDuration +
                ", webhookReceivers=" + webhookUrls.size() +
                ", webhookTokenSet=" + (webhookToken != null) +
                ", simulationAcceleration=" + simulationAcceleration +
                '}';
    }
}
