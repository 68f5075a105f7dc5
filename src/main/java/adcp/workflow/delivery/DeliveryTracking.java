package adcp.workflow.delivery;

import adcp.workflow.adapter.AdServerAdapter;
import adcp.workflow.simulation.DeliverySimulator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts delivery reporting for a newly created media buy: live reports when the
 * adapter has real data, the accelerated simulator otherwise.
 */
public class DeliveryTracking implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeliveryTracking.class);

    private final LiveDeliveryReporter reporter;
    private final DeliverySimulator simulator;

    public DeliveryTracking(LiveDeliveryReporter reporter, DeliverySimulator simulator) {
        this.reporter = reporter;
        this.simulator = simulator;
    }

    public boolean start(AdServerAdapter adapter, DeliveryTarget target) {
        try {
            if (adapter.reportsLiveDelivery()) {
                return reporter.start(adapter, target);
            }
            return simulator.start(target);
        } catch (RuntimeException e) {
            // tracking is best effort, the media buy itself already exists
            log.warn("Could not start delivery tracking for {}: {}", target.mediaBuyId(), e.getMessage());
            return false;
        }
    }

    public void stop(String mediaBuyId) {
        reporter.stop(mediaBuyId);
        simulator.stop(mediaBuyId);
    }

    public boolean isTracking(String mediaBuyId) {
        return reporter.isReporting(mediaBuyId) || simulator.isRunning(mediaBuyId);
    }

    @Override
    public void close() {
        reporter.shutdown();
        simulator.shutdown();
    }
}
