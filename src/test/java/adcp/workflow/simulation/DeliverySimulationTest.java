package adcp.workflow.simulation;

import adcp.workflow.delivery.DeliveryTarget;
import adcp.workflow.testing.Fixtures;
import adcp.workflow.webhook.DeliveryUpdate;
import adcp.workflow.webhook.EventType;
import adcp.workflow.webhook.WebhookEvent;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeliverySimulationTest {

    private static DeliveryTarget sevenDayTarget() {
        return DeliveryTarget.of("mb_sim", "tenant-1", Fixtures.createMediaBuy());
    }

    @Test
    void sevenDayFlightAtOneHourPerTickTakes168Ticks() {
        DeliverySimulation simulation = new DeliverySimulation(sevenDayTarget(), 3600, Duration.ofSeconds(1));
        WebhookEvent started = simulation.start(Fixtures.NOW);
        assertEquals(DeliverySimulation.STARTED, started.payload().status());
        assertEquals(EventType.DELIVERY_PROGRESS, started.type());

        List<WebhookEvent> events = new ArrayList<>();
        while (!simulation.isCompleted()) {
            events.add(simulation.tick(Fixtures.NOW));
            assertTrue(events.size() <= 168, "simulation ran past the end of the flight");
        }

        assertEquals(168, simulation.ticks());
        long completed = events.stream().filter(e -> e.type() == EventType.DELIVERY_COMPLETED).count();
        assertEquals(1, completed);
        assertEquals(DeliverySimulation.COMPLETED, events.get(events.size() - 1).payload().status());
    }

    @Test
    void progressAndDeliveryAreMonotonic() {
        DeliverySimulation simulation = new DeliverySimulation(sevenDayTarget(), 3600, Duration.ofSeconds(1));
        simulation.start(Fixtures.NOW);

        double lastProgress = 0;
        long lastImpressions = 0;
        double lastSpend = 0;
        DeliveryUpdate last = null;
        while (!simulation.isCompleted()) {
            DeliveryUpdate update = (DeliveryUpdate) simulation.tick(Fixtures.NOW).payload().data();
            assertTrue(update.progress().progressPercentage() >= lastProgress);
            assertTrue(update.delivery().impressions() >= lastImpressions);
            assertTrue(update.delivery().spend() >= lastSpend);
            lastProgress = update.progress().progressPercentage();
            lastImpressions = update.delivery().impressions();
            lastSpend = update.delivery().spend();
            last = update;
        }

        assertNotNull(last);
        assertEquals(100.0, last.progress().progressPercentage());
        assertEquals(168_000, last.delivery().impressions());
        assertEquals(1_340.0, last.delivery().spend(), 0.001);
        assertEquals(168.0, last.progress().totalHours());
    }

    @Test
    void firstTickIsOneSimulatedHour() {
        DeliverySimulation simulation = new DeliverySimulation(sevenDayTarget(), 3600, Duration.ofSeconds(1));
        simulation.start(Fixtures.NOW);

        DeliveryUpdate update = (DeliveryUpdate) simulation.tick(Fixtures.NOW).payload().data();

        assertEquals(1.0, update.progress().elapsedHours());
        assertEquals(1_000, update.delivery().impressions());
        assertEquals(100.0, update.delivery().pacingPercentage());
    }

    @Test
    void largeAccelerationCompletesInOneTick() {
        DeliverySimulation simulation = new DeliverySimulation(sevenDayTarget(), 1_000_000, Duration.ofSeconds(1));
        simulation.start(Fixtures.NOW);

        WebhookEvent event = simulation.tick(Fixtures.NOW);

        assertEquals(EventType.DELIVERY_COMPLETED, event.type());
        assertTrue(simulation.isCompleted());
        DeliveryUpdate update = (DeliveryUpdate) event.payload().data();
        assertEquals(168.0, update.progress().elapsedHours());
    }

    @Test
    void misuseIsRejected() {
        DeliverySimulation simulation = new DeliverySimulation(sevenDayTarget(), 1_000_000, Duration.ofSeconds(1));

        assertThrows(IllegalStateException.class, () -> simulation.tick(Fixtures.NOW));
        simulation.start(Fixtures.NOW);
        assertThrows(IllegalStateException.class, () -> simulation.start(Fixtures.NOW));
        simulation.tick(Fixtures.NOW);
        assertThrows(IllegalStateException.class, () -> simulation.tick(Fixtures.NOW));

        assertThrows(IllegalArgumentException.class,
                () -> new DeliverySimulation(sevenDayTarget(), 0, Duration.ofSeconds(1)));
        assertThrows(IllegalArgumentException.class,
                () -> new DeliverySimulation(sevenDayTarget(), 3600, Duration.ZERO));
    }
}
