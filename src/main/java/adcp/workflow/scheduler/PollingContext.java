package adcp.workflow.scheduler;

import adcp.workflow.delivery.DeliveryTracking;
import adcp.workflow.operation.RequestContextCodec;
import adcp.workflow.repository.TaskRepository;
import adcp.workflow.service.ExecutionLocks;
import adcp.workflow.service.PolicyResolver;
import adcp.workflow.service.TaskFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Collaborators shared by all poll workers of one supervisor.
 */
record PollingContext(
        TaskRepository tasks,
        PolicyResolver policyResolver,
        ExecutionLocks locks,
        TaskFactory taskFactory,
        RequestContextCodec codec,
        DeliveryTracking deliveryTracking,
        Clock clock,
        Duration maxPolling) {
}
