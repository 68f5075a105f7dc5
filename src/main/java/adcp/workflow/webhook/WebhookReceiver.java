package adcp.workflow.webhook;

/**
 * Destination for webhook payloads: a remote HTTP endpoint or an in-process listener.
 */
public interface WebhookReceiver {

    String name();

    void deliver(WebhookPayload payload) throws WebhookDeliveryException;
}
