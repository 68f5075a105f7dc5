package adcp.workflow.webhook;

/**
 * A receiver could not accept a payload; the dispatcher may retry.
 */
public class WebhookDeliveryException extends Exception {

    public WebhookDeliveryException(String message) {
        super(message);
    }

    public WebhookDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
