package adcp.workflow.service;

/**
 * No usable policy for a tenant: policy row missing or its ad server not registered.
 */
public class PolicyLookupException extends RuntimeException {

    public PolicyLookupException(String message) {
        super(message);
    }
}
