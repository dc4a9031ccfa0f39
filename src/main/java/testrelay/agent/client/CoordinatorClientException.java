package testrelay.agent.client;

/**
 * Transport failure or unexpected status from the coordinator.
 */
public class CoordinatorClientException extends Exception {

    private final int statusCode;

    public CoordinatorClientException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public CoordinatorClientException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the rejected call, or -1 when no response arrived.
     */
    public int statusCode() {
        return statusCode;
    }
}
