package testrelay.agent;

/**
 * The job payload does not carry a usable test plan.
 */
public class PayloadDecodeException extends Exception {

    public PayloadDecodeException(String message) {
        super(message);
    }

    public PayloadDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
