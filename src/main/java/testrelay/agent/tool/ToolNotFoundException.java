package testrelay.agent.tool;

/**
 * The external test tool could not be found on this host.
 */
public class ToolNotFoundException extends Exception {

    public ToolNotFoundException(String message) {
        super(message);
    }
}
