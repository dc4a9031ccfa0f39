package testrelay.agent.tool;

/**
 * Exit status and captured output of one tool run.
 */
public record ToolResult(int exitCode, String stdout, String stderr, boolean timedOut) {

    private static final int TAIL_LENGTH = 2000;

    public boolean succeeded() {
        return !timedOut && exitCode == 0;
    }

    /**
     * Last part of stderr, for error messages.
     */
    public String stderrTail() {
        String trimmed = stderr == null ? "" : stderr.strip();
        return trimmed.length() <= TAIL_LENGTH ? trimmed : trimmed.substring(trimmed.length() - TAIL_LENGTH);
    }
}
