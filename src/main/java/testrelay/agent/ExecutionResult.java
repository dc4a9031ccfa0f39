package testrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of one job execution, ready to be reported.
 */
public record ExecutionResult(
        boolean success,
        JsonNode summary,
        String resultLogBase64,
        String reportBase64,
        String errorMessage) {

    public static ExecutionResult success(JsonNode summary, String resultLogBase64, String reportBase64) {
        return new ExecutionResult(true, summary, resultLogBase64, reportBase64, null);
    }

    public static ExecutionResult failure(String errorMessage) {
        return new ExecutionResult(false, null, null, null, errorMessage);
    }
}
