package testrelay.coordinator.model;

/**
 * Outcome reported by a worker when a job run ends.
 *
 * @param success         whether the tool run succeeded
 * @param summaryJson     machine-readable statistics, may be null
 * @param resultLogBase64 raw result log, base64
 * @param reportBase64    rendered report, base64
 * @param errorMessage    human-readable reason on failure
 */
public record JobOutcome(
        boolean success,
        String summaryJson,
        String resultLogBase64,
        String reportBase64,
        String errorMessage) {

    public static JobOutcome completed(String summaryJson, String resultLogBase64, String reportBase64) {
        return new JobOutcome(true, summaryJson, resultLogBase64, reportBase64, null);
    }

    public static JobOutcome failed(String errorMessage) {
        return new JobOutcome(false, null, null, null, errorMessage);
    }
}
