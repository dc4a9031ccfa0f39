package testrelay.agent.results;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Aggregate statistics of one result log. Times are in milliseconds.
 */
public record ResultSummary(
        @JsonProperty("totalRequests") int totalRequests,
        @JsonProperty("successCount") int successCount,
        @JsonProperty("errorCount") int errorCount,
        @JsonProperty("errorRate") BigDecimal errorRate,
        @JsonProperty("avgResponseTime") long avgResponseTime,
        @JsonProperty("minResponseTime") long minResponseTime,
        @JsonProperty("maxResponseTime") long maxResponseTime,
        @JsonProperty("p90ResponseTime") long p90ResponseTime,
        @JsonProperty("p95ResponseTime") long p95ResponseTime,
        @JsonProperty("p99ResponseTime") long p99ResponseTime,
        @JsonProperty("totalBytes") long totalBytes) {

    private static final ResultSummary EMPTY =
            new ResultSummary(0, 0, 0, BigDecimal.ZERO, 0, 0, 0, 0, 0, 0, 0);

    public static ResultSummary empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return totalRequests == 0;
    }
}
