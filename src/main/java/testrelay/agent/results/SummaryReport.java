package testrelay.agent.results;

/**
 * Renders the markdown report that accompanies a load test result.
 */
public final class SummaryReport {

    private SummaryReport() {
    }

    /**
     * @param jobId           job the report belongs to
     * @param executionMillis wall time of the whole run
     * @param threads         virtual users, or null when the plan's default was used
     * @param rampUp          ramp-up seconds, or null
     * @param duration        duration seconds, or null
     * @param summary         parsed statistics
     */
    public static String render(String jobId, long executionMillis, Integer threads, Integer rampUp,
            Integer duration, ResultSummary summary) {
        StringBuilder sb = new StringBuilder();
        sb.append("# JMeter Performance Test Report\n\n");

        sb.append("## Test Summary\n");
        sb.append("- **Job ID**: ").append(jobId).append('\n');
        sb.append("- **Execution Time**: ").append(executionMillis).append("ms\n");
        sb.append("- **Virtual Users**: ").append(orDefault(threads)).append('\n');
        sb.append("- **Ramp Up**: ").append(seconds(rampUp)).append('\n');
        sb.append("- **Duration**: ").append(seconds(duration)).append("\n\n");

        sb.append("## Results\n");
        sb.append("- **Total Requests**: ").append(summary.totalRequests()).append('\n');
        sb.append("- **Successful**: ").append(summary.successCount()).append('\n');
        sb.append("- **Failed**: ").append(summary.errorCount()).append('\n');
        sb.append("- **Error Rate**: ").append(summary.errorRate().toPlainString()).append("%\n\n");

        sb.append("## Response Times\n");
        sb.append("- **Average**: ").append(summary.avgResponseTime()).append("ms\n");
        sb.append("- **Min**: ").append(summary.minResponseTime()).append("ms\n");
        sb.append("- **Max**: ").append(summary.maxResponseTime()).append("ms\n");
        sb.append("- **90th Percentile**: ").append(summary.p90ResponseTime()).append("ms\n");
        sb.append("- **95th Percentile**: ").append(summary.p95ResponseTime()).append("ms\n");
        sb.append("- **99th Percentile**: ").append(summary.p99ResponseTime()).append("ms\n\n");

        sb.append("## Data Transfer\n");
        sb.append("- **Total Bytes**: ").append(summary.totalBytes()).append('\n');

        return sb.toString();
    }

    private static String orDefault(Integer value) {
        return value == null ? "Default" : value.toString();
    }

    private static String seconds(Integer value) {
        return value == null ? "Default" : value + "s";
    }
}
