package testrelay.agent.results;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class SummaryReportTest {

    @Test
    @DisplayName("Report lists parameters and statistics")
    void rendersStatistics() {
        ResultSummary summary = new ResultSummary(10, 9, 1, new BigDecimal("10.00"),
                120, 50, 400, 300, 350, 390, 12345);

        String report = SummaryReport.render("job-1", 65000, 25, 10, 60, summary);

        assertTrue(report.startsWith("# JMeter Performance Test Report"));
        assertTrue(report.contains("- **Job ID**: job-1"));
        assertTrue(report.contains("- **Execution Time**: 65000ms"));
        assertTrue(report.contains("- **Virtual Users**: 25"));
        assertTrue(report.contains("- **Ramp Up**: 10s"));
        assertTrue(report.contains("- **Duration**: 60s"));
        assertTrue(report.contains("- **Total Requests**: 10"));
        assertTrue(report.contains("- **Failed**: 1"));
        assertTrue(report.contains("- **Error Rate**: 10.00%"));
        assertTrue(report.contains("- **95th Percentile**: 350ms"));
        assertTrue(report.contains("- **Total Bytes**: 12345"));
    }

    @Test
    @DisplayName("Unset overrides show as Default")
    void defaultsForMissingOverrides() {
        String report = SummaryReport.render("job-2", 10, null, null, null, ResultSummary.empty());

        assertTrue(report.contains("- **Virtual Users**: Default"));
        assertTrue(report.contains("- **Ramp Up**: Default\n"));
        assertTrue(report.contains("- **Error Rate**: 0%"));
        assertTrue(report.contains("- **Total Requests**: 0"));
    }
}
