package testrelay.agent.results;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResultLogParserTest {

    private static final String HEADER =
            "timeStamp,elapsed,label,responseCode,responseMessage,threadName,dataType,success,failureMessage,bytes";

    @Test
    @DisplayName("Aggregates counts, times and bytes from a CSV log")
    void parsesCsvLog() {
        String log = String.join("\n",
                HEADER,
                "1700000000000,100,home,200,OK,t-1,text,true,,1000",
                "1700000000100,200,home,200,OK,t-1,text,true,,2000",
                "1700000000200,300,login,500,Error,t-2,text,false,Internal,500",
                "1700000000300,400,login,200,OK,t-2,text,true,,1500");

        ResultSummary summary = ResultLogParser.parse(log);

        assertEquals(4, summary.totalRequests());
        assertEquals(3, summary.successCount());
        assertEquals(1, summary.errorCount());
        assertEquals(new BigDecimal("25.00"), summary.errorRate());
        assertEquals(250, summary.avgResponseTime());
        assertEquals(100, summary.minResponseTime());
        assertEquals(400, summary.maxResponseTime());
        assertEquals(5000, summary.totalBytes());
        assertFalse(summary.isEmpty());
    }

    @Test
    @DisplayName("Percentiles pick sorted[floor(n * p)]")
    void percentilesUseFloorIndex() {
        StringBuilder log = new StringBuilder(HEADER).append('\n');
        // elapsed 100 down to 1, written out of order
        for (int i = 100; i >= 1; i--) {
            log.append("1700000000000,").append(i).append(",req,200,OK,t,text,true,,10\n");
        }

        ResultSummary summary = ResultLogParser.parse(log.toString());

        assertEquals(100, summary.totalRequests());
        assertEquals(91, summary.p90ResponseTime());
        assertEquals(96, summary.p95ResponseTime());
        assertEquals(100, summary.p99ResponseTime());
        assertEquals(51, summary.avgResponseTime());
    }

    @Test
    @DisplayName("Five all-successful samples")
    void fiveSamples() {
        StringBuilder log = new StringBuilder("timeStamp,elapsed,success\n");
        for (int elapsed : new int[] {30, 10, 50, 20, 40}) {
            log.append("1700000000000,").append(elapsed).append(",true\n");
        }

        ResultSummary summary = ResultLogParser.parse(log.toString());

        assertEquals(50, summary.p90ResponseTime());
        assertEquals(30, summary.avgResponseTime());
        assertEquals(0, summary.errorRate().signum());
    }

    @Test
    @DisplayName("A single sample is every percentile")
    void singleSample() {
        ResultSummary summary = ResultLogParser.parse(HEADER + "\n1700000000000,42,req,200,OK,t,text,true,,7");

        assertEquals(42, summary.p90ResponseTime());
        assertEquals(42, summary.p99ResponseTime());
        assertEquals(42, summary.minResponseTime());
        assertEquals(BigDecimal.ZERO.setScale(2), summary.errorRate());
    }

    @Test
    @DisplayName("Quoted fields with commas do not shift columns")
    void quotedFields() {
        String log = HEADER + "\n"
                + "1700000000000,150,\"search, page 2\",200,\"OK, \"\"fine\"\"\",t-1,text,TRUE,,300";

        ResultSummary summary = ResultLogParser.parse(log);

        assertEquals(1, summary.totalRequests());
        assertEquals(1, summary.successCount());
        assertEquals(150, summary.avgResponseTime());
        assertEquals(300, summary.totalBytes());
    }

    @Test
    @DisplayName("Unparseable cells are skipped but the row still counts")
    void badCells() {
        String log = String.join("\n",
                HEADER,
                "1700000000000,abc,req,200,OK,t,text,true,,xyz",
                "1700000000000,80,req,200,OK,t,text,maybe,,20",
                "",
                "1700000000000,120,req,200,OK,t,text,true,,40");

        ResultSummary summary = ResultLogParser.parse(log);

        assertEquals(3, summary.totalRequests());
        assertEquals(2, summary.successCount());
        assertEquals(1, summary.errorCount());
        assertEquals(100, summary.avgResponseTime());
        assertEquals(80, summary.minResponseTime());
        assertEquals(60, summary.totalBytes());
        assertEquals(new BigDecimal("33.33"), summary.errorRate());
    }

    @Test
    @DisplayName("Missing, blank, header-only and XML logs yield the empty summary")
    void emptyInputs() {
        assertTrue(ResultLogParser.parse(null).isEmpty());
        assertTrue(ResultLogParser.parse("   \n ").isEmpty());
        assertTrue(ResultLogParser.parse(HEADER).isEmpty());
        assertTrue(ResultLogParser.parse("<?xml version=\"1.0\"?>\n<testResults/>").isEmpty());
        assertEquals(ResultSummary.empty(), ResultLogParser.parse(HEADER + "\n"));
    }

    @Test
    @DisplayName("Column lookup ignores case and works without a success column")
    void caseInsensitiveColumns() {
        String log = "TimeStamp,Elapsed,Bytes\r\n1,10,5\r\n2,30,5\r\n";

        ResultSummary summary = ResultLogParser.parse(log);

        assertEquals(2, summary.totalRequests());
        assertEquals(0, summary.successCount());
        assertEquals(0, summary.errorCount());
        assertEquals(20, summary.avgResponseTime());
        assertEquals(10, summary.totalBytes());
    }

    @Test
    void splitCsv() {
        assertEquals(List.of("a", "b,c", "d\"e", ""), ResultLogParser.splitCsv("a,\"b,c\",\"d\"\"e\","));
    }

    @Test
    void errorRateRounding() {
        assertEquals(BigDecimal.ZERO, ResultLogParser.errorRate(0, 0));
        assertEquals(new BigDecimal("66.67"), ResultLogParser.errorRate(2, 3));
        assertEquals(new BigDecimal("100.00"), ResultLogParser.errorRate(5, 5));
    }
}
