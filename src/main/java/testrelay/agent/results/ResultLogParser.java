package testrelay.agent.results;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Parses a CSV JTL result log into a {@link ResultSummary}.
 *
 * Anything that does not look like a CSV log with a header row yields the
 * empty summary. Rows are counted even when individual cells do not parse;
 * such cells are left out of the statistic they feed.
 */
public final class ResultLogParser {

    private static final Logger log = LoggerFactory.getLogger(ResultLogParser.class);

    private ResultLogParser() {
    }

    public static ResultSummary parse(String content) {
        if (content == null || content.isBlank()) {
            return ResultSummary.empty();
        }

        String[] lines = content.strip().split("\\r?\\n");
        if (lines.length < 2) {
            return ResultSummary.empty();
        }

        String header = lines[0].toLowerCase(Locale.ROOT);
        if (!header.contains("timestamp") && !header.contains("elapsed")) {
            log.debug("Result log has no CSV header, skipping");
            return ResultSummary.empty();
        }

        List<String> columns = splitCsv(lines[0]);
        int elapsedIdx = indexOf(columns, "elapsed");
        int successIdx = indexOf(columns, "success");
        int bytesIdx = indexOf(columns, "bytes");

        int total = 0;
        int successCount = 0;
        int errorCount = 0;
        List<Long> times = new ArrayList<>();
        long totalBytes = 0;

        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }

            List<String> cells = splitCsv(line);
            total++;

            if (elapsedIdx >= 0) {
                Long elapsed = parseLong(cell(cells, elapsedIdx));
                if (elapsed != null) {
                    times.add(elapsed);
                }
            }

            if (successIdx >= 0) {
                if ("true".equalsIgnoreCase(cell(cells, successIdx))) {
                    successCount++;
                } else {
                    errorCount++;
                }
            }

            if (bytesIdx >= 0) {
                Long bytes = parseLong(cell(cells, bytesIdx));
                if (bytes != null) {
                    totalBytes += bytes;
                }
            }
        }

        long[] sorted = times.stream().mapToLong(Long::longValue).sorted().toArray();
        long avg = sorted.length == 0 ? 0 : Math.round(Arrays.stream(sorted).sum() / (double) sorted.length);

        return new ResultSummary(
                total,
                successCount,
                errorCount,
                errorRate(errorCount, total),
                avg,
                sorted.length == 0 ? 0 : sorted[0],
                sorted.length == 0 ? 0 : sorted[sorted.length - 1],
                percentile(sorted, 0.90),
                percentile(sorted, 0.95),
                percentile(sorted, 0.99),
                totalBytes);
    }

    /**
     * Splits one CSV line. Double quotes group a field and {@code ""} inside
     * a quoted field is a literal quote.
     */
    static List<String> splitCsv(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    static BigDecimal errorRate(int errors, int total) {
        if (total == 0) {
            return BigDecimal.ZERO;
        }
        return BigDecimal.valueOf(errors)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }

    // sorted[floor(n * p)]
    static long percentile(long[] sorted, double p) {
        if (sorted.length == 0) {
            return 0;
        }
        int idx = (int) Math.floor(sorted.length * p);
        return sorted[Math.min(idx, sorted.length - 1)];
    }

    private static int indexOf(List<String> columns, String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).trim().equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    private static String cell(List<String> cells, int idx) {
        return idx < cells.size() ? cells.get(idx).trim() : "";
    }

    private static Long parseLong(String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
