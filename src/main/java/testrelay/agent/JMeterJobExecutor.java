package testrelay.agent;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.agent.client.AssignedJob;
import testrelay.agent.client.HttpCoordinatorClient;
import testrelay.agent.results.ResultLogParser;
import testrelay.agent.results.ResultSummary;
import testrelay.agent.results.SummaryReport;
import testrelay.agent.tool.LoadToolRunner;
import testrelay.agent.tool.ToolLocator;
import testrelay.agent.tool.ToolNotFoundException;
import testrelay.agent.tool.ToolResult;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Runs JMeter load tests.
 *
 * Each job gets its own scratch directory holding the decoded plan, the JTL
 * log and the HTML report. The directory is removed once the job is done,
 * whatever the outcome.
 */
public class JMeterJobExecutor implements JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JMeterJobExecutor.class);

    static final String PLAN_FILE = "test.jmx";
    static final String RESULT_LOG_FILE = "results.jtl";
    static final String REPORT_DIR = "report";

    private final AgentConfig config;
    private final ToolLocator locator;
    private final LoadToolRunner runner;

    public JMeterJobExecutor(AgentConfig config, ToolLocator locator, LoadToolRunner runner) {
        this.config = config;
        this.locator = locator;
        this.runner = runner;
    }

    /**
     * JMeter saturates the host on its own.
     */
    @Override
    public int maxConcurrency() {
        return 1;
    }

    @Override
    public ExecutionResult execute(AssignedJob job) {
        Path scratch = scratchDir(job.id());
        long startedAt = System.currentTimeMillis();

        try {
            LoadPlan plan = LoadPlan.from(job.payload());

            Files.createDirectories(scratch);
            Files.write(scratch.resolve(PLAN_FILE), plan.plan());
            log.info("Job {}: plan written ({} bytes) to {}", job.id(), plan.plan().length, scratch);

            Path jmeter = locator.locate();
            ToolResult result = runner.run(jmeter, arguments(plan), scratch);

            if (result.timedOut()) {
                return ExecutionResult.failure("JMeter timed out after " + config.toolTimeout());
            }
            if (result.exitCode() != 0) {
                return ExecutionResult.failure(
                        "JMeter exited with code " + result.exitCode() + ": " + result.stderrTail());
            }

            String resultLog = readResultLog(job.id(), scratch.resolve(RESULT_LOG_FILE));
            ResultSummary summary = ResultLogParser.parse(resultLog);
            String report = SummaryReport.render(job.id(), System.currentTimeMillis() - startedAt,
                    plan.threads(), plan.rampUp(), plan.duration(), summary);

            log.info("Job {}: {} requests, {}% errors", job.id(), summary.totalRequests(), summary.errorRate());

            JsonNode summaryJson = HttpCoordinatorClient.mapper().valueToTree(summary);
            return ExecutionResult.success(summaryJson, encode(resultLog), encode(report));

        } catch (PayloadDecodeException | ToolNotFoundException e) {
            log.warn("Job {} failed: {}", job.id(), e.getMessage());
            return ExecutionResult.failure(e.getMessage());
        } catch (IOException e) {
            log.error("Job {} failed with I/O error", job.id(), e);
            return ExecutionResult.failure("Failed to run JMeter: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionResult.failure("Execution interrupted");
        } finally {
            deleteRecursively(scratch);
        }
    }

    Path scratchDir(String jobId) {
        return config.workDir().resolve(config.workDirPrefix() + "-perf-" + jobId);
    }

    static List<String> arguments(LoadPlan plan) {
        List<String> args = new ArrayList<>(List.of(
                "-n",
                "-t", PLAN_FILE,
                "-l", RESULT_LOG_FILE,
                "-e",
                "-o", REPORT_DIR));
        if (plan.threads() != null) {
            args.add("-Jthreads=" + plan.threads());
        }
        if (plan.rampUp() != null) {
            args.add("-Jrampup=" + plan.rampUp());
        }
        if (plan.duration() != null) {
            args.add("-Jduration=" + plan.duration());
        }
        return args;
    }

    private static String readResultLog(String jobId, Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Job {}: could not read result log {}: {}", jobId, file, e.getMessage());
            return null;
        }
    }

    private static String encode(String content) {
        if (content == null || content.isEmpty()) {
            return null;
        }
        return Base64.getEncoder().encodeToString(content.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Best-effort removal of a scratch directory. Entries that cannot be
     * removed are logged and skipped.
     *
     * @return true if nothing is left behind
     */
    static boolean deleteRecursively(Path dir) {
        if (!Files.exists(dir, LinkOption.NOFOLLOW_LINKS)) {
            return true;
        }
        List<Path> leftovers = new ArrayList<>();
        try {
            Files.walkFileTree(dir, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    if (!(e instanceof NoSuchFileException)) {
                        leftovers.add(file);
                        log.debug("Cannot visit {}: {}", file, e.getMessage());
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path subdir, IOException e) {
                    delete(subdir);
                    return FileVisitResult.CONTINUE;
                }

                private void delete(Path path) {
                    try {
                        Files.deleteIfExists(path);
                    } catch (IOException e) {
                        leftovers.add(path);
                        log.debug("Cannot delete {}: {}", path, e.getMessage());
                    }
                }
            });
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to clean up work directory {}: {}", dir, e.getMessage());
            return false;
        }
        if (!leftovers.isEmpty()) {
            log.warn("Failed to clean up work directory {}: {} entries left, first {}",
                    dir, leftovers.size(), leftovers.get(0));
            return false;
        }
        return true;
    }

    /**
     * Decoded job payload: the plan file plus optional JMeter property overrides.
     */
    record LoadPlan(byte[] plan, Integer threads, Integer rampUp, Integer duration) {

        static LoadPlan from(JsonNode payload) throws PayloadDecodeException {
            if (payload == null || !payload.isObject()) {
                throw new PayloadDecodeException("Invalid test plan payload: payload is not an object");
            }

            JsonNode planNode = payload.get("plan");
            if (planNode == null || !planNode.isTextual() || planNode.asText().isBlank()) {
                throw new PayloadDecodeException("Invalid test plan payload: missing plan");
            }

            byte[] plan;
            try {
                plan = Base64.getDecoder().decode(planNode.asText().replaceAll("\\s", ""));
            } catch (IllegalArgumentException e) {
                throw new PayloadDecodeException("Invalid test plan payload: " + e.getMessage(), e);
            }
            if (plan.length == 0) {
                throw new PayloadDecodeException("Invalid test plan payload: plan is empty");
            }

            return new LoadPlan(plan, optionalInt(payload, "threads"), optionalInt(payload, "rampup"),
                    optionalInt(payload, "duration"));
        }

        private static Integer optionalInt(JsonNode payload, String field) throws PayloadDecodeException {
            JsonNode node = payload.get(field);
            if (node == null || node.isNull()) {
                return null;
            }
            if (node.canConvertToInt()) {
                return node.asInt();
            }
            if (node.isTextual()) {
                try {
                    return Integer.parseInt(node.asText().trim());
                } catch (NumberFormatException e) {
                    throw new PayloadDecodeException("Invalid test plan payload: " + field + " is not a number", e);
                }
            }
            throw new PayloadDecodeException("Invalid test plan payload: " + field + " is not a number");
        }
    }
}
