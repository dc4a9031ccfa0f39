package testrelay.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.api.Controller;
import testrelay.coordinator.api.internal.v1.dto.AgentActionRequest;
import testrelay.coordinator.api.internal.v1.dto.AgentJobResponse;
import testrelay.coordinator.api.internal.v1.dto.JobResultRequest;
import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobClaimResult;
import testrelay.coordinator.model.JobReportResult;
import testrelay.coordinator.model.JobStartResult;
import testrelay.coordinator.server.RouterHandler;
import testrelay.coordinator.service.JobService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for the agent side of the job queue (internal API).
 * GET /internal/v1/jobs/poll?agentId= - Next claimable job, or 204
 * GET /internal/v1/jobs/{jobId} - Job status and owner
 * POST /internal/v1/jobs/{jobId}/claim - Claim a PENDING job
 * POST /internal/v1/jobs/{jobId}/start - Mark a claimed job RUNNING
 * POST /internal/v1/jobs/{jobId}/result - Final report (idempotent)
 */
public class JobQueueController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobQueueController.class);

    private static final String POLL_PATH = "/internal/v1/jobs/poll";
    private static final Pattern JOB_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)$");
    private static final Pattern ACTION_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/(claim|start|result)$");

    private final JobService jobService;

    public JobQueueController(JobService jobService) {
        this.jobService = jobService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.GET)) {
            return POLL_PATH.equals(path) || JOB_PATTERN.matcher(path).matches();
        }
        return method.equals(HttpMethod.POST) && ACTION_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.GET)) {
                if (POLL_PATH.equals(path)) {
                    return handlePoll(req);
                }
                Matcher jobMatcher = JOB_PATTERN.matcher(path);
                if (jobMatcher.matches()) {
                    return handleGet(jobMatcher.group(1));
                }
            }

            Matcher actionMatcher = ACTION_PATTERN.matcher(path);
            if (actionMatcher.matches()) {
                String jobId = actionMatcher.group(1);
                return switch (actionMatcher.group(2)) {
                    case "claim" -> handleClaim(req, jobId);
                    case "start" -> handleStart(req, jobId);
                    default -> handleResult(req, jobId);
                };
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Job queue controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * GET /internal/v1/jobs/poll?agentId=
     */
    private ControllerResponse handlePoll(FullHttpRequest req) throws Exception {
        Map<String, List<String>> params = new QueryStringDecoder(req.uri()).parameters();
        List<String> agentIds = params.get("agentId");
        String agentId = agentIds == null || agentIds.isEmpty() ? null : agentIds.get(0);

        Optional<Job> job = jobService.poll(agentId);
        if (job.isEmpty()) {
            return ControllerResponse.noContent();
        }

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("job", AgentJobResponse.from(job.get()))));
    }

    /**
     * GET /internal/v1/jobs/{jobId}
     */
    private ControllerResponse handleGet(String jobId) throws Exception {
        Optional<Job> job = jobService.findById(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(AgentJobResponse.from(job.get())));
    }

    /**
     * POST /internal/v1/jobs/{jobId}/claim
     */
    private ControllerResponse handleClaim(FullHttpRequest req, String jobId) throws Exception {
        AgentActionRequest request = readAction(req);

        JobClaimResult result = jobService.claim(jobId, request.agentId());

        return switch (result) {
            case CLAIMED -> ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(Map.of("success", true, "jobId", jobId)));
            case ALREADY_CLAIMED -> ControllerResponse.conflict("job already claimed");
            case NOT_FOUND -> ControllerResponse.notFound("job not found");
        };
    }

    /**
     * POST /internal/v1/jobs/{jobId}/start
     */
    private ControllerResponse handleStart(FullHttpRequest req, String jobId) throws Exception {
        AgentActionRequest request = readAction(req);

        JobStartResult result = jobService.start(jobId, request.agentId());

        return switch (result) {
            case STARTED -> ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(Map.of("success", true, "jobId", jobId)));
            case NOT_OWNER -> ControllerResponse.conflict("job not assigned to this agent");
            case INVALID_STATE -> ControllerResponse.conflict("job is not in ASSIGNED state");
            case NOT_FOUND -> ControllerResponse.notFound("job not found");
        };
    }

    /**
     * POST /internal/v1/jobs/{jobId}/result
     */
    private ControllerResponse handleResult(FullHttpRequest req, String jobId) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        JobResultRequest request = RouterHandler.mapper().readValue(body, JobResultRequest.class);

        request.validate();

        JobReportResult result = jobService.report(jobId, request.agentId(), request.toOutcome());

        return switch (result) {
            case COMPLETED, FAILED, RETRIED, ALREADY_TERMINAL -> ControllerResponse.json(
                    RouterHandler.mapper().writeValueAsString(Map.of(
                            "success", true,
                            "outcome", result.name().toLowerCase(),
                            "willRetry", result == JobReportResult.RETRIED)));
            case NOT_OWNER -> ControllerResponse.conflict("job not assigned to this agent");
            case INVALID_STATE -> ControllerResponse.conflict("job is not in RUNNING state");
            case NOT_FOUND -> ControllerResponse.notFound("job not found");
        };
    }

    private AgentActionRequest readAction(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        AgentActionRequest request = RouterHandler.mapper().readValue(body, AgentActionRequest.class);
        request.validate();
        return request;
    }
}
