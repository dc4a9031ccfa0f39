package testrelay.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.api.Controller;
import testrelay.coordinator.api.v1.dto.JobResponse;
import testrelay.coordinator.api.v1.dto.JobResultResponse;
import testrelay.coordinator.api.v1.dto.SubmitJobRequest;
import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobResult;
import testrelay.coordinator.server.RouterHandler;
import testrelay.coordinator.service.JobService;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job management (public API).
 *
 * POST /api/v1/jobs - Submit a job
 * GET /api/v1/jobs/{jobId} - Get job status
 * POST /api/v1/jobs/{jobId}/cancel - Cancel a job
 * GET /api/v1/jobs/{jobId}/result - Get the stored result
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern CANCEL_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/cancel$");
    private static final Pattern RESULT_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/result$");

    private final JobService jobService;
    private final int defaultMaxRetries;

    public JobController(JobService jobService, int defaultMaxRetries) {
        this.jobService = jobService;
        this.defaultMaxRetries = defaultMaxRetries;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (method.equals(HttpMethod.POST)) {
            return JOBS_PATTERN.matcher(path).matches() || CANCEL_PATTERN.matcher(path).matches();
        }
        if (method.equals(HttpMethod.GET)) {
            return JOB_BY_ID_PATTERN.matcher(path).matches() || RESULT_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (req.method().equals(HttpMethod.POST)) {
                if (JOBS_PATTERN.matcher(path).matches()) {
                    return handleSubmit(req);
                }
                Matcher cancelMatcher = CANCEL_PATTERN.matcher(path);
                if (cancelMatcher.matches()) {
                    return handleCancel(cancelMatcher.group(1));
                }
            }

            Matcher resultMatcher = RESULT_PATTERN.matcher(path);
            if (resultMatcher.matches()) {
                return handleGetResult(resultMatcher.group(1));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                return handleGetJob(jobMatcher.group(1));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/jobs
     */
    private ControllerResponse handleSubmit(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        SubmitJobRequest request = RouterHandler.mapper().readValue(body, SubmitJobRequest.class);

        request.validate();

        Job job = jobService.submit(request.toJob(defaultMaxRetries));

        Map<String, Object> response = Map.of(
                "success", true,
                "jobId", job.id(),
                "runId", job.runId());

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs/{jobId}
     */
    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<Job> job = jobService.findById(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResponse.from(job.get())));
    }

    /**
     * POST /api/v1/jobs/{jobId}/cancel
     */
    private ControllerResponse handleCancel(String jobId) throws Exception {
        Optional<Job> job = jobService.findById(jobId);
        if (job.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }
        if (!jobService.cancel(jobId)) {
            return ControllerResponse.conflict("job already finished");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("success", true, "jobId", jobId)));
    }

    /**
     * GET /api/v1/jobs/{jobId}/result
     */
    private ControllerResponse handleGetResult(String jobId) throws Exception {
        Optional<JobResult> result = jobService.findResult(jobId);
        if (result.isEmpty()) {
            return ControllerResponse.notFound("result not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(JobResultResponse.from(result.get())));
    }
}
