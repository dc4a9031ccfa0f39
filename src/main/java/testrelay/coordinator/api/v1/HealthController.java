package testrelay.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.api.Controller;
import testrelay.coordinator.api.v1.dto.HealthResponse;
import testrelay.coordinator.model.JobStatus;
import testrelay.coordinator.model.WorkerStatus;
import testrelay.coordinator.server.RouterHandler;
import testrelay.coordinator.service.JobService;
import testrelay.coordinator.service.WorkerService;
import testrelay.coordinator.store.Database;

import java.lang.management.ManagementFactory;
import java.time.Duration;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final JobService jobService;
    private final WorkerService workerService;

    public HealthController(Database database, JobService jobService, WorkerService workerService) {
        this.database = database;
        this.jobService = jobService;
        this.workerService = workerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (!database.isHealthy()) {
                return unavailable("connection failed");
            }

            // Busy workers are alive too
            int onlineWorkers = workerService.countByStatus(WorkerStatus.ONLINE)
                    + workerService.countByStatus(WorkerStatus.BUSY);

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    onlineWorkers,
                    jobService.countByStatus(JobStatus.PENDING),
                    jobService.countByStatus(JobStatus.RUNNING));

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            try {
                return unavailable(e.getMessage());
            } catch (Exception ex) {
                return ControllerResponse.error("health check failed");
            }
        }
    }

    private ControllerResponse unavailable(String reason) throws Exception {
        return ControllerResponse.json(
                HttpResponseStatus.SERVICE_UNAVAILABLE,
                RouterHandler.mapper().writeValueAsString(HealthResponse.unhealthy(reason)));
    }

    private String formatUptime() {
        Duration duration = Duration.ofMillis(ManagementFactory.getRuntimeMXBean().getUptime());
        return duration.toHours() + "h " + duration.toMinutesPart() + "m";
    }
}
