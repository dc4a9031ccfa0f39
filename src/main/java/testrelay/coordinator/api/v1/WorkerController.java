package testrelay.coordinator.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.api.Controller;
import testrelay.coordinator.api.v1.dto.WorkerResponse;
import testrelay.coordinator.server.RouterHandler;
import testrelay.coordinator.service.WorkerService;

import java.util.List;
import java.util.Map;

/**
 * Controller for worker listing (public API).
 * GET /api/v1/workers
 */
public class WorkerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private final WorkerService workerService;

    public WorkerController(WorkerService workerService) {
        this.workerService = workerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/workers".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            List<WorkerResponse> workers = workerService.findAll().stream()
                    .map(WorkerResponse::from)
                    .toList();

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("workers", workers, "total", workers.size())));
        } catch (Exception e) {
            log.error("Worker controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
