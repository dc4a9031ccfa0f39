package testrelay.coordinator.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.api.Controller;
import testrelay.coordinator.api.internal.v1.dto.HeartbeatRequest;
import testrelay.coordinator.api.internal.v1.dto.HeartbeatResponse;
import testrelay.coordinator.api.internal.v1.dto.RegisterAgentRequest;
import testrelay.coordinator.model.Worker;
import testrelay.coordinator.server.RouterHandler;
import testrelay.coordinator.service.WorkerService;
import testrelay.coordinator.service.WorkerService.HeartbeatReply;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Controller for agent registration and heartbeat (internal API).
 * POST /internal/v1/agents/register - Register or re-register an agent
 * POST /internal/v1/agents/heartbeat - Agent heartbeat
 */
public class AgentController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AgentController.class);

    private static final String REGISTER_PATH = "/internal/v1/agents/register";
    private static final String HEARTBEAT_PATH = "/internal/v1/agents/heartbeat";

    private final WorkerService workerService;

    public AgentController(WorkerService workerService) {
        this.workerService = workerService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (!method.equals(HttpMethod.POST)) {
            return false;
        }
        return REGISTER_PATH.equals(path) || HEARTBEAT_PATH.equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (REGISTER_PATH.equals(path)) {
                return handleRegister(req);
            }
            return handleHeartbeat(req);
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Agent controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /internal/v1/agents/register
     */
    private ControllerResponse handleRegister(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        RegisterAgentRequest request = RouterHandler.mapper().readValue(body, RegisterAgentRequest.class);

        request.validate();

        Worker worker = workerService.register(request.toWorker());

        Map<String, Object> response = Map.of(
                "success", true,
                "agentId", worker.id(),
                "status", worker.status().name());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * POST /internal/v1/agents/heartbeat
     */
    private ControllerResponse handleHeartbeat(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        HeartbeatRequest request = RouterHandler.mapper().readValue(body, HeartbeatRequest.class);

        request.validate();

        Optional<HeartbeatReply> reply = workerService.heartbeat(
                request.agentId(),
                request.runningJobs(),
                request.maxCapacity(),
                request.systemInfoJson());

        if (reply.isEmpty()) {
            return ControllerResponse.notFound("agent not registered");
        }

        return ControllerResponse.json(
                RouterHandler.mapper().writeValueAsString(HeartbeatResponse.from(reply.get())));
    }
}
