package testrelay.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.api.Controller;
import testrelay.coordinator.api.v1.dto.ExecutionResponse;
import testrelay.coordinator.api.v1.dto.TriggerRequest;
import testrelay.coordinator.api.v1.dto.TriggerResponse;
import testrelay.coordinator.dispatch.Dispatcher;
import testrelay.coordinator.model.ExecutionSource;
import testrelay.coordinator.model.Trigger;
import testrelay.coordinator.model.TriggerExecution;
import testrelay.coordinator.server.RouterHandler;
import testrelay.coordinator.service.TriggerService;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for trigger management (public API).
 *
 * POST /api/v1/triggers - Create a trigger
 * GET /api/v1/triggers?projectId= - List a project's triggers
 * GET /api/v1/triggers/{triggerId} - Get one trigger
 * PUT /api/v1/triggers/{triggerId} - Replace a trigger
 * DELETE /api/v1/triggers/{triggerId} - Delete a trigger
 * POST /api/v1/triggers/{triggerId}/run - Fire now
 * POST /api/v1/triggers/{triggerId}/events - Fire from an external event
 * GET /api/v1/triggers/{triggerId}/executions?limit= - Firing history
 */
public class TriggerController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(TriggerController.class);

    private static final int DEFAULT_EXECUTION_LIMIT = 50;

    private static final Pattern TRIGGERS_PATTERN = Pattern.compile("^/api/v1/triggers$");
    private static final Pattern TRIGGER_BY_ID_PATTERN = Pattern.compile("^/api/v1/triggers/([^/]+)$");
    private static final Pattern FIRE_PATTERN = Pattern.compile("^/api/v1/triggers/([^/]+)/(run|events)$");
    private static final Pattern EXECUTIONS_PATTERN = Pattern.compile("^/api/v1/triggers/([^/]+)/executions$");

    private final TriggerService triggerService;
    private final Dispatcher dispatcher;

    public TriggerController(TriggerService triggerService, Dispatcher dispatcher) {
        this.triggerService = triggerService;
        this.dispatcher = dispatcher;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (TRIGGERS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (TRIGGER_BY_ID_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.GET) || method.equals(HttpMethod.PUT)
                    || method.equals(HttpMethod.DELETE);
        }
        if (FIRE_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST);
        }
        return method.equals(HttpMethod.GET) && EXECUTIONS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            HttpMethod method = req.method();

            if (TRIGGERS_PATTERN.matcher(path).matches()) {
                return method.equals(HttpMethod.POST) ? handleCreate(req) : handleList(req);
            }

            Matcher fireMatcher = FIRE_PATTERN.matcher(path);
            if (fireMatcher.matches()) {
                ExecutionSource source = "run".equals(fireMatcher.group(2))
                        ? ExecutionSource.MANUAL
                        : ExecutionSource.EXTERNAL_EVENT;
                return handleFire(fireMatcher.group(1), source);
            }

            Matcher executionsMatcher = EXECUTIONS_PATTERN.matcher(path);
            if (executionsMatcher.matches()) {
                return handleExecutions(req, executionsMatcher.group(1));
            }

            Matcher idMatcher = TRIGGER_BY_ID_PATTERN.matcher(path);
            if (idMatcher.matches()) {
                String triggerId = idMatcher.group(1);
                if (method.equals(HttpMethod.PUT)) {
                    return handleUpdate(req, triggerId);
                }
                if (method.equals(HttpMethod.DELETE)) {
                    return handleDelete(triggerId);
                }
                return handleGet(triggerId);
            }

            return ControllerResponse.notFound("unknown trigger endpoint");

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Trigger controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/triggers
     */
    private ControllerResponse handleCreate(FullHttpRequest req) throws Exception {
        TriggerRequest request = readRequest(req);

        Trigger created = triggerService.create(request.toTrigger(UUID.randomUUID().toString()));

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(TriggerResponse.from(created)));
    }

    /**
     * GET /api/v1/triggers?projectId=
     */
    private ControllerResponse handleList(FullHttpRequest req) throws Exception {
        String projectId = queryParam(req, "projectId");

        List<TriggerResponse> triggers = triggerService.findByProject(projectId).stream()
                .map(TriggerResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("triggers", triggers, "total", triggers.size())));
    }

    /**
     * GET /api/v1/triggers/{triggerId}
     */
    private ControllerResponse handleGet(String triggerId) throws Exception {
        Optional<Trigger> trigger = triggerService.findById(triggerId);
        if (trigger.isEmpty()) {
            return ControllerResponse.notFound("trigger not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TriggerResponse.from(trigger.get())));
    }

    /**
     * PUT /api/v1/triggers/{triggerId}
     */
    private ControllerResponse handleUpdate(FullHttpRequest req, String triggerId) throws Exception {
        TriggerRequest request = readRequest(req);

        Optional<Trigger> updated = triggerService.update(request.toTrigger(triggerId));
        if (updated.isEmpty()) {
            return ControllerResponse.notFound("trigger not found");
        }
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(TriggerResponse.from(updated.get())));
    }

    /**
     * DELETE /api/v1/triggers/{triggerId}
     */
    private ControllerResponse handleDelete(String triggerId) {
        if (!triggerService.delete(triggerId)) {
            return ControllerResponse.notFound("trigger not found");
        }
        return ControllerResponse.noContent();
    }

    /**
     * POST /api/v1/triggers/{triggerId}/run and /events
     */
    private ControllerResponse handleFire(String triggerId, ExecutionSource source) throws Exception {
        if (triggerService.findById(triggerId).isEmpty()) {
            return ControllerResponse.notFound("trigger not found");
        }

        TriggerExecution execution = dispatcher.fire(triggerId, source);

        return ControllerResponse.json(
                HttpResponseStatus.ACCEPTED,
                RouterHandler.mapper().writeValueAsString(ExecutionResponse.from(execution)));
    }

    /**
     * GET /api/v1/triggers/{triggerId}/executions?limit=
     */
    private ControllerResponse handleExecutions(FullHttpRequest req, String triggerId) throws Exception {
        if (triggerService.findById(triggerId).isEmpty()) {
            return ControllerResponse.notFound("trigger not found");
        }

        String rawLimit = queryParam(req, "limit");
        int limit;
        try {
            limit = rawLimit == null ? DEFAULT_EXECUTION_LIMIT : Integer.parseInt(rawLimit);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("limit must be a number");
        }

        List<ExecutionResponse> executions = triggerService.executions(triggerId, limit).stream()
                .map(ExecutionResponse::from)
                .toList();

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                Map.of("triggerId", triggerId, "executions", executions)));
    }

    private TriggerRequest readRequest(FullHttpRequest req) throws JsonProcessingException {
        String body = req.content().toString(StandardCharsets.UTF_8);
        TriggerRequest request = RouterHandler.mapper().readValue(body, TriggerRequest.class);
        request.validate();
        return request;
    }

    private static String queryParam(FullHttpRequest req, String name) {
        List<String> values = new QueryStringDecoder(req.uri()).parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }
}
