package testrelay.coordinator.api.internal.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.api.Controller;
import testrelay.coordinator.server.RouterHandler;
import testrelay.coordinator.service.SettingsService;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only settings access for agents (internal API).
 * GET /internal/v1/settings/{key}
 */
public class AgentSettingsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(AgentSettingsController.class);

    private static final Pattern SETTING_PATTERN = Pattern.compile("^/internal/v1/settings/([^/]+)$");

    private final SettingsService settingsService;

    public AgentSettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && SETTING_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher matcher = SETTING_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown settings endpoint");
            }

            String key = matcher.group(1);
            Optional<String> value = settingsService.get(key);
            if (value.isEmpty()) {
                return ControllerResponse.notFound("setting not found");
            }

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("key", key, "value", value.get())));
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Settings controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
