package testrelay.coordinator.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.coordinator.api.Controller;
import testrelay.coordinator.api.v1.dto.SettingRequest;
import testrelay.coordinator.server.RouterHandler;
import testrelay.coordinator.service.SettingsService;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for runtime settings (public API).
 * PUT /api/v1/settings/{key}
 */
public class SettingsController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(SettingsController.class);

    private static final Pattern SETTING_PATTERN = Pattern.compile("^/api/v1/settings/([^/]+)$");

    private final SettingsService settingsService;

    public SettingsController(SettingsService settingsService) {
        this.settingsService = settingsService;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.PUT) && SETTING_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            Matcher matcher = SETTING_PATTERN.matcher(path);
            if (!matcher.matches()) {
                return ControllerResponse.notFound("unknown settings endpoint");
            }
            String key = matcher.group(1);

            String body = req.content().toString(StandardCharsets.UTF_8);
            SettingRequest request = RouterHandler.mapper().readValue(body, SettingRequest.class);
            request.validate();

            settingsService.put(key, request.value());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(
                    Map.of("key", key, "value", request.value())));

        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (Exception e) {
            log.error("Settings controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
