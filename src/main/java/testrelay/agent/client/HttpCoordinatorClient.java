package testrelay.agent.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import testrelay.agent.AgentConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * CoordinatorClient over java.net.http with Jackson bodies.
 */
public class HttpCoordinatorClient implements CoordinatorClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCoordinatorClient.class);

    public static final String AGENT_KEY_HEADER = "X-Agent-Key";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .findAndRegisterModules();

    private final HttpClient http;
    private final String baseUrl;
    private final String agentKey;
    private final Duration requestTimeout;

    public HttpCoordinatorClient(AgentConfig config) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(),
                config.apiUrl(), config.agentKey(), config.requestTimeout());
    }

    HttpCoordinatorClient(HttpClient http, String baseUrl, String agentKey, Duration requestTimeout) {
        this.http = http;
        this.baseUrl = baseUrl;
        this.agentKey = agentKey;
        this.requestTimeout = requestTimeout;
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    @Override
    public void register(AgentRegistration registration) throws CoordinatorClientException {
        HttpResponse<String> response = send(post("/internal/v1/agents/register", registration));
        requireSuccess(response, "register agent");
    }

    @Override
    public HeartbeatAck heartbeat(AgentHeartbeat heartbeat) throws CoordinatorClientException {
        HttpResponse<String> response = send(post("/internal/v1/agents/heartbeat", heartbeat));
        requireSuccess(response, "send heartbeat");
        return read(response, HeartbeatAck.class);
    }

    @Override
    public Optional<String> fetchSetting(String key) throws CoordinatorClientException {
        HttpResponse<String> response = send(get("/internal/v1/settings/" + encode(key)));
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, "fetch setting " + key);

        JsonNode value = read(response, JsonNode.class).get("value");
        return value == null || value.isNull() ? Optional.empty() : Optional.of(value.asText());
    }

    @Override
    public Optional<AssignedJob> poll(String agentId) throws CoordinatorClientException {
        HttpResponse<String> response = send(get("/internal/v1/jobs/poll?agentId=" + encode(agentId)));
        if (response.statusCode() == 204) {
            return Optional.empty();
        }
        requireSuccess(response, "poll for jobs");

        JsonNode job = read(response, JsonNode.class).get("job");
        if (job == null || job.isNull()) {
            return Optional.empty();
        }
        try {
            return Optional.of(MAPPER.treeToValue(job, AssignedJob.class));
        } catch (JsonProcessingException e) {
            throw new CoordinatorClientException("Malformed job in poll response", e);
        }
    }

    @Override
    public boolean claim(String jobId, String agentId) throws CoordinatorClientException {
        HttpResponse<String> response = send(post("/internal/v1/jobs/" + encode(jobId) + "/claim",
                Map.of("agentId", agentId)));
        if (response.statusCode() == 409 || response.statusCode() == 404) {
            return false;
        }
        requireSuccess(response, "claim job " + jobId);
        return true;
    }

    @Override
    public boolean start(String jobId, String agentId) throws CoordinatorClientException {
        HttpResponse<String> response = send(post("/internal/v1/jobs/" + encode(jobId) + "/start",
                Map.of("agentId", agentId)));
        if (response.statusCode() == 409 || response.statusCode() == 404) {
            return false;
        }
        requireSuccess(response, "start job " + jobId);
        return true;
    }

    @Override
    public Optional<AssignedJob> getJob(String jobId) throws CoordinatorClientException {
        HttpResponse<String> response = send(get("/internal/v1/jobs/" + encode(jobId)));
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, "fetch job " + jobId);
        return Optional.of(read(response, AssignedJob.class));
    }

    @Override
    public ReportAck report(String jobId, ResultReport report) throws CoordinatorClientException {
        HttpResponse<String> response = send(post("/internal/v1/jobs/" + encode(jobId) + "/result", report));
        requireSuccess(response, "report result for job " + jobId);
        return read(response, ReportAck.class);
    }

    // Helper methods

    private HttpRequest get(String path) {
        return builder(path).GET().build();
    }

    private HttpRequest post(String path, Object body) throws CoordinatorClientException {
        try {
            return builder(path)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new CoordinatorClientException("Failed to serialize request for " + path, e);
        }
    }

    private HttpRequest.Builder builder(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(requestTimeout);
        if (agentKey != null && !agentKey.isBlank()) {
            builder.header(AGENT_KEY_HEADER, agentKey);
        }
        return builder;
    }

    private HttpResponse<String> send(HttpRequest request) throws CoordinatorClientException {
        try {
            HttpResponse<String> response = http.send(request, HttpResponse.BodyHandlers.ofString());
            log.debug("{} {} -> {}", request.method(), request.uri().getPath(), response.statusCode());
            return response;
        } catch (IOException e) {
            throw new CoordinatorClientException("Request failed: " + request.method() + " " + request.uri(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoordinatorClientException("Interrupted: " + request.method() + " " + request.uri(), e);
        }
    }

    private static void requireSuccess(HttpResponse<String> response, String action)
            throws CoordinatorClientException {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new CoordinatorClientException(
                    "Failed to " + action + ": HTTP " + status + " " + response.body(), status);
        }
    }

    private static <T> T read(HttpResponse<String> response, Class<T> type) throws CoordinatorClientException {
        try {
            return MAPPER.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            throw new CoordinatorClientException("Malformed response: " + response.body(), e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
