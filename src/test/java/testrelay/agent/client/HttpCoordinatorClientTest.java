package testrelay.agent.client;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import testrelay.agent.AgentConfig;
import testrelay.agent.AgentWorker;
import testrelay.agent.ExecutionResult;
import testrelay.agent.JobExecutor;
import testrelay.coordinator.config.CoordinatorConfig;
import testrelay.coordinator.config.Dependencies;
import testrelay.coordinator.model.Job;
import testrelay.coordinator.model.JobResult;
import testrelay.coordinator.model.JobStatus;
import testrelay.coordinator.model.Worker;
import testrelay.coordinator.server.CoordinatorServer;
import testrelay.coordinator.service.SettingsService;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the agent client against a real coordinator.
 */
class HttpCoordinatorClientTest {

        private static final String AGENT_KEY = "agent-secret";

        private Dependencies deps;
        private CoordinatorServer server;
        private String baseUrl;
        private HttpCoordinatorClient client;

        @BeforeEach
        void setUp() throws Exception {
                CoordinatorConfig config = CoordinatorConfig.defaults()
                                .withDatabaseUrl("jdbc:h2:mem:test-agent-client-" + System.nanoTime()
                                                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                                .withServerHost("127.0.0.1")
                                .withServerPort(0)
                                .withAgentKey(AGENT_KEY)
                                .withMaxRetries(1);

                deps = Dependencies.create(config);
                server = new CoordinatorServer(deps.routerHandler(), config.serverHost(), config.serverPort());
                baseUrl = "http://127.0.0.1:" + server.start();

                client = new HttpCoordinatorClient(agentConfig("agent-1"));
        }

        @AfterEach
        void tearDown() {
                if (server != null) {
                        server.stop();
                }
                if (deps != null) {
                        deps.close();
                }
        }

        @Test
        @DisplayName("Poll, claim, start and report through the internal API")
        void jobProtocol() throws Exception {
                register(client, "agent-1");
                Job job = submit();

                Optional<AssignedJob> polled = client.poll("agent-1");
                assertTrue(polled.isPresent());
                assertEquals(job.id(), polled.get().id());
                assertEquals(2, polled.get().payload().get("threads").asInt());

                assertTrue(client.claim(job.id(), "agent-1"));
                assertTrue(client.start(job.id(), "agent-1"));
                assertTrue(client.getJob(job.id()).orElseThrow().isRunningFor("agent-1"));

                ObjectNode summary = HttpCoordinatorClient.mapper().createObjectNode().put("totalRequests", 10);
                ReportAck ack = client.report(job.id(), ResultReport.completed("agent-1", summary, "bG9n", null));

                assertTrue(ack.success());
                assertFalse(ack.willRetry());
                assertEquals(JobStatus.COMPLETED, deps.jobService().findById(job.id()).orElseThrow().status());
                JobResult result = deps.jobService().findResult(job.id()).orElseThrow();
                assertTrue(result.summaryJson().contains("totalRequests"));
                assertEquals("bG9n", result.resultLogBase64());
        }

        @Test
        @DisplayName("Lost claims and foreign starts come back as false")
        void conflicts() throws Exception {
                HttpCoordinatorClient other = new HttpCoordinatorClient(agentConfig("agent-2"));
                register(client, "agent-1");
                register(other, "agent-2");
                Job job = submit();

                assertTrue(client.claim(job.id(), "agent-1"));
                assertFalse(other.claim(job.id(), "agent-2"));
                assertFalse(other.start(job.id(), "agent-2"));
                assertFalse(client.claim("missing-job", "agent-1"));
                assertTrue(client.getJob("missing-job").isEmpty());
                assertTrue(client.poll("agent-1").isEmpty());
        }

        @Test
        @DisplayName("Heartbeat returns queue depth and settings are optional")
        void heartbeatAndSettings() throws Exception {
                register(client, "agent-1");
                submit();

                HeartbeatAck ack = client.heartbeat(new AgentHeartbeat("agent-1", 1, 1, 0, Map.of()));
                assertTrue(ack.success());
                assertEquals(1, ack.pendingJobs());
                assertNotNull(ack.serverTime());

                assertTrue(client.fetchSetting(SettingsService.AGENT_POLL_INTERVAL).isEmpty());
                deps.settingsService().put(SettingsService.AGENT_POLL_INTERVAL, "3");
                assertEquals(Optional.of("3"), client.fetchSetting(SettingsService.AGENT_POLL_INTERVAL));
        }

        @Test
        @DisplayName("Wrong agent key is rejected with the status code")
        void wrongKey() {
                HttpCoordinatorClient intruder = new HttpCoordinatorClient(
                                AgentConfig.of(baseUrl, "agent-x").withAgentKey("wrong"));

                CoordinatorClientException e = assertThrows(CoordinatorClientException.class,
                                () -> register(intruder, "agent-x"));
                assertEquals(403, e.statusCode());
        }

        @Test
        @DisplayName("Unreachable coordinator surfaces as a client exception")
        void unreachable() throws Exception {
                server.stop();
                server = null;

                CoordinatorClientException e = assertThrows(CoordinatorClientException.class,
                                () -> client.poll("agent-1"));
                assertEquals(-1, e.statusCode());
        }

        @Test
        @DisplayName("A started agent picks up and completes a queued job")
        void agentRoundTrip() throws Exception {
                Job job = submit();
                JobExecutor executor = new JobExecutor() {
                        @Override
                        public int maxConcurrency() {
                                return 1;
                        }

                        @Override
                        public ExecutionResult execute(AssignedJob assigned) {
                                return ExecutionResult.success(
                                                HttpCoordinatorClient.mapper().createObjectNode().put("totalRequests", 1),
                                                null, null);
                        }
                };

                try (AgentWorker worker = new AgentWorker(agentConfig("agent-1"), client, executor)) {
                        worker.start();

                        long deadline = System.currentTimeMillis() + 10_000;
                        JobStatus status = JobStatus.PENDING;
                        while (status != JobStatus.COMPLETED && System.currentTimeMillis() < deadline) {
                                Thread.sleep(50);
                                status = deps.jobService().findById(job.id()).orElseThrow().status();
                        }
                        assertEquals(JobStatus.COMPLETED, status);
                }

                Worker worker = deps.workerRepository().findById("agent-1").orElseThrow();
                assertEquals(0, worker.runningJobs());
        }

        private AgentConfig agentConfig(String agentId) {
                return AgentConfig.of(baseUrl, agentId).withAgentKey(AGENT_KEY).withProjectId("proj-1");
        }

        private static void register(CoordinatorClient client, String agentId) throws CoordinatorClientException {
                client.register(new AgentRegistration(agentId, agentId, "proj-1", 1,
                                List.of("performance"), Map.of("os", "test")));
        }

        private Job submit() {
                return deps.jobService().submit(Job.builder()
                                .id(UUID.randomUUID().toString())
                                .projectId("proj-1")
                                .testId("t-1")
                                .runId("RUN-" + UUID.randomUUID())
                                .payload("{\"plan\":\"PGp0ZXN0UGxhbi8+\",\"threads\":2}")
                                .build());
        }
}
