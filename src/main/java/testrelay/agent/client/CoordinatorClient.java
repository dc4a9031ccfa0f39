package testrelay.agent.client;

import java.util.Optional;

/**
 * Agent side of the coordinator's internal API.
 */
public interface CoordinatorClient {

    void register(AgentRegistration registration) throws CoordinatorClientException;

    HeartbeatAck heartbeat(AgentHeartbeat heartbeat) throws CoordinatorClientException;

    /**
     * @return the setting value, or empty when the coordinator has none
     */
    Optional<String> fetchSetting(String key) throws CoordinatorClientException;

    /**
     * @return the next claimable job, or empty when the queue has nothing for this agent
     */
    Optional<AssignedJob> poll(String agentId) throws CoordinatorClientException;

    /**
     * @return false when another agent won the claim
     */
    boolean claim(String jobId, String agentId) throws CoordinatorClientException;

    /**
     * @return false when the job is no longer assigned to this agent
     */
    boolean start(String jobId, String agentId) throws CoordinatorClientException;

    Optional<AssignedJob> getJob(String jobId) throws CoordinatorClientException;

    ReportAck report(String jobId, ResultReport report) throws CoordinatorClientException;
}
