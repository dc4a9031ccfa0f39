package testrelay.agent;

import testrelay.agent.client.AssignedJob;

/**
 * Runs one claimed job to completion on this host.
 */
public interface JobExecutor {

    /**
     * Upper bound on simultaneous executions this executor supports.
     */
    int maxConcurrency();

    /**
     * Execute the job. Job-level failures are returned, not thrown.
     */
    ExecutionResult execute(AssignedJob job);
}
