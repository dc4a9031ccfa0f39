package testrelay.coordinator.model;

/**
 * A runnable test as stored in the catalog. The payload is copied verbatim
 * into every job created for the test.
 */
public record TestDefinition(
        String id,
        String projectId,
        String name,
        String jobType,
        String payload) {
}
