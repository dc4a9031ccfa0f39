package testrelay.coordinator.model;

/**
 * A test inside a suite, with its configured position.
 */
public record SuiteMember(int executionOrder, TestDefinition test) {
}
