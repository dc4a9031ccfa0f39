package testrelay.coordinator.repository;

import testrelay.coordinator.model.SuiteMember;
import testrelay.coordinator.model.TestDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Read access to stored tests and suites, used to resolve trigger targets.
 */
public interface TestCatalog {

    Optional<TestDefinition> findTest(String testId);

    /**
     * Member tests of a suite in configured execution order. Members whose
     * test no longer exists are omitted.
     */
    List<SuiteMember> findSuiteMembers(String suiteId);

    void saveTest(TestDefinition test);

    void addSuiteMember(String suiteId, String testId, int executionOrder);
}
