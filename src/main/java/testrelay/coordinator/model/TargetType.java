package testrelay.coordinator.model;

/**
 * What a trigger runs when it fires.
 */
public enum TargetType {
    /** One test, one job */
    SINGLE_TEST,
    /** Every member test of a suite, one job each, in suite order */
    SUITE
}
