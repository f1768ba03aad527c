package io.github.galkahana.testharness;

/**
 * Result of evaluating a single test. The set of variants is closed.
 */
public sealed interface Outcome permits Outcome.Passed, Outcome.Failed, Outcome.Ignored, Outcome.Measured {

    /**
     * The test passed.
     */
    record Passed() implements Outcome {}

    /**
     * The test or benchmark failed.
     *
     * @param message Optional message shown in the failure listing after all tests ran, may be null
     */
    record Failed(String message) implements Outcome {}

    /**
     * The test or benchmark was not executed.
     */
    record Ignored() implements Outcome {}

    /**
     * The benchmark ran successfully. Both values must lie in {@code 0..Long.MAX_VALUE}, roughly 292 years.
     *
     * @param averageNanos Average time per iteration in nanoseconds
     * @param varianceNanos Variance in nanoseconds
     */
    record Measured(long averageNanos, long varianceNanos) implements Outcome {
        public Measured {
            if (averageNanos < 0 || varianceNanos < 0) {
                throw new IllegalArgumentException("Measurements must not be negative");
            }
        }
    }

    static Outcome passed() {
        return new Passed();
    }

    static Outcome failed() {
        return new Failed(null);
    }

    static Outcome failed(String message) {
        return new Failed(message);
    }

    static Outcome ignored() {
        return new Ignored();
    }

    static Outcome measured(long averageNanos, long varianceNanos) {
        return new Measured(averageNanos, varianceNanos);
    }
}
