package io.github.galkahana.testharness;

/**
 * Counts collected over one test run.
 * <p>
 * Every test of the catalog lands in exactly one of filtered out, passed, failed, ignored or measured,
 * so after a real run {@link #total()} equals the catalog size. Folding outcomes with {@link #record}
 * is order independent, which is what lets concurrent runs deliver outcomes in completion order.
 *
 * @param numFilteredOut Tests removed by the name filter or skip patterns
 * @param numPassed Tests that passed
 * @param numFailed Tests and benchmarks that failed
 * @param numIgnored Tests and benchmarks that were not executed
 * @param numMeasured Benchmarks that ran successfully
 * @param numBenches Benchmarks seen during the run, whatever their outcome
 */
public record RunSummary(long numFilteredOut, long numPassed, long numFailed, long numIgnored,
                         long numMeasured, long numBenches) {

    public static final int SUCCESS_EXIT_CODE = 0;
    public static final int FAILURE_EXIT_CODE = 101;

    public static RunSummary empty() {
        return new RunSummary(0, 0, 0, 0, 0, 0);
    }

    public static RunSummary filteredOut(long numFilteredOut) {
        return new RunSummary(numFilteredOut, 0, 0, 0, 0, 0);
    }

    /**
     * Fold one outcome into the counts.
     *
     * @param outcome Outcome of a single test
     * @param bench Whether the test was a benchmark
     * @return New summary with exactly one outcome counter incremented
     */
    public RunSummary record(Outcome outcome, boolean bench) {
        long benches = numBenches + (bench ? 1 : 0);
        if (outcome instanceof Outcome.Passed) {
            return new RunSummary(numFilteredOut, numPassed + 1, numFailed, numIgnored, numMeasured, benches);
        } else if (outcome instanceof Outcome.Failed) {
            return new RunSummary(numFilteredOut, numPassed, numFailed + 1, numIgnored, numMeasured, benches);
        } else if (outcome instanceof Outcome.Ignored) {
            return new RunSummary(numFilteredOut, numPassed, numFailed, numIgnored + 1, numMeasured, benches);
        } else if (outcome instanceof Outcome.Measured) {
            return new RunSummary(numFilteredOut, numPassed, numFailed, numIgnored, numMeasured + 1, benches);
        }
        throw new IllegalArgumentException("Unknown outcome " + outcome);
    }

    /**
     * Number of catalog entries accounted for.
     */
    public long total() {
        return numFilteredOut + numPassed + numFailed + numIgnored + numMeasured;
    }

    public boolean hasFailed() {
        return numFailed > 0;
    }

    /**
     * Process exit code matching the standard harness convention: 0 when nothing failed, 101 otherwise.
     * The harness never exits the process itself.
     */
    public int exitCode() {
        return hasFailed() ? FAILURE_EXIT_CODE : SUCCESS_EXIT_CODE;
    }
}
