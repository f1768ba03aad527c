package io.github.galkahana.testharness;

import java.util.List;

/**
 * What a call to {@link TestRunner#run} hands back.
 *
 * @param summary Final counts
 * @param failures Failed tests in the order their outcomes were reported
 * @param listedOnly Whether tests were only listed, in which case all counts are zero
 */
public record RunResult<D>(RunSummary summary, List<Failure<D>> failures, boolean listedOnly) {

    public RunResult {
        failures = List.copyOf(failures);
    }

    static <D> RunResult<D> listed() {
        return new RunResult<>(RunSummary.empty(), List.of(), true);
    }

    public boolean hasFailed() {
        return summary.hasFailed();
    }

    /**
     * @see RunSummary#exitCode()
     */
    public int exitCode() {
        return summary.exitCode();
    }
}
