package io.github.galkahana.testharness;

import java.util.List;

/**
 * Entry points for test programs that take their options from the command line.
 *
 * <pre>{@code
 * public static void main(String[] args) throws Exception {
 *     List<TestDescriptor<Void>> tests = List.of(
 *         TestDescriptor.test("toph"),
 *         TestDescriptor.test("sokka"),
 *         TestDescriptor.<Void>test("long_computation").withIgnored(true));
 *
 *     RunResult<Void> result = Harness.run(args, tests, test -> Outcome.passed());
 *     System.exit(result.exitCode());
 * }
 * }</pre>
 */
public final class Harness {

    private Harness() {
    }

    /**
     * Parse {@code args} and run the tests with the resulting configuration.
     *
     * @param args Command line arguments, without the program name
     * @see Arguments
     * @see TestRunner#run
     */
    public static <D> RunResult<D> run(String[] args, List<TestDescriptor<D>> tests, TestFunction<D> function)
            throws InterruptedException {
        return run(Arguments.parse(args).toConfiguration(), tests, function);
    }

    /**
     * Run the tests with a prepared configuration, reporting to the destination it names.
     */
    public static <D> RunResult<D> run(RunConfiguration config, List<TestDescriptor<D>> tests,
                                       TestFunction<D> function) throws InterruptedException {
        return new TestRunner<D>(config).run(tests, function);
    }
}
