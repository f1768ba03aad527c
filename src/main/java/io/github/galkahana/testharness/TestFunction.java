package io.github.galkahana.testharness;

/**
 * Evaluates one test. Called at most once per test, possibly from a worker thread.
 * <p>
 * A failing test should be reported by returning {@link Outcome#failed(String)}. Throwing is treated as a
 * crash of the harness and aborts the run.
 *
 * @param <D> Type of the caller owned test data
 */
@FunctionalInterface
public interface TestFunction<D> {
    Outcome run(TestDescriptor<D> test) throws Exception;
}
