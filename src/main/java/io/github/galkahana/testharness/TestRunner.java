package io.github.galkahana.testharness;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

/**
 * Runs a list of tests with a caller supplied evaluation function and reports like a standard test harness.
 * <p>
 * A run filters the tests, then either lists them or executes them, prints the report and returns the
 * summary. With zero or one worker every test runs on the calling thread in catalog order. With more
 * workers the tests run on a fixed pool and are reported in completion order; each test's announcement
 * and outcome are printed together, by the calling thread only.
 *
 * <pre>{@code
 * List<TestDescriptor<Path>> tests = files.stream()
 *     .map(file -> TestDescriptor.<Path>test(file.getFileName().toString()).withData(file))
 *     .toList();
 *
 * RunResult<Path> result = new TestRunner<Path>(config).run(tests, test -> check(test.data())
 *     ? Outcome.passed()
 *     : Outcome.failed("mismatch in " + test.data()));
 * System.exit(result.exitCode());
 * }</pre>
 *
 * @param <D> Type of the caller owned test data
 */
@Slf4j
public class TestRunner<D> {

    private final RunConfiguration config;
    private final OutputSink sink;

    /**
     * Create a runner that writes to the destination described by the configuration.
     */
    public TestRunner(RunConfiguration config) {
        this(config, null);
    }

    /**
     * Create a runner that writes to the given sink. The sink is flushed but not closed at the end of a run.
     */
    public TestRunner(RunConfiguration config, OutputSink sink) {
        this.config = Objects.requireNonNull(config, "config");
        this.sink = sink;
    }

    /**
     * Run the tests.
     *
     * @param tests All tests known to the caller, in the order they should run sequentially
     * @param function Evaluates one test
     * @return The summary and failures, or an empty summary if the tests were only listed
     * @throws ConfigurationException If the configuration asks for an unsupported format
     * @throws SinkException If the report cannot be written
     * @throws TestExecutionException If {@code function} throws (including {@link AssertionError}) or returns
     *                                null. In parallel runs the tests already handed to workers finish before
     *                                this is thrown
     * @throws InterruptedException If interrupted while waiting for workers
     */
    public RunResult<D> run(List<TestDescriptor<D>> tests, TestFunction<D> function) throws InterruptedException {
        Objects.requireNonNull(function, "function");
        Printer.checkFormat(config.getFormat());

        Selector selector = new Selector(config);
        List<TestDescriptor<D>> selected = new ArrayList<>(tests.size());
        for (TestDescriptor<D> test : tests) {
            if (!selector.isFilteredOut(test)) selected.add(test);
        }
        long numFilteredOut = tests.size() - selected.size();

        try (Printer printer = new Printer(config.getFormat(), selected, openSink())) {
            if (config.isList()) {
                printer.printList(selected);
                return RunResult.listed();
            }

            log.info("Running {} tests ({} filtered out) {}", selected.size(), numFilteredOut,
                    config.isSequential() ? "sequentially" : "on " + config.getNumWorkers() + " workers");

            printer.printTitle(selected.size());
            Collector collector = new Collector(printer, RunSummary.filteredOut(numFilteredOut));
            if (config.isSequential()) {
                runSequentially(selected, selector, function, collector);
            } else {
                runConcurrently(selected, selector, function, collector);
            }

            if (!collector.failures.isEmpty()) {
                printer.printFailures(collector.failures);
            }
            printer.printSummary(collector.summary);

            log.info("Run finished: {}", collector.summary);
            return new RunResult<>(collector.summary, collector.failures, false);
        }
    }

    private void runSequentially(List<TestDescriptor<D>> tests, Selector selector, TestFunction<D> function,
                                 Collector collector) {
        for (TestDescriptor<D> test : tests) {
            // Announce first so the line shows while the test runs.
            collector.printer.printTest(test);
            collector.printer.flush();
            Outcome outcome = selector.isIgnored(test) ? Outcome.ignored() : evaluate(function, test);
            collector.handleOutcome(test, outcome);
        }
    }

    private void runConcurrently(List<TestDescriptor<D>> tests, Selector selector, TestFunction<D> function,
                                 Collector collector) throws InterruptedException {
        WorkDistributor<TestDescriptor<D>, Outcome> distributor = new WorkDistributor<>(config.getNumWorkers());
        distributor.start();
        try {
            for (TestDescriptor<D> test : tests) {
                if (selector.isIgnored(test)) {
                    distributor.complete(test, Outcome.ignored());
                } else {
                    distributor.submitTask(test, () -> evaluate(function, test));
                }
            }

            // The announcement is only printed once the outcome is known, otherwise lines of
            // different workers would interleave.
            distributor.drain((test, outcome) -> {
                collector.printer.printTest(test);
                collector.handleOutcome(test, outcome);
            });
        } finally {
            // Tests already dispatched run to completion, also when the run is aborted.
            distributor.shutdown();
            log.debug("Drained {} of {} results", distributor.getTasksDrained(), distributor.getTasksSubmitted());
        }
    }

    private Outcome evaluate(TestFunction<D> function, TestDescriptor<D> test) {
        Outcome outcome;
        try {
            outcome = function.run(test);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TestExecutionException(test.name(), "was interrupted", e);
        } catch (Exception | AssertionError e) {
            throw new TestExecutionException(test.name(), "threw " + e, e);
        }
        if (outcome == null) {
            throw new TestExecutionException(test.name(), "returned no outcome", null);
        }
        return outcome;
    }

    private OutputSink openSink() {
        if (sink == null) return OutputSinks.open(config);
        return new BorrowedSink(sink);
    }

    /**
     * Caller owned sink that the run flushes but leaves open.
     */
    private static final class BorrowedSink implements OutputSink {
        private final OutputSink delegate;

        BorrowedSink(OutputSink delegate) {
            this.delegate = delegate;
        }

        @Override
        public void write(String text) throws IOException {
            delegate.write(text);
        }

        @Override
        public void setColor(TextColor color) throws IOException {
            delegate.setColor(color);
        }

        @Override
        public void reset() throws IOException {
            delegate.reset();
        }

        @Override
        public boolean supportsColor() {
            return delegate.supportsColor();
        }

        @Override
        public void flush() throws IOException {
            delegate.flush();
        }

        @Override
        public void close() throws IOException {
            delegate.flush();
        }
    }

    /**
     * Printing, counting and failure bookkeeping of a run. Only touched by the coordinating thread.
     */
    private class Collector {
        private final Printer printer;
        private final List<Failure<D>> failures = new ArrayList<>();
        private RunSummary summary;

        Collector(Printer printer, RunSummary initial) {
            this.printer = printer;
            this.summary = initial;
        }

        void handleOutcome(TestDescriptor<D> test, Outcome outcome) {
            printer.printOutcome(outcome);
            printer.flush();
            summary = summary.record(outcome, test.bench());
            if (outcome instanceof Outcome.Failed failed) {
                failures.add(new Failure<>(test, failed.message()));
            }
        }
    }
}
