package io.github.galkahana.testharness;

import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ConcurrentRunTest {

    private static final int NUM_WORKERS = 4;
    private static final Pattern PRETTY_LINE = Pattern.compile("test (case_\\d+) +\\.\\.\\. (ok|FAILED|ignored)");

    private static List<TestDescriptor<Integer>> catalog(int size) {
        List<TestDescriptor<Integer>> tests = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            tests.add(TestDescriptor.<Integer>test("case_" + i).withData(i).withIgnored(i % 10 == 0));
        }
        return tests;
    }

    @Test
    public void testConcurrentRun_EvaluatesEachRunnableTestOnce() throws Exception {
        // Arrange
        List<TestDescriptor<Integer>> tests = catalog(50);
        ConcurrentHashMap<String, AtomicInteger> calls = new ConcurrentHashMap<>();
        RunConfiguration config = RunConfiguration.builder().numWorkers(NUM_WORKERS).build();

        // Act
        RunResult<Integer> result = new TestRunner<Integer>(config, new PlainSink(new StringWriter())).run(tests, test -> {
            calls.computeIfAbsent(test.name(), k -> new AtomicInteger()).incrementAndGet();
            return test.data() % 7 == 0 ? Outcome.failed("multiple of 7") : Outcome.passed();
        });

        // Assert
        assertEquals(45, calls.size(), "ignored tests must never be evaluated");
        calls.forEach((name, count) -> assertEquals(1, count.get(), name + " should run exactly once"));
        // failing: 7, 14, 21, 28, 35, 42, 49 (0 is ignored)
        assertEquals(new RunSummary(0, 38, 7, 5, 0, 0), result.summary());
        assertEquals(7, result.failures().size());
        assertEquals(101, result.exitCode());
    }

    @Test
    public void testConcurrentRun_RunsOnWorkerThreads() throws Exception {
        // Arrange
        Set<String> threadNames = ConcurrentHashMap.newKeySet();
        String caller = Thread.currentThread().getName();
        RunConfiguration config = RunConfiguration.builder().numWorkers(NUM_WORKERS).build();

        // Act
        new TestRunner<Integer>(config, new PlainSink(new StringWriter())).run(catalog(20), test -> {
            threadNames.add(Thread.currentThread().getName());
            return Outcome.passed();
        });

        // Assert
        assertFalse(threadNames.contains(caller));
        assertTrue(threadNames.stream().allMatch(name -> name.startsWith("test-worker-")), threadNames.toString());
    }

    @Test
    public void testConcurrentRun_PrintsEveryTestAsOneCompleteLine() throws Exception {
        // Arrange
        StringWriter out = new StringWriter();
        List<TestDescriptor<Integer>> tests = catalog(60);
        RunConfiguration config = RunConfiguration.builder().numWorkers(NUM_WORKERS).build();

        // Act
        new TestRunner<Integer>(config, new PlainSink(out)).run(tests, test -> {
            Thread.sleep(test.data() % 3);
            return test.data() % 11 == 0 ? Outcome.failed() : Outcome.passed();
        });

        // Assert
        List<String> lines = Arrays.asList(out.toString().split("\n"));
        assertEquals("running 60 tests", lines.get(1));
        List<String> testLines = lines.subList(2, 2 + tests.size());
        Set<String> printedNames = new HashSet<>();
        for (String line : testLines) {
            Matcher matcher = PRETTY_LINE.matcher(line);
            assertTrue(matcher.matches(), "interleaved or partial line: " + line);
            printedNames.add(matcher.group(1));
        }
        assertEquals(tests.stream().map(TestDescriptor::name).collect(Collectors.toSet()), printedNames);
    }

    @Test
    public void testConcurrentRun_ReportsInCompletionOrder() throws Exception {
        // Arrange
        CountDownLatch secondFinished = new CountDownLatch(1);
        List<TestDescriptor<Void>> tests = List.of(TestDescriptor.test("first"), TestDescriptor.test("second"));
        StringWriter out = new StringWriter();
        RunConfiguration config = RunConfiguration.builder()
            .numWorkers(2)
            .format(FormatSetting.TERSE)
            .build();

        // Act
        new TestRunner<Void>(config, new PlainSink(out)).run(tests, test -> {
            if (test.name().equals("first")) {
                assertTrue(secondFinished.await(10, TimeUnit.SECONDS));
                return Outcome.failed();
            }
            secondFinished.countDown();
            return Outcome.passed();
        });

        // Assert
        assertTrue(out.toString().startsWith("\nrunning 2 tests\n.F\n"), out.toString());
    }

    @Test
    public void testSingleWorker_RunsOnCallingThreadInOrder() throws Exception {
        // Arrange
        List<String> order = new ArrayList<>();
        String caller = Thread.currentThread().getName();
        RunConfiguration config = RunConfiguration.builder().numWorkers(1).build();

        // Act
        new TestRunner<Integer>(config, new PlainSink(new StringWriter())).run(catalog(15), test -> {
            assertEquals(caller, Thread.currentThread().getName());
            order.add(test.name());
            return Outcome.passed();
        });

        // Assert
        List<String> expected = catalog(15).stream()
            .filter(test -> !test.ignored())
            .map(TestDescriptor::name)
            .collect(Collectors.toList());
        assertEquals(expected, order);
    }

    @Test
    public void testConcurrentRun_ThrowingFunctionAbortsRun() {
        // Arrange
        RunConfiguration config = RunConfiguration.builder().numWorkers(NUM_WORKERS).build();
        TestRunner<Integer> runner = new TestRunner<>(config, new PlainSink(new StringWriter()));

        // Act
        TestExecutionException ex = assertThrows(TestExecutionException.class, () -> runner.run(catalog(10), test -> {
            if (test.data() == 3) throw new IllegalArgumentException("bad input");
            return Outcome.passed();
        }));

        // Assert
        assertEquals("case_3", ex.getTestName());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    public void testConcurrentRun_FailedAssertionAbortsRunNamingTheTest() {
        // Arrange
        RunConfiguration config = RunConfiguration.builder().numWorkers(NUM_WORKERS).build();
        TestRunner<Integer> runner = new TestRunner<>(config, new PlainSink(new StringWriter()));

        // Act
        TestExecutionException ex = assertThrows(TestExecutionException.class, () -> runner.run(catalog(10), test -> {
            if (test.data() == 5) throw new AssertionError("expected 1 but was 2");
            return Outcome.passed();
        }));

        // Assert
        assertEquals("case_5", ex.getTestName());
        assertInstanceOf(AssertionError.class, ex.getCause());
    }

    @Test
    public void testConcurrentRun_AbortWaitsForDispatchedTests() {
        // Arrange
        CountDownLatch slowStarted = new CountDownLatch(1);
        AtomicBoolean slowFinished = new AtomicBoolean(false);
        List<TestDescriptor<Void>> tests = List.of(TestDescriptor.test("slow"), TestDescriptor.test("crash"));
        RunConfiguration config = RunConfiguration.builder().numWorkers(2).build();
        TestRunner<Void> runner = new TestRunner<>(config, new PlainSink(new StringWriter()));

        // Act
        assertThrows(TestExecutionException.class, () -> runner.run(tests, test -> {
            if (test.name().equals("slow")) {
                slowStarted.countDown();
                Thread.sleep(200);
                slowFinished.set(true);
                return Outcome.passed();
            }
            assertTrue(slowStarted.await(10, TimeUnit.SECONDS));
            throw new IllegalStateException("crash");
        }));

        // Assert
        assertTrue(slowFinished.get(), "the slow test must have finished before run returned");
    }
}
