package io.github.galkahana.testharness;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;

import lombok.extern.slf4j.Slf4j;

/**
 * Fixed size worker pool with a single completion channel.
 * <p>
 * Work is submitted with {@link #submitTask}, results that are known without running anything are put
 * straight into the channel with {@link #complete}. The thread that calls {@link #drain} receives every
 * result exactly once, in completion order, and is the only consumer of the channel. Workers never touch
 * anything but the channel. There is no retry, cancellation or timeout: a submitted task runs to completion, and
 * {@link #shutdown()} waits for it even when draining was abandoned.
 *
 * @param <I> Input identifying a unit of work
 * @param <O> Result of a unit of work
 */
@Slf4j
public class WorkDistributor<I, O> {

    private final int numWorkers;

    private ThreadPoolExecutor executor;
    private BlockingQueue<Future<Completion<I, O>>> completionQueue;
    private CompletionService<Completion<I, O>> completionService;

    private volatile boolean running = false;
    private int tasksSubmitted = 0;
    private int tasksDrained = 0;

    /**
     * @param numWorkers Number of concurrent worker threads
     */
    public WorkDistributor(int numWorkers) {
        if (numWorkers < 1) throw new IllegalArgumentException("numWorkers must be positive, got " + numWorkers);
        this.numWorkers = numWorkers;
    }

    /**
     * A finished unit of work as it travels through the completion channel.
     */
    public record Completion<I, O>(I input, O result) {}

    /**
     * Start the worker pool. Call this before submitting anything.
     */
    public synchronized void start() {
        if (running) throw new IllegalStateException("Already running");
        running = true;

        AtomicInteger threadIndex = new AtomicInteger();
        executor = new ThreadPoolExecutor(numWorkers, numWorkers, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                runnable -> new Thread(runnable, "test-worker-" + threadIndex.incrementAndGet()));
        completionQueue = new LinkedBlockingQueue<>();
        completionService = new ExecutorCompletionService<>(executor, completionQueue);

        log.debug("Started executor with {} workers", numWorkers);
    }

    /**
     * Run {@code work} on a worker. Its result reaches the channel when it finishes.
     *
     * @param input Identifies the work, handed back together with the result
     * @param work Produces the result
     * @throws IllegalStateException If not started or already shut down
     */
    public void submitTask(I input, Callable<O> work) {
        checkRunning();
        completionService.submit(() -> new Completion<>(input, work.call()));
        tasksSubmitted++;
    }

    /**
     * Put a result that needs no work into the channel as if its task completed immediately.
     */
    public void complete(I input, O result) {
        checkRunning();
        completionQueue.add(CompletableFuture.completedFuture(new Completion<>(input, result)));
        tasksSubmitted++;
    }

    /**
     * Block until every submitted or completed item has been handed to {@code consumer}, in the order
     * they finished. The consumer runs on the calling thread.
     *
     * @throws InterruptedException If interrupted while waiting for a result
     * @throws RuntimeException The failure of a task, unwrapped if it was unchecked
     * @throws Error An error thrown by a task, unwrapped
     */
    public void drain(BiConsumer<I, O> consumer) throws InterruptedException {
        checkRunning();
        while (tasksDrained < tasksSubmitted) {
            Completion<I, O> completion;
            try {
                completion = completionService.take().get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException runtime) throw runtime;
                if (cause instanceof Error error) throw error;
                throw new IllegalStateException("Task failed", cause);
            }
            tasksDrained++;
            consumer.accept(completion.input(), completion.result());
        }
    }

    public int getTasksSubmitted() {
        return tasksSubmitted;
    }

    public int getTasksDrained() {
        return tasksDrained;
    }

    /**
     * Let running tasks finish and stop the workers. Blocks until all threads have stopped.
     */
    public synchronized void shutdown() throws InterruptedException {
        if (!running) return;
        running = false;
        executor.shutdown();
        if (!executor.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS)) {
            log.warn("Executor did not terminate in time");
        }
        log.debug("All workers stopped");
    }

    private void checkRunning() {
        if (!running) throw new IllegalStateException("Not running. Call start() first, and ensure shutdown has not been called.");
    }
}
