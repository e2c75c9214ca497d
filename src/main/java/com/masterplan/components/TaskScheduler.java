package com.masterplan.components;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Application-wide bounded thread pools. The "heavy" executor runs whole publish jobs, so its thread count limits how
 * many publishes proceed at once. The "light" executor is the passing lane for short work such as geometry import and
 * asynchronous event handling. The tile executor is reserved for encoding the tiles of one pyramid level in parallel;
 * it is separate from the heavy pool so a job waiting on its tiles never waits on a thread held by itself or another
 * job.
 *
 * Every Runnable submitted here is wrapped so that no Throwable can silently kill a pool thread.
 */
public class TaskScheduler implements Component {

    private static final Logger LOG = LoggerFactory.getLogger(TaskScheduler.class);

    private final ExecutorService lightExecutor;
    private final ExecutorService heavyExecutor;
    private final ExecutorService tileExecutor;

    // Maybe the number of threads should always be auto-set from the number of processor cores.
    public interface Config {
        int lightThreads ();
        int heavyThreads ();
        int tileThreads ();
    }

    public TaskScheduler (Config config) {
        lightExecutor = Executors.newFixedThreadPool(config.lightThreads(), namedThreads("light"));
        heavyExecutor = Executors.newFixedThreadPool(config.heavyThreads(), namedThreads("heavy"));
        tileExecutor = Executors.newFixedThreadPool(config.tileThreads(), namedThreads("tile"));
        LOG.info("Thread pools: {} light, {} heavy, {} tile encoding.",
                config.lightThreads(), config.heavyThreads(), config.tileThreads());
    }

    public void enqueueLightTask (Runnable runnable) {
        lightExecutor.submit(new ErrorTrap(runnable));
    }

    public void enqueueHeavyTask (Runnable runnable) {
        heavyExecutor.submit(new ErrorTrap(runnable));
    }

    /** For CompletableFutures, which capture their own exceptions and so need no ErrorTrap. */
    public Executor lightExecutor () {
        return lightExecutor;
    }

    public ExecutorService tileExecutor () {
        return tileExecutor;
    }

    /** Stop accepting work and wait briefly for running tasks. Used at shutdown and in tests. */
    public void shutdown () {
        lightExecutor.shutdown();
        heavyExecutor.shutdown();
        tileExecutor.shutdown();
        try {
            if (!heavyExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Heavy tasks still running at shutdown.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads (String poolName) {
        final AtomicInteger counter = new AtomicInteger();
        final ThreadFactory defaultFactory = Executors.defaultThreadFactory();
        return runnable -> {
            Thread thread = defaultFactory.newThread(runnable);
            thread.setName(poolName + "-" + counter.incrementAndGet());
            return thread;
        };
    }

    /**
     * Wrap a runnable, catching any Errors or Exceptions that occur. This prevents them from propagating up to the
     * executor, which would swallow them in an unexamined Future.
     */
    private static class ErrorTrap implements Runnable {

        private final Runnable runnable;

        public ErrorTrap (Runnable runnable) {
            this.runnable = runnable;
        }

        @Override
        public final void run () {
            try {
                runnable.run();
            } catch (Throwable t) {
                LOG.error("Background execution of {} caused exception.", runnable.getClass(), t);
            }
        }
    }

}
