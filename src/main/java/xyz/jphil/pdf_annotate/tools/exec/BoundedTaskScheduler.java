package xyz.jphil.pdf_annotate.tools.exec;

import lombok.Getter;
import lombok.experimental.Accessors;
import xyz.jphil.pdf_annotate.tools.LogFormatter;
import xyz.jphil.pdf_annotate.tools.ProgressTracker;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs independent work items with at most {@code maxConcurrency} of them in flight.
 * <p>
 * Items start in input order on a fixed-size pool and {@link #run} returns only once
 * every item has finished. The first failure is fatal: no further items start, running
 * siblings are interrupted, and the failure is rethrown to the caller.
 */
@Getter
@Accessors(fluent = true)
public class BoundedTaskScheduler {

    private static final AtomicInteger POOL_SEQ = new AtomicInteger();

    private final int maxConcurrency;
    private final LogFormatter log;

    public BoundedTaskScheduler(int maxConcurrency, LogFormatter log) {
        if (maxConcurrency < 1) {
            throw new ConfigurationException("--concurrency must be at least 1 (got " + maxConcurrency + ")");
        }
        this.maxConcurrency = maxConcurrency;
        this.log = log;
    }

    public void run(List<WorkItem> items) {
        run(items, ProgressTracker.silent("tasks", items.size()));
    }

    public void run(List<WorkItem> items, ProgressTracker progress) {
        if (items.isEmpty()) {
            return;
        }
        log.trace("SCHED", String.format("running %d items, max %d in flight: %s",
            items.size(), maxConcurrency, items));

        int poolSize = Math.min(maxConcurrency, items.size());
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, workerThreads());
        var completion = new ExecutorCompletionService<WorkItem>(executor);
        boolean failed = true;

        try {
            for (WorkItem item : items) {
                completion.submit(() -> execute(item));
            }
            for (int i = 0; i < items.size(); i++) {
                Future<WorkItem> finished = completion.take();
                finished.get();
                progress.inc();
            }
            failed = false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AnnotateException annotateException) {
                throw annotateException;
            }
            throw new ToolInvocationException("task failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolInvocationException("interrupted while waiting for tasks", e);
        } finally {
            shutdown(executor, failed);
        }
    }

    private static WorkItem execute(WorkItem item) throws Exception {
        try {
            item.action().run();
            return item;
        } catch (AnnotateException e) {
            throw e;
        } catch (Exception e) {
            throw new ToolInvocationException(item.label() + " failed (" + e.getMessage() + ")", e);
        }
    }

    private void shutdown(ExecutorService executor, boolean failed) {
        if (failed) {
            executor.shutdownNow();
        } else {
            executor.shutdown();
        }
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warning("SCHED", "workers did not stop within 60s, abandoning them");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory workerThreads() {
        int pool = POOL_SEQ.incrementAndGet();
        var seq = new AtomicInteger();
        return runnable -> {
            var thread = new Thread(runnable, "stage-" + pool + "-worker-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
