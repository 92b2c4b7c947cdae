package com.overseer.analysis;

import com.overseer.AlertHistory;
import com.overseer.AppLogger;
import com.overseer.models.AnalysisContext;
import com.overseer.models.AnalysisResult;
import com.overseer.models.SupervisorResult;
import com.overseer.models.ThinkingChunk;
import com.overseer.supervisors.BehaviorSupervisor;
import com.overseer.supervisors.NodeAnalyzer;
import com.overseer.supervisors.SupervisorTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Feeds thinking chunks through the supervisor tree one at a time.
 * <p>
 * A single worker thread drains submissions in arrival order, so at most one traversal is
 * in flight. The first submission on an idle scheduler gets a future for its real result;
 * submissions that arrive while another chunk is being analyzed get a completed "queued"
 * placeholder and their result is published to listeners once it is ready.
 * <p>
 * Each tree traversal races a deadline. When the deadline wins, the chunk fails with
 * {@link AnalysisTimeoutException} and the worker moves on; judge calls still running are
 * left to finish and their verdicts are discarded. The behavior run is not bound by the
 * deadline and is waited for in full.
 */
public class AnalysisScheduler {

    private static final String COMPONENT = "AnalysisScheduler";

    private final SupervisorTree tree;
    private final NodeAnalyzer analyzer;
    private final BehaviorSupervisor behavior;
    private final AlertHistory history;
    private final long timeoutMs;

    private final ExecutorService worker;
    private final ExecutorService traversals;
    private final AtomicInteger outstanding = new AtomicInteger();
    private final List<Consumer<AnalysisEvent>> listeners = new CopyOnWriteArrayList<>();

    public AnalysisScheduler(SupervisorTree tree, NodeAnalyzer analyzer, BehaviorSupervisor behavior,
                             AlertHistory history, long timeoutMs) {
        this.tree = Objects.requireNonNull(tree, "tree");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.behavior = behavior;
        this.history = history;
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : 10_000;
        this.worker = Executors.newSingleThreadExecutor(threadFactory("overseer-analysis-worker"));
        this.traversals = Executors.newCachedThreadPool(threadFactory("overseer-traversal"));
    }

    public CompletableFuture<AnalysisResult> analyzeThinking(ThinkingChunk chunk) {
        return analyzeThinking(chunk, null);
    }

    /**
     * Submit a chunk for analysis. Never blocks the caller.
     */
    public synchronized CompletableFuture<AnalysisResult> analyzeThinking(ThinkingChunk chunk, AnalysisContext context) {
        Objects.requireNonNull(chunk, "chunk");
        CompletableFuture<AnalysisResult> future = new CompletableFuture<>();
        int ahead = outstanding.getAndIncrement();
        worker.execute(() -> run(chunk, context, future));
        if (ahead == 0) {
            return future;
        }
        log("Analysis in progress, queued chunk " + chunk.getId() + " (" + ahead + " ahead)");
        return CompletableFuture.completedFuture(AnalysisResult.queued(chunk));
    }

    private void run(ThinkingChunk chunk, AnalysisContext context, CompletableFuture<AnalysisResult> future) {
        AnalysisResult result = null;
        Throwable failure = null;
        try {
            result = process(chunk, context);
        } catch (AnalysisTimeoutException e) {
            logWarning(e.getMessage());
            failure = e;
        } catch (ExecutionException e) {
            failure = e.getCause() != null ? e.getCause() : e;
            AppLogger.error(COMPONENT, "Analysis of chunk " + chunk.getId() + " failed", failure);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        } finally {
            // released before the outcome is announced, so follow-up submissions see an idle scheduler
            outstanding.decrementAndGet();
        }

        if (failure != null) {
            if (!(failure instanceof InterruptedException)) {
                publish(AnalysisEvent.failed(chunk, failure));
            }
            future.completeExceptionally(failure);
            return;
        }

        publish(AnalysisEvent.complete(chunk, result));
        for (SupervisorResult alert : result.getAlerts()) {
            if (history != null) {
                history.record(alert, result.getThinkingChunk());
            }
            publish(AnalysisEvent.alert(chunk, result, alert));
        }
        future.complete(result);
    }

    /**
     * Only the tree traversal races the deadline. The behavior run is awaited on its own
     * and its result joins the tree's.
     */
    private AnalysisResult process(ThinkingChunk chunk, AnalysisContext context)
        throws ExecutionException, InterruptedException {
        long startedAt = System.currentTimeMillis();
        long deadline = startedAt + timeoutMs;
        String content = chunk.getContent() != null ? chunk.getContent() : "";

        Future<SupervisorResult> treeRun = traversals.submit(() -> analyzer.analyze(tree.getRoot(), content, context));
        Future<SupervisorResult> behaviorRun = null;
        if (behavior != null && context != null && context.hasOriginalRequest()) {
            behaviorRun = traversals.submit(() -> behavior.analyze(content, context));
        }

        List<SupervisorResult> results = new ArrayList<>();
        results.add(awaitUntil(treeRun, deadline, chunk));
        if (behaviorRun != null) {
            SupervisorResult behaviorResult = awaitBehavior(behaviorRun, chunk);
            if (behaviorResult != null) {
                results.add(behaviorResult);
            }
        }
        return new AnalysisResult(chunk.getId(), content, results, System.currentTimeMillis() - startedAt, false);
    }

    private SupervisorResult awaitUntil(Future<SupervisorResult> run, long deadline, ThinkingChunk chunk)
        throws ExecutionException, InterruptedException {
        long remaining = Math.max(0, deadline - System.currentTimeMillis());
        try {
            return run.get(remaining, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // the run is abandoned, not cancelled
            throw new AnalysisTimeoutException(chunk.getId(), timeoutMs);
        }
    }

    /**
     * A failed behavior run drops its own result only; the tree result still stands.
     */
    private SupervisorResult awaitBehavior(Future<SupervisorResult> run, ThinkingChunk chunk)
        throws InterruptedException {
        try {
            return run.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            AppLogger.error(COMPONENT, "Behavior analysis of chunk " + chunk.getId() + " failed", cause);
            return null;
        }
    }

    private void publish(AnalysisEvent event) {
        for (Consumer<AnalysisEvent> listener : listeners) {
            deliverSafely(listener, event);
        }
    }

    private void deliverSafely(Consumer<AnalysisEvent> listener, AnalysisEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            logWarning("Listener threw while handling " + event.getType() + ": " + e.getMessage());
        }
    }

    public Runnable addListener(Consumer<AnalysisEvent> listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Chunks waiting behind the one being analyzed.
     */
    public int getQueueSize() {
        return Math.max(0, outstanding.get() - 1);
    }

    public boolean isBusy() {
        return outstanding.get() > 0;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void shutdown() {
        worker.shutdownNow();
        traversals.shutdownNow();
    }

    private static ThreadFactory threadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void log(String message) {
        AppLogger.info(COMPONENT, message);
    }

    private void logWarning(String message) {
        AppLogger.warn(COMPONENT, message);
    }
}
