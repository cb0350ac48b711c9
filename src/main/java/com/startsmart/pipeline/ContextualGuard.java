package com.startsmart.pipeline;

import com.startsmart.bev.BusinessEnvironmentVector;
import com.startsmart.contextual.ContextualEvaluator;
import com.startsmart.core.diagnostics.DegradationCause;
import com.startsmart.core.diagnostics.Outcome;
import com.startsmart.model.ContextualAssessment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the contextual evaluator on its own threads with a hard timeout. Never throws for evaluator failures.
 * <p>
 * The timeout is measured from the moment a worker picks the call up. Time spent waiting for a free
 * worker is bounded separately by the queue timeout.
 */
final class ContextualGuard implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(ContextualGuard.class);

    private final ContextualEvaluator evaluator;
    private final long timeoutMs;
    private final long queueTimeoutMs;
    private final ExecutorService executor;

    ContextualGuard(ContextualEvaluator evaluator, long timeoutMs, long queueTimeoutMs, int threads) {
        this.evaluator = evaluator;
        this.timeoutMs = Math.max(1L, timeoutMs);
        this.queueTimeoutMs = Math.max(1L, queueTimeoutMs);
        AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, threads), r -> {
            Thread t = new Thread(r, "contextual-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    Outcome<ContextualAssessment> assess(BusinessEnvironmentVector bev) {
        CountDownLatch started = new CountDownLatch(1);
        Future<ContextualAssessment> future = executor.submit(() -> {
            started.countDown();
            return evaluator.assess(bev);
        });
        try {
            if (!started.await(queueTimeoutMs, TimeUnit.MILLISECONDS)) {
                future.cancel(true);
                LOG.warn("contextual evaluator {} still queued after {}ms", evaluator.name(), queueTimeoutMs);
                return Outcome.failure(DegradationCause.CONTEXTUAL_TIMEOUT, "queued for more than " + queueTimeoutMs + "ms");
            }
            ContextualAssessment assessment = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (assessment == null) {
                return Outcome.failure(DegradationCause.CONTEXTUAL_ERROR, "evaluator returned no assessment");
            }
            return Outcome.success(assessment);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("contextual evaluator {} timed out after {}ms", evaluator.name(), timeoutMs);
            return Outcome.failure(DegradationCause.CONTEXTUAL_TIMEOUT, "timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            LOG.warn("contextual evaluator {} failed: {}", evaluator.name(), cause.getMessage());
            return Outcome.failure(DegradationCause.CONTEXTUAL_ERROR, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Outcome.failure(DegradationCause.CONTEXTUAL_ERROR, "interrupted");
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
