package com.startsmart.pipeline;

import com.startsmart.bev.BusinessEnvironmentVector;
import com.startsmart.contextual.ContextualEvaluator;
import com.startsmart.core.diagnostics.DegradationCause;
import com.startsmart.core.diagnostics.Outcome;
import com.startsmart.model.ContextualAssessment;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContextualGuardTest {

    @Test
    void assess_shouldStartTimeoutWhenWorkerPicksUpTheCall() throws Exception {
        CountDownLatch firstRunning = new CountDownLatch(1);
        SleepingEvaluator evaluator = new SleepingEvaluator(firstRunning, 250L, 200L);

        try (ContextualGuard guard = new ContextualGuard(evaluator, 400L, 5_000L, 1)) {
            CompletableFuture<Outcome<ContextualAssessment>> first = CompletableFuture.supplyAsync(() -> guard.assess(null));
            assertTrue(firstRunning.await(2, TimeUnit.SECONDS));
            Outcome<ContextualAssessment> second = guard.assess(null);

            assertTrue(first.get(5, TimeUnit.SECONDS).success);
            assertTrue(second.success, second.message);
            assertEquals(0.7, second.value.probabilities.get("gym"), 1e-9);
        }
    }

    @Test
    void assess_shouldStillTimeOutSlowRunningCalls() {
        SleepingEvaluator evaluator = new SleepingEvaluator(new CountDownLatch(1), 2_000L, 2_000L);

        try (ContextualGuard guard = new ContextualGuard(evaluator, 100L, 5_000L, 1)) {
            Outcome<ContextualAssessment> outcome = guard.assess(null);

            assertFalse(outcome.success);
            assertEquals(DegradationCause.CONTEXTUAL_TIMEOUT, outcome.cause);
        }
    }

    @Test
    void assess_shouldBoundTimeSpentWaitingForAWorker() throws Exception {
        CountDownLatch firstRunning = new CountDownLatch(1);
        SleepingEvaluator evaluator = new SleepingEvaluator(firstRunning, 1_500L, 10L);

        try (ContextualGuard guard = new ContextualGuard(evaluator, 3_000L, 100L, 1)) {
            CompletableFuture.supplyAsync(() -> guard.assess(null));
            assertTrue(firstRunning.await(2, TimeUnit.SECONDS));
            Outcome<ContextualAssessment> queued = guard.assess(null);

            assertFalse(queued.success);
            assertEquals(DegradationCause.CONTEXTUAL_TIMEOUT, queued.cause);
            assertTrue(queued.message.contains("queued"));
        }
    }

    private static final class SleepingEvaluator implements ContextualEvaluator {
        private final CountDownLatch firstRunning;
        private final long firstSleepMs;
        private final long laterSleepMs;
        private final AtomicInteger calls = new AtomicInteger();

        SleepingEvaluator(CountDownLatch firstRunning, long firstSleepMs, long laterSleepMs) {
            this.firstRunning = firstRunning;
            this.firstSleepMs = firstSleepMs;
            this.laterSleepMs = laterSleepMs;
        }

        @Override
        public ContextualAssessment assess(BusinessEnvironmentVector bev) {
            boolean first = calls.getAndIncrement() == 0;
            if (first) {
                firstRunning.countDown();
            }
            try {
                Thread.sleep(first ? firstSleepMs : laterSleepMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted", e);
            }
            return ContextualAssessment.builder()
                    .probabilities(Map.of("gym", 0.7))
                    .evaluator(name())
                    .build();
        }

        @Override
        public String name() {
            return "sleeping";
        }
    }
}
