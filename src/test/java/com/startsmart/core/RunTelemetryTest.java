package com.startsmart.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunTelemetryTest {

    @Test
    void summaryShouldContainRequiredFields() {
        RunTelemetry telemetry = new RunTelemetry("req-1", "full");
        telemetry.startStep(RunTelemetry.STEP_AGGREGATE);
        telemetry.endStep(RunTelemetry.STEP_AGGREGATE, 10, 9, 1);
        telemetry.startStep(RunTelemetry.STEP_EXPLAIN);
        telemetry.endStep(RunTelemetry.STEP_EXPLAIN, 3, 3, 0, "partial");
        telemetry.finish();

        String summary = telemetry.getSummary();

        assertTrue(summary.contains("request_id=req-1"));
        assertTrue(summary.contains("mode=full"));
        assertTrue(summary.contains("total_elapsed_ms="));
        assertTrue(summary.contains("errors_total=1"));
        assertTrue(summary.contains("steps:"));
        assertTrue(summary.contains(RunTelemetry.STEP_AGGREGATE));
        assertTrue(summary.contains("note=partial"));
    }

    @Test
    void timingMap_shouldUseLowercaseStageKeysAndTotal() {
        RunTelemetry telemetry = new RunTelemetry("req-2", "fast");
        telemetry.startStep(RunTelemetry.STEP_RULE);
        telemetry.endStep(RunTelemetry.STEP_RULE, 9, 9, 0);
        telemetry.addStep(RunTelemetry.STEP_LLM, 120, 9, 8, 1, "timeout");
        telemetry.finish();

        Map<String, Long> timing = telemetry.timingMap();

        assertEquals(List.of("rule_ms", "llm_ms", "total_ms"), List.copyOf(timing.keySet()));
        assertEquals(120L, timing.get("llm_ms"));
        assertTrue(timing.get("total_ms") >= 0L);
    }

    @Test
    void addStep_shouldAccumulateRepeatedStages() {
        RunTelemetry telemetry = new RunTelemetry("req-3", "full");
        telemetry.addStep("llm", 30, 1, 1, 0, "");
        telemetry.addStep("LLM", 45, 1, 0, 1, "timeout");
        telemetry.addStep("LLM", 5, 1, 0, 1, "timeout");

        List<RunTelemetry.StepRecord> records = telemetry.stepRecords();

        assertEquals(1, records.size());
        RunTelemetry.StepRecord llm = records.get(0);
        assertEquals("LLM", llm.name());
        assertEquals(80L, llm.elapsedMs());
        assertEquals(3L, llm.itemsIn());
        assertEquals(2L, llm.errorCount());
        assertEquals("timeout", llm.optionalNote());
        assertEquals(2, telemetry.errorsTotal());
    }
}
