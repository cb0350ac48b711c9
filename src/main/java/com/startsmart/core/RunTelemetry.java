package com.startsmart.core;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-request stage timings. Sequential stages use startStep/endStep; work spread over
 * several threads reports its elapsed time through {@link #addStep}.
 */
public final class RunTelemetry {
    public static final String STEP_BEV = "BEV";
    public static final String STEP_AGGREGATE = "AGGREGATE";
    public static final String STEP_NORMALIZE = "NORMALIZE";
    public static final String STEP_RULE = "RULE";
    public static final String STEP_LLM = "LLM";
    public static final String STEP_COMBINE = "COMBINE";
    public static final String STEP_EXPLAIN = "EXPLAIN";

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_INSTANT;

    private final String requestId;
    private final String mode;
    private final Instant startedAt;
    private final long startedNanos;
    private Instant finishedAt;
    private long finishedNanos;
    private int errorsTotal;

    private final Map<String, StepStat> steps = new LinkedHashMap<>();
    private final Map<String, Deque<Long>> stepStartsNanos = new HashMap<>();

    public RunTelemetry(String requestId, String mode) {
        this.requestId = blankTo(requestId, "request");
        this.mode = blankTo(mode, "fast");
        this.startedAt = Instant.now();
        this.startedNanos = System.nanoTime();
        this.errorsTotal = 0;
    }

    public synchronized String requestId() {
        return requestId;
    }

    public synchronized void startStep(String name) {
        String key = sanitizeStepName(name);
        steps.putIfAbsent(key, new StepStat(key));
        stepStartsNanos.computeIfAbsent(key, ignored -> new ArrayDeque<>()).push(System.nanoTime());
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount) {
        endStep(name, itemsIn, itemsOut, errorCount, "");
    }

    public synchronized void endStep(String name, long itemsIn, long itemsOut, long errorCount, String optionalNote) {
        String key = sanitizeStepName(name);
        long startedNanos = 0L;
        Deque<Long> stack = stepStartsNanos.get(key);
        if (stack != null && !stack.isEmpty()) {
            startedNanos = stack.pop();
        }
        long elapsedMs = startedNanos <= 0L
                ? 0L
                : Math.max(0L, (System.nanoTime() - startedNanos) / 1_000_000L);
        addStep(key, elapsedMs, itemsIn, itemsOut, errorCount, optionalNote);
    }

    public synchronized void addStep(String name, long elapsedMs, long itemsIn, long itemsOut, long errorCount, String optionalNote) {
        String key = sanitizeStepName(name);
        StepStat stat = steps.computeIfAbsent(key, StepStat::new);
        stat.elapsedMs += Math.max(0L, elapsedMs);
        stat.itemsIn += Math.max(0L, itemsIn);
        stat.itemsOut += Math.max(0L, itemsOut);
        stat.errorCount += Math.max(0L, errorCount);
        if (optionalNote != null && !optionalNote.trim().isEmpty()) {
            String note = optionalNote.trim();
            if (stat.optionalNote.isEmpty()) {
                stat.optionalNote = note;
            } else if (!stat.optionalNote.contains(note)) {
                stat.optionalNote = stat.optionalNote + "; " + note;
            }
        }
        if (errorCount > 0L) {
            errorsTotal += (int) errorCount;
        }
    }

    public synchronized int errorsTotal() {
        return errorsTotal;
    }

    public synchronized void finish() {
        if (finishedAt == null) {
            finishedAt = Instant.now();
            finishedNanos = System.nanoTime();
        }
    }

    public synchronized long totalElapsedMs() {
        long end = finishedAt == null ? System.nanoTime() : finishedNanos;
        return Math.max(0L, (end - startedNanos) / 1_000_000L);
    }

    /**
     * Stage timings keyed {@code <stage>_ms} plus {@code total_ms}, in the order stages first ran.
     */
    public synchronized Map<String, Long> timingMap() {
        Map<String, Long> out = new LinkedHashMap<>();
        for (StepStat stat : steps.values()) {
            out.put(stat.name.toLowerCase(Locale.ROOT) + "_ms", stat.elapsedMs);
        }
        out.put("total_ms", totalElapsedMs());
        return out;
    }

    public synchronized List<StepRecord> stepRecords() {
        List<StepRecord> out = new ArrayList<>();
        for (StepStat stat : steps.values()) {
            out.add(new StepRecord(stat.name, stat.elapsedMs, stat.itemsIn, stat.itemsOut, stat.errorCount, stat.optionalNote));
        }
        return out;
    }

    public synchronized String getSummary() {
        Instant end = finishedAt == null ? Instant.now() : finishedAt;
        StringBuilder sb = new StringBuilder();
        sb.append("request_id=").append(requestId).append('\n');
        sb.append("mode=").append(mode).append('\n');
        sb.append("started_at=").append(ISO.format(startedAt)).append('\n');
        sb.append("finished_at=").append(ISO.format(end)).append('\n');
        sb.append("total_elapsed_ms=").append(Math.max(0L, Duration.between(startedAt, end).toMillis())).append('\n');
        sb.append("errors_total=").append(errorsTotal).append('\n');
        sb.append("steps:\n");
        for (StepStat stat : steps.values()) {
            sb.append(String.format(
                    Locale.US,
                    "  %s elapsed_ms=%d in=%d out=%d err=%d",
                    stat.name,
                    stat.elapsedMs,
                    stat.itemsIn,
                    stat.itemsOut,
                    stat.errorCount
            ));
            if (!stat.optionalNote.isBlank()) {
                sb.append(" note=").append(stat.optionalNote.trim());
            }
            sb.append('\n');
        }
        return sb.toString().trim();
    }

    private String sanitizeStepName(String name) {
        String step = name == null ? "" : name.trim();
        return step.isEmpty() ? "UNKNOWN_STEP" : step.toUpperCase(Locale.ROOT);
    }

    private static String blankTo(String value, String fallback) {
        String text = value == null ? "" : value.trim();
        return text.isEmpty() ? fallback : text;
    }

    private static final class StepStat {
        private final String name;
        private long elapsedMs;
        private long itemsIn;
        private long itemsOut;
        private long errorCount;
        private String optionalNote;

        private StepStat(String name) {
            this.name = name;
            this.optionalNote = "";
        }
    }

    public record StepRecord(
            String name,
            long elapsedMs,
            long itemsIn,
            long itemsOut,
            long errorCount,
            String optionalNote
    ) {
    }
}
