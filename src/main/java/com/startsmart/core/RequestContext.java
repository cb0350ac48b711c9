package com.startsmart.core;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;

/**
 * State, telemetry and cancellation flag of one pipeline invocation.
 */
public final class RequestContext {
    private static final Logger LOG = LogManager.getLogger(RequestContext.class);

    private final String requestId;
    private final RunTelemetry telemetry;
    private final List<PipelineState> history = new ArrayList<>();
    private PipelineState state = PipelineState.RECEIVED;
    private volatile boolean cancelled;

    public RequestContext(String mode) {
        this(UUID.randomUUID().toString(), mode);
    }

    public RequestContext(String requestId, String mode) {
        this.requestId = requestId;
        this.telemetry = new RunTelemetry(requestId, mode);
        this.history.add(PipelineState.RECEIVED);
    }

    public String requestId() {
        return requestId;
    }

    public RunTelemetry telemetry() {
        return telemetry;
    }

    public synchronized PipelineState state() {
        return state;
    }

    public synchronized List<PipelineState> history() {
        return Collections.unmodifiableList(new ArrayList<>(history));
    }

    public synchronized void moveTo(PipelineState next) {
        checkNotCancelled();
        if (!state.canMoveTo(next)) {
            throw new IllegalStateException("illegal pipeline transition " + state + " -> " + next);
        }
        LOG.trace("request {} {} -> {}", requestId, state, next);
        state = next;
        history.add(next);
        if (next == PipelineState.DONE) {
            telemetry.finish();
        }
    }

    /**
     * Requests an abort. The running pipeline notices at its next checkpoint.
     */
    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public synchronized void checkNotCancelled() {
        if (cancelled || Thread.currentThread().isInterrupted()) {
            if (!state.isTerminal()) {
                state = PipelineState.CANCELLED;
                history.add(PipelineState.CANCELLED);
                telemetry.finish();
            }
            throw new CancellationException("request " + requestId + " cancelled");
        }
    }
}
