package com.startsmart.core;

import java.util.EnumSet;
import java.util.Set;

/**
 * Per-request lifecycle. Point queries skip NORMALIZING; fast mode skips CONTEXTUAL_PENDING.
 */
public enum PipelineState {
    RECEIVED,
    AGGREGATING,
    NORMALIZING,
    RULE_SCORING,
    CONTEXTUAL_PENDING,
    COMBINING,
    EXPLAINING,
    DONE,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == CANCELLED;
    }

    public boolean canMoveTo(PipelineState next) {
        if (isTerminal()) {
            return false;
        }
        if (next == CANCELLED) {
            return true;
        }
        return successors().contains(next);
    }

    private Set<PipelineState> successors() {
        switch (this) {
            case RECEIVED:
                return EnumSet.of(AGGREGATING);
            case AGGREGATING:
                return EnumSet.of(NORMALIZING, RULE_SCORING);
            case NORMALIZING:
                return EnumSet.of(RULE_SCORING);
            case RULE_SCORING:
                return EnumSet.of(CONTEXTUAL_PENDING, COMBINING);
            case CONTEXTUAL_PENDING:
                return EnumSet.of(COMBINING);
            case COMBINING:
                return EnumSet.of(EXPLAINING);
            case EXPLAINING:
                return EnumSet.of(DONE);
            default:
                return EnumSet.noneOf(PipelineState.class);
        }
    }
}
