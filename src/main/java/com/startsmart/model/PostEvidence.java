package com.startsmart.model;

import java.time.Instant;

public record PostEvidence(String id, String text, SignalType type, double engagement, Instant timestamp) {
}
