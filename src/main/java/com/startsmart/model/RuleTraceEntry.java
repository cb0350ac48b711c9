package com.startsmart.model;

/**
 * One fired rule. {@code delta} is what the rule asked for; {@code appliedDelta} is what survived clamping.
 */
public record RuleTraceEntry(String ruleName, double delta, double appliedDelta, String reason) {
}
