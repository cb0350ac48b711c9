package com.startsmart.rules;

import java.util.List;

public final class RuleTable {
    public static final double DEFAULT_BASE_SCORE = 0.5;

    public final String name;
    public final double baseScore;
    public final List<Rule> rules;

    public RuleTable(String name, double baseScore, List<Rule> rules) {
        this.name = name;
        this.baseScore = baseScore;
        this.rules = List.copyOf(rules);
    }
}
