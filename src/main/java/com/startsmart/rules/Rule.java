package com.startsmart.rules;

import com.startsmart.model.FeatureSource;

/**
 * One row of a rule table. The effective delta is {@code delta + scale.weight * (feature - scale.pivot)};
 * rules without a scale contribute their constant delta.
 */
public final class Rule {
    public final String name;
    public final RuleCondition condition;
    public final double delta;
    public final Scale scale;
    public final String reason;
    public final String concern;

    public record Scale(String feature, double weight, double pivot) {
    }

    public Rule(String name, RuleCondition condition, double delta, Scale scale, String reason, String concern) {
        this.name = name;
        this.condition = condition;
        this.delta = delta;
        this.scale = scale;
        this.reason = reason;
        this.concern = concern;
    }

    public Rule(String name, RuleCondition condition, double delta, String reason) {
        this(name, condition, delta, null, reason, null);
    }

    public double effectiveDelta(FeatureSource features) {
        if (scale == null) {
            return delta;
        }
        Double value = Conditions.asNumber(features.feature(scale.feature()));
        if (value == null) {
            return delta;
        }
        return delta + scale.weight() * (value - scale.pivot());
    }

    public String reasonFor(double effectiveDelta) {
        if (effectiveDelta < 0 && concern != null && !concern.isBlank()) {
            return concern;
        }
        return reason;
    }
}
