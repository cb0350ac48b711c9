package com.startsmart.rules;

import com.startsmart.model.FeatureSource;

import java.util.List;
import java.util.Locale;

/**
 * The condition vocabulary of rule tables.
 */
public final class Conditions {
    private Conditions() {
    }

    public enum Op {
        GT, GTE, LT, LTE, EQ, BETWEEN;

        public String jsonKey() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static RuleCondition always() {
        return features -> true;
    }

    public static RuleCondition present(String feature) {
        return features -> features.feature(feature) != null;
    }

    public static RuleCondition absent(String feature) {
        return features -> features.feature(feature) == null;
    }

    public static RuleCondition any(List<RuleCondition> parts) {
        List<RuleCondition> copy = List.copyOf(parts);
        return features -> {
            for (RuleCondition part : copy) {
                if (part.test(features)) {
                    return true;
                }
            }
            return false;
        };
    }

    public static RuleCondition all(List<RuleCondition> parts) {
        List<RuleCondition> copy = List.copyOf(parts);
        return features -> {
            for (RuleCondition part : copy) {
                if (!part.test(features)) {
                    return false;
                }
            }
            return true;
        };
    }

    public static RuleCondition compare(String feature, Op op, double threshold) {
        return new NumericComparison(feature, op, threshold, threshold);
    }

    public static RuleCondition between(String feature, double low, double high) {
        return new NumericComparison(feature, Op.BETWEEN, low, high);
    }

    public static RuleCondition equalsText(String feature, String expected) {
        return features -> {
            Object value = features.feature(feature);
            return value != null && expected.equalsIgnoreCase(String.valueOf(value));
        };
    }

    private static final class NumericComparison implements RuleCondition {
        private final String feature;
        private final Op op;
        private final double a;
        private final double b;

        private NumericComparison(String feature, Op op, double a, double b) {
            this.feature = feature;
            this.op = op;
            this.a = a;
            this.b = b;
        }

        @Override
        public boolean test(FeatureSource features) {
            Double value = asNumber(features.feature(feature));
            if (value == null) {
                return false;
            }
            double v = value;
            switch (op) {
                case GT:
                    return v > a;
                case GTE:
                    return v >= a;
                case LT:
                    return v < a;
                case LTE:
                    return v <= a;
                case EQ:
                    return v == a;
                case BETWEEN:
                    return v >= a && v <= b;
                default:
                    return false;
            }
        }
    }

    static Double asNumber(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        if (value instanceof Boolean flag) {
            return flag ? 1.0 : 0.0;
        }
        return null;
    }
}
