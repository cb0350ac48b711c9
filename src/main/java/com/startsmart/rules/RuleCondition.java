package com.startsmart.rules;

import com.startsmart.model.FeatureSource;

/**
 * Predicate over named features. A comparison on an absent feature is false.
 */
public interface RuleCondition {
    boolean test(FeatureSource features);
}
