package com.startsmart.contextual;

import com.startsmart.bev.BusinessEnvironmentVector;
import com.startsmart.model.ContextualAssessment;

/**
 * External opinion on a location. Implementations may block and may throw
 * {@link com.startsmart.core.ContextualEvaluatorException}; callers bound them with a timeout.
 */
public interface ContextualEvaluator {
    ContextualAssessment assess(BusinessEnvironmentVector bev);

    String name();
}
