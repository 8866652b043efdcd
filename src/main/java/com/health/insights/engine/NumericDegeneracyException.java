package com.health.insights.engine;

/**
 * Zero variance, singular regression or a similar condition under which a
 * statistic is undefined.
 */
public class NumericDegeneracyException extends InsufficientDataException {

    public NumericDegeneracyException(String message) {
        super(message);
    }
}
