package com.health.insights.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Statistical confidence attached to a correlation. Methods without a closed-form
 * test report {@link #unsupported()} instead of a made-up p-value.
 */
@Schema(description = "p-value of the method's significance test, or unsupported when the method has none")
public record StatisticalConfidence(boolean supported, Double pValue) {

    private static final StatisticalConfidence UNSUPPORTED = new StatisticalConfidence(false, null);

    public StatisticalConfidence {
        if (supported && (pValue == null || pValue.isNaN())) {
            throw new IllegalArgumentException("A tested confidence needs a p-value");
        }
        if (!supported && pValue != null) {
            throw new IllegalArgumentException("An unsupported confidence cannot carry a p-value");
        }
    }

    public static StatisticalConfidence tested(double pValue) {
        return new StatisticalConfidence(true, Math.max(0.0, Math.min(1.0, pValue)));
    }

    public static StatisticalConfidence unsupported() {
        return UNSUPPORTED;
    }

    @JsonIgnore
    public boolean isSignificantAt(double alpha) {
        return supported && pValue < alpha;
    }
}
