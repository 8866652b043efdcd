package com.health.insights.engine.correlation;

/**
 * Two equally long value arrays paired by date.
 */
public record AlignedPair(double[] a, double[] b) {

    public int size() {
        return a.length;
    }
}
