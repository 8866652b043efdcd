package com.health.insights.model;

/**
 * Ordered pair of metrics. For directional methods {@code first} is the candidate cause.
 */
public record MetricPair(String first, String second) {

    public MetricPair {
        if (first == null || second == null || first.equals(second)) {
            throw new IllegalArgumentException("A metric pair needs two distinct metrics");
        }
    }

    /** Order-independent identity of the pair. */
    public String unorderedKey() {
        return first.compareTo(second) <= 0 ? first + "|" + second : second + "|" + first;
    }

    @Override
    public String toString() {
        return first + "->" + second;
    }
}
