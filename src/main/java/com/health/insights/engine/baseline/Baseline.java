package com.health.insights.engine.baseline;

import com.health.insights.model.BaselineStrategy;
import lombok.Value;

/**
 * A metric's personal baseline: a center and a standard-deviation comparable spread.
 */
@Value
public class Baseline {
    double center;
    double spread;
    BaselineStrategy strategy;
    int sampleSize;
}
