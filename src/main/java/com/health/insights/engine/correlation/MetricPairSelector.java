package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.model.MetricPair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chooses which metric pairs to test. Configured pairs win; otherwise every
 * influencer is paired with every outcome. Each unordered pair appears once, in name order.
 */
@Component
public class MetricPairSelector {

    public List<MetricPair> select(Set<String> availableMetrics, DetectionConfig config) {
        DetectionConfig.Correlation settings = config.getCorrelation();
        List<MetricPair> candidates = new ArrayList<>();

        if (!settings.getPairs().isEmpty()) {
            for (DetectionConfig.PairSetting pair : settings.getPairs()) {
                addIfAvailable(candidates, availableMetrics, pair.getFirst(), pair.getSecond());
            }
        } else {
            for (String influencer : settings.getInfluencers()) {
                for (String outcome : settings.getOutcomes()) {
                    addIfAvailable(candidates, availableMetrics, influencer, outcome);
                }
            }
        }

        candidates.sort(Comparator.comparing(MetricPair::first).thenComparing(MetricPair::second));
        Map<String, MetricPair> unique = new LinkedHashMap<>();
        for (MetricPair pair : candidates) {
            unique.putIfAbsent(pair.unorderedKey(), pair);
        }
        return new ArrayList<>(unique.values());
    }

    private static void addIfAvailable(List<MetricPair> pairs, Set<String> available, String first, String second) {
        if (first != null && second != null && !first.equals(second)
                && available.contains(first) && available.contains(second)) {
            pairs.add(new MetricPair(first, second));
        }
    }
}
