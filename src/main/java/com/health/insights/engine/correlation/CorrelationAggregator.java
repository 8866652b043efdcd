package com.health.insights.engine.correlation;

import com.health.insights.config.DetectionConfig;
import com.health.insights.model.CausalDirection;
import com.health.insights.model.CorrelationFamily;
import com.health.insights.model.CorrelationResult;
import com.health.insights.model.CorrelationStrength;
import com.health.insights.model.CorrelationSummary;
import com.health.insights.model.CorrelationType;
import com.health.insights.model.Granularity;
import com.health.insights.model.MergedCorrelation;
import com.health.insights.model.MetricPair;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Merges the per-detector results for one metric pair into a single verdict.
 *
 * The composite confidence is a weighted mean of each result's confidence score.
 * Tested statistics carry more weight than untested ones. The lead result is the
 * most trustworthy single result: tested before untested, then lowest p-value,
 * then highest confidence.
 */
@Component
public class CorrelationAggregator {

    static final Map<CorrelationType, Double> WEIGHTS = new EnumMap<>(CorrelationType.class);

    static {
        WEIGHTS.put(CorrelationType.PEARSON, 0.30);
        WEIGHTS.put(CorrelationType.SPEARMAN, 0.25);
        WEIGHTS.put(CorrelationType.GRANGER, 0.30);
        WEIGHTS.put(CorrelationType.CROSS_CORRELATION, 0.10);
        WEIGHTS.put(CorrelationType.MUTUAL_INFORMATION, 0.05);
    }

    private static final Comparator<CorrelationResult> LEAD_ORDER = Comparator
            .comparing((CorrelationResult r) -> !r.getConfidence().supported())
            .thenComparingDouble(r -> r.getConfidence().supported() ? r.getConfidence().pValue() : 1.0)
            .thenComparing(Comparator.comparingDouble(CorrelationResult::confidenceScore).reversed())
            .thenComparing(CorrelationResult::getCorrelationType);

    private static final Comparator<MergedCorrelation> RANK_ORDER = Comparator
            .comparing(MergedCorrelation::isActionable).reversed()
            .thenComparing(Comparator.comparingInt(MergedCorrelation::getAgreement).reversed())
            .thenComparing(Comparator.comparingDouble(MergedCorrelation::getCompositeConfidence).reversed())
            .thenComparing(Comparator.comparingDouble((MergedCorrelation m) -> Math.abs(m.getStrength())).reversed())
            .thenComparing(MergedCorrelation::getMetricA)
            .thenComparing(MergedCorrelation::getMetricB)
            .thenComparing(MergedCorrelation::getGranularity);

    /**
     * Builds one verdict per granularity present in {@code results}. Daily and weekly
     * results about the same pair are never merged with each other.
     */
    public List<MergedCorrelation> aggregateByGranularity(MetricPair pair, List<CorrelationResult> results,
                                                          DetectionConfig config) {
        Map<Granularity, List<CorrelationResult>> byGranularity = new EnumMap<>(Granularity.class);
        for (CorrelationResult r : results) {
            byGranularity.computeIfAbsent(r.getGranularity(), g -> new ArrayList<>()).add(r);
        }
        List<MergedCorrelation> verdicts = new ArrayList<>();
        for (List<CorrelationResult> group : byGranularity.values()) {
            aggregate(pair, group, config).ifPresent(verdicts::add);
        }
        return verdicts;
    }

    /**
     * Builds the verdict for {@code pair} from every detector result about it, in either orientation.
     * The results are expected to share one granularity.
     *
     * @return empty when no result meets its detector's sample floor
     */
    public Optional<MergedCorrelation> aggregate(MetricPair pair, List<CorrelationResult> results, DetectionConfig config) {
        List<CorrelationResult> surviving = results.stream()
                .filter(r -> r.getSampleSize() >= minSamples(r, config))
                .toList();
        if (surviving.isEmpty()) {
            return Optional.empty();
        }

        CorrelationResult lead = surviving.stream().min(LEAD_ORDER).orElseThrow();

        double weighted = 0.0, totalWeight = 0.0;
        for (CorrelationResult r : surviving) {
            double w = WEIGHTS.get(r.getCorrelationType());
            weighted += w * r.confidenceScore();
            totalWeight += w;
        }
        double composite = totalWeight > 0 ? weighted / totalWeight : 0.0;

        List<CorrelationResult> significantSigned = surviving.stream()
                .filter(r -> r.isSignificant() && r.getCorrelationType().isSigned() && r.getStrength() != 0.0)
                .toList();
        boolean signConflict = significantSigned.stream().anyMatch(r -> r.getStrength() > 0)
                && significantSigned.stream().anyMatch(r -> r.getStrength() < 0);
        double referenceSign = referenceSign(lead, significantSigned);

        Set<CorrelationFamily> concurring = EnumSet.noneOf(CorrelationFamily.class);
        for (CorrelationResult r : surviving) {
            if (!r.isSignificant()) continue;
            if (!r.getCorrelationType().isSigned() || referenceSign == 0.0
                    || Math.signum(r.getStrength()) == referenceSign) {
                concurring.add(r.getCorrelationType().getFamily());
            }
        }

        DetectionConfig.Aggregation settings = config.getAggregation();
        int agreement = concurring.size();
        boolean actionable = lead.isSignificant()
                && !signConflict
                && agreement >= settings.getActionableMinAgreement()
                && composite >= settings.getActionableMinConfidence()
                && Math.abs(lead.getStrength()) >= settings.getActionableMinStrength();

        CorrelationStrength label = lead.getCorrelationType().isSigned()
                ? CorrelationStrength.fromValue(lead.getStrength())
                : CorrelationStrength.fromUnsigned(lead.getStrength());

        return Optional.of(MergedCorrelation.builder()
                .metricA(pair.first())
                .metricB(pair.second())
                .leadType(lead.getCorrelationType())
                .strength(lead.getStrength())
                .strengthLabel(label)
                .lagDays(lead.getLagDays())
                .causalDirection(causalDirection(pair, surviving))
                .confidence(lead.getConfidence())
                .significant(lead.isSignificant())
                .compositeConfidence(composite)
                .agreement(agreement)
                .signConflict(signConflict)
                .actionable(actionable)
                .sampleSize(surviving.stream().mapToInt(CorrelationResult::getSampleSize).max().orElse(0))
                .granularity(lead.getGranularity())
                .contributions(surviving)
                .build());
    }

    /** Orders verdicts most actionable first; ties fall back to the pair names. */
    public List<MergedCorrelation> rank(List<MergedCorrelation> verdicts) {
        List<MergedCorrelation> ranked = new ArrayList<>(verdicts);
        ranked.sort(RANK_ORDER);
        return ranked;
    }

    public CorrelationSummary summarize(List<MergedCorrelation> verdicts, int topCount) {
        List<MergedCorrelation> ranked = rank(verdicts);
        Map<CorrelationType, Integer> byType = new EnumMap<>(CorrelationType.class);
        Map<CorrelationStrength, Integer> byStrength = new EnumMap<>(CorrelationStrength.class);
        Map<Granularity, Integer> byGranularity = new EnumMap<>(Granularity.class);
        for (MergedCorrelation m : ranked) {
            byType.merge(m.getLeadType(), 1, Integer::sum);
            byStrength.merge(m.getStrengthLabel(), 1, Integer::sum);
            byGranularity.merge(m.getGranularity(), 1, Integer::sum);
        }

        List<String> top = ranked.stream()
                .limit(topCount)
                .map(CorrelationAggregator::describe)
                .toList();

        return CorrelationSummary.builder()
                .total(ranked.size())
                .significant((int) ranked.stream().filter(MergedCorrelation::isSignificant).count())
                .actionable((int) ranked.stream().filter(MergedCorrelation::isActionable).count())
                .byType(Collections.unmodifiableMap(new LinkedHashMap<>(byType)))
                .byStrength(Collections.unmodifiableMap(new LinkedHashMap<>(byStrength)))
                .byGranularity(Collections.unmodifiableMap(new LinkedHashMap<>(byGranularity)))
                .topFindings(top)
                .build();
    }

    public static int minSamples(CorrelationResult result, DetectionConfig config) {
        if (result.getGranularity() == Granularity.WEEKLY) {
            return config.getWeekly().getMinWeeks();
        }
        return minSamples(result.getCorrelationType(), config);
    }

    public static int minSamples(CorrelationType type, DetectionConfig config) {
        return switch (type) {
            case PEARSON, SPEARMAN -> config.getPearson().getMinSamples();
            case CROSS_CORRELATION -> config.getCrossCorrelation().getMinSamples();
            case GRANGER -> config.getGranger().getMinSamples();
            case MUTUAL_INFORMATION -> config.getMutualInformation().getMinSamples();
        };
    }

    static String describe(MergedCorrelation m) {
        String arrow = switch (m.getCausalDirection()) {
            case A_CAUSES_B -> " -> ";
            case B_CAUSES_A -> " <- ";
            default -> " <-> ";
        };
        String lag = m.getLagDays() != 0 ? ", lag " + m.getLagDays() + "d" : "";
        String weekly = m.getGranularity() == Granularity.WEEKLY ? ", weekly" : "";
        return m.getMetricA() + arrow + m.getMetricB() + " (" + m.getStrengthLabel() + lag + weekly + ")";
    }

    // Sign the family agreement is measured against: the lead's own sign, or the
    // strongest significant signed result when the lead is unsigned.
    private static double referenceSign(CorrelationResult lead, List<CorrelationResult> significantSigned) {
        if (lead.getCorrelationType().isSigned()) {
            return Math.signum(lead.getStrength());
        }
        return significantSigned.stream()
                .max(Comparator.comparingDouble(CorrelationResult::confidenceScore))
                .map(r -> Math.signum(r.getStrength()))
                .orElse(0.0);
    }

    private static CausalDirection causalDirection(MetricPair pair, List<CorrelationResult> results) {
        boolean forward = false, backward = false;
        for (CorrelationResult r : results) {
            if (r.getCorrelationType() != CorrelationType.GRANGER || !r.isSignificant()) continue;
            if (r.getMetricA().equals(pair.first())) forward = true;
            else backward = true;
        }
        if (forward && backward) return CausalDirection.BIDIRECTIONAL;
        if (forward) return CausalDirection.A_CAUSES_B;
        if (backward) return CausalDirection.B_CAUSES_A;
        return CausalDirection.NONE;
    }
}
