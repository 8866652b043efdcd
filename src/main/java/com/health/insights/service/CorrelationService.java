package com.health.insights.service;

import com.health.insights.engine.correlation.CorrelationAggregator;
import com.health.insights.model.CorrelationSummary;
import com.health.insights.model.MergedCorrelation;
import com.health.insights.repository.CorrelationResultRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class CorrelationService {

    static final int TOP_FINDINGS = 5;

    private final CorrelationResultRepository correlationRepository;
    private final CorrelationAggregator aggregator;

    public CorrelationService(CorrelationResultRepository correlationRepository,
                              CorrelationAggregator aggregator) {
        this.correlationRepository = correlationRepository;
        this.aggregator = aggregator;
    }

    /** Stored verdicts, most actionable first. */
    public List<MergedCorrelation> getCorrelations(String userId, boolean actionableOnly, int limit) {
        List<MergedCorrelation> ranked = aggregator.rank(correlationRepository.findByUser(userId, actionableOnly));
        return ranked.size() > limit ? ranked.subList(0, limit) : ranked;
    }

    public CorrelationSummary getSummary(String userId) {
        return aggregator.summarize(correlationRepository.findByUser(userId, false), TOP_FINDINGS);
    }
}
