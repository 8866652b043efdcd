package com.health.insights.controller;

import com.health.insights.model.CorrelationStrength;
import com.health.insights.model.CorrelationSummary;
import com.health.insights.model.CorrelationType;
import com.health.insights.service.CorrelationService;
import com.health.insights.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CorrelationController.class)
class CorrelationControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CorrelationService correlationService;

    @Test
    void getCorrelations_actionableOnly() throws Exception {
        when(correlationService.getCorrelations("user-1", true, 5))
                .thenReturn(List.of(TestDataFactory.merged("exercise_minutes", "sleep_quality", true, 3, 0.72)));

        mockMvc.perform(get("/api/v1/users/user-1/correlations?actionableOnly=true&limit=5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].metricA").value("exercise_minutes"))
                .andExpect(jsonPath("$[0].actionable").value(true))
                .andExpect(jsonPath("$[0].agreement").value(3))
                .andExpect(jsonPath("$[0].confidence.supported").value(true))
                .andExpect(jsonPath("$[0].confidence.pValue").value(0.001));
    }

    @Test
    void getCorrelations_defaults() throws Exception {
        when(correlationService.getCorrelations("user-1", false, 20)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/users/user-1/correlations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void getSummary_success() throws Exception {
        CorrelationSummary summary = CorrelationSummary.builder()
                .total(4)
                .significant(3)
                .actionable(1)
                .byType(Map.of(CorrelationType.GRANGER, 2, CorrelationType.PEARSON, 2))
                .byStrength(Map.of(CorrelationStrength.MODERATE_POSITIVE, 4))
                .topFindings(List.of("exercise_minutes -> sleep_quality (MODERATE_POSITIVE, lag 1d)"))
                .build();
        when(correlationService.getSummary("user-1")).thenReturn(summary);

        mockMvc.perform(get("/api/v1/users/user-1/correlations/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.actionable").value(1))
                .andExpect(jsonPath("$.byType.GRANGER").value(2))
                .andExpect(jsonPath("$.topFindings[0]").value("exercise_minutes -> sleep_quality (MODERATE_POSITIVE, lag 1d)"));
    }
}
