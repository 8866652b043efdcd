package com.health.insights.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI healthInsightsOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Health Insights Detection API")
                        .version("1.0.0")
                        .description(
                                "Personal-baseline anomaly detection and metric correlation discovery over daily health data.\n\n" +
                                "**Detection Pipeline:**\n" +
                                "1. Start a run via `POST /users/{userId}/detections` (background job) or `POST /users/{userId}/anomalies/detect`\n" +
                                "2. Load the user's daily metric series for the window (gaps stay gaps)\n" +
                                "3. Estimate a personal baseline per metric: **ROBUST**, **ADAPTIVE** or **EWMA**\n" +
                                "4. Run anomaly detectors per metric and correlation detectors per metric pair in parallel\n" +
                                "5. Score severity: **HIGH** (>=0.8), **MEDIUM** (>=0.5), **LOW**\n" +
                                "6. Merge correlation evidence into one confidence-weighted verdict per pair\n\n" +
                                "**Anomaly Detectors:**\n" +
                                "- `ZSCORE` - deviation from the personal baseline plus absolute medical bounds\n" +
                                "- `ISOLATION_FOREST` - isolation depth over value, rolling mean, rolling spread and daily change\n" +
                                "- `ENSEMBLE` - emitted when both detectors agree on a day\n\n" +
                                "**Correlation Methods:** `PEARSON`, `SPEARMAN`, `CROSS_CORRELATION`, `GRANGER`, `MUTUAL_INFORMATION`")
                        .contact(new Contact().name("Health Insights Team")));
    }
}
