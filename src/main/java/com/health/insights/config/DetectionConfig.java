package com.health.insights.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "detection")
public class DetectionConfig {

    // Trailing window used when a request does not specify one.
    private int defaultWindowDays = 60;

    // Upper bound on anomalies returned by one run (after ranking).
    private int maxAnomalies = 50;

    private Baseline baseline = new Baseline();
    private ZScore zScore = new ZScore();
    private IsolationForest isolationForest = new IsolationForest();
    private Correlation correlation = new Correlation();
    private Pearson pearson = new Pearson();
    private CrossCorrelation crossCorrelation = new CrossCorrelation();
    private Granger granger = new Granger();
    private MutualInformation mutualInformation = new MutualInformation();
    private Aggregation aggregation = new Aggregation();
    private Weekly weekly = new Weekly();
    private Derived derived = new Derived();
    private Population population = new Population();
    private Workers workers = new Workers();
    private Jobs jobs = new Jobs();

    @Data
    public static class Baseline {
        // Below this many finite observations no baseline is estimated.
        private int minSamples = 7;
        private double ewmaHalfLifeDays = 7.0;
        // CV at which the adaptive factor is exactly 1.
        private double adaptiveReferenceCv = 0.15;
        private double adaptiveMinFactor = 0.75;
        private double adaptiveMaxFactor = 1.5;
    }

    @Data
    public static class ZScore {
        private double defaultThreshold = 2.5;
        private Map<String, Double> thresholds = new LinkedHashMap<>(Map.of(
                "sleep_hours", 2.5,
                "sleep_quality", 2.5,
                "total_calories", 3.0,
                "resting_hr", 2.5,
                "hrv", 2.5,
                "bp_systolic", 2.5,
                "bp_diastolic", 2.5,
                "blood_glucose_fasting", 2.5,
                "weight_kg", 2.0));
        // Absolute bounds outside of which a value is flagged regardless of the personal baseline.
        private Map<String, Bounds> bounds = new LinkedHashMap<>(Map.of(
                "blood_glucose_fasting", new Bounds(70.0, 140.0),
                "resting_hr", new Bounds(40.0, 100.0),
                "bp_systolic", new Bounds(90.0, 140.0),
                "bp_diastolic", new Bounds(60.0, 90.0),
                "spo2", new Bounds(94.0, 100.0)));
        // z at which the score reaches 0.5.
        private double saturationK = 3.0;
        private double minSpread = 1e-6;
        private double relativeSpreadFloor = 0.01;
        private double boundsViolationMinScore = 0.7;

        public double thresholdFor(String metric) {
            return thresholds.getOrDefault(metric, defaultThreshold);
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Bounds {
        private Double min;
        private Double max;

        public boolean violatedBy(double value) {
            return (min != null && value < min) || (max != null && value > max);
        }
    }

    @Data
    public static class IsolationForest {
        private int numTrees = 100;
        private int sampleSize = 256;
        private long seed = 42L;
        private double scoreThreshold = 0.6;
        private int rollingWindowDays = 7;
        private int minSamples = 10;
    }

    @Data
    public static class Correlation {
        private double significanceLevel = 0.05;
        // Explicit pairs replace the influencer x outcome cross product.
        private List<PairSetting> pairs = new ArrayList<>();
        private List<String> influencers = new ArrayList<>(List.of(
                "exercise_minutes", "exercise_calories", "exercise_intensity_avg",
                "total_calories", "total_protein_g", "total_carbs_g", "total_sugar_g", "total_fats_g",
                "sleep_hours", "sleep_quality",
                "protein_ratio", "exercise_minutes_7d_avg", "total_calories_7d_avg"));
        private List<String> outcomes = new ArrayList<>(List.of(
                "sleep_hours", "sleep_quality", "awakenings",
                "resting_hr", "hrv", "bp_systolic", "bp_diastolic",
                "blood_glucose_fasting", "blood_glucose_post_meal",
                "weight_kg", "body_fat_pct",
                "weight_change_7d", "bp_mean", "resting_hr_deviation"));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PairSetting {
        private String first;
        private String second;
    }

    @Data
    public static class Pearson {
        private int minSamples = 14;
    }

    @Data
    public static class CrossCorrelation {
        private int maxLag = 14;
        private int minSamples = 14;
        // Best-lag |r| below this is not reported.
        private double minCorrelation = 0.25;
        // Without correction the best-of-many-lags p-value is not reported.
        private boolean bonferroniCorrection = true;
    }

    @Data
    public static class Granger {
        private int maxLag = 3;
        private int minSamples = 20;
        private boolean difference = false;
        private boolean bothDirections = true;
    }

    @Data
    public static class MutualInformation {
        private int neighbors = 3;
        private int minSamples = 20;
        // Information coefficients below this are not reported.
        private double minCoefficient = 0.3;
        private long jitterSeed = 7L;
    }

    @Data
    public static class Aggregation {
        private int actionableMinAgreement = 2;
        private double actionableMinConfidence = 0.4;
        private double actionableMinStrength = 0.3;
    }

    @Data
    public static class Weekly {
        private boolean enabled = true;
        private int minWeeks = 4;
        // Weeks with fewer observed days are left out of the resample.
        private int minDaysPerWeek = 4;
    }

    @Data
    public static class Derived {
        private boolean enabled = true;
        private int rollingWindowDays = 7;
        private List<String> rollingMetrics = new ArrayList<>(List.of(
                "sleep_hours", "total_calories", "resting_hr", "exercise_minutes"));
        // Derived series the anomaly detectors also run on. Rolling averages and deviations feed correlations only.
        private List<String> anomalyMetrics = new ArrayList<>(List.of(
                "protein_ratio", "weight_change_7d", "bp_mean"));
    }

    @Data
    public static class Population {
        private int minUsers = 10;
        private double stdFloor = 0.1;
        private double unusualDistance = 1.5;
    }

    @Data
    public static class Workers {
        private int detectorPoolSize = 4;
        private int jobPoolSize = 2;
        private int queueCapacity = 500;
    }

    @Data
    public static class Jobs {
        private int retentionHours = 24;
        private int cleanupIntervalMinutes = 30;
    }
}
