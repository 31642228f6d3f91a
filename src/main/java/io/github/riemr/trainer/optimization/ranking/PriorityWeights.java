package io.github.riemr.trainer.optimization.ranking;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tunable scoring policy for {@link PriorityRanker}. Bound from {@code trainer.scheduler.ranking.*}.
 */
@Data
@ConfigurationProperties(prefix = "trainer.scheduler.ranking")
public class PriorityWeights {

    private double baseScore = 3.0;
    private double recurringClientBonus = 3.0;
    private double minScore = 1.0;
    private double maxScore = 10.0;

    private DurationBonusPolicy durationBonusPolicy = DurationBonusPolicy.PREFERENCE_GATED;

    static final Map<String, Double> DEFAULT_TRAINING_TYPE_WEIGHTS = Map.of(
            "Personal Training", 2.5,
            "Nutrition Coaching", 2.0,
            "Rehabilitation", 2.0,
            "Calisthenics", 1.5,
            "Gym Weights", 1.0,
            "Cardio", 0.8,
            "Yoga", 0.5,
            "Pilates", 0.5);
    static final Map<String, Double> DEFAULT_LOCATION_TYPE_WEIGHTS = Map.of(
            "home", 1.0,
            "gym", 0.3);

    /**
     * Looked up case-insensitively; types not listed get {@link #unknownTrainingTypeWeight}.
     * A configured table replaces the built-in one as a whole; null means the built-in table.
     */
    private Map<String, Double> trainingTypeWeights;
    private double unknownTrainingTypeWeight = 1.0;

    /** Same replacement rule as {@link #trainingTypeWeights}. */
    private Map<String, Double> locationTypeWeights;

    private double specialRequestBonus = 1.5;
    private double boilerplateSpecialRequestBonus = 0.5;
    // 自動生成された定型文は「特記事項なし」に近い扱い
    private List<String> boilerplateMarkers = new ArrayList<>(List.of("Booked via optimal scheduling algorithm"));

    public double trainingTypeWeight(String trainingType) {
        if (trainingType == null || trainingType.isBlank()) return 0.0;
        Map<String, Double> table = trainingTypeWeights != null ? trainingTypeWeights : DEFAULT_TRAINING_TYPE_WEIGHTS;
        return lookup(table, trainingType).orElse(unknownTrainingTypeWeight);
    }

    public double locationTypeWeight(String locationType) {
        if (locationType == null || locationType.isBlank()) return 0.0;
        Map<String, Double> table = locationTypeWeights != null ? locationTypeWeights : DEFAULT_LOCATION_TYPE_WEIGHTS;
        return lookup(table, locationType).orElse(0.0);
    }

    private static Optional<Double> lookup(Map<String, Double> table, String key) {
        String k = key.trim();
        for (var e : table.entrySet()) {
            if (e.getKey().equalsIgnoreCase(k)) return Optional.ofNullable(e.getValue());
        }
        return Optional.empty();
    }
}
