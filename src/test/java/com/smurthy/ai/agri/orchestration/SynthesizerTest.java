package com.smurthy.ai.agri.orchestration;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Horizon;
import com.smurthy.ai.agri.model.Outcome;
import com.smurthy.ai.agri.model.PartialFailure;
import com.smurthy.ai.agri.model.Priority;
import com.smurthy.ai.agri.model.Recommendation;
import com.smurthy.ai.agri.model.SpecialistResult;
import com.smurthy.ai.agri.model.SynthesizedResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SynthesizerTest {

    private Synthesizer synthesizer;

    @BeforeEach
    void setUp() {
        synthesizer = new Synthesizer();
    }

    private static SpecialistResult success(Category category, String source, double confidence,
                                            Recommendation... recommendations) {
        return SpecialistResult.success(category, source, Map.of("from", source), confidence,
                List.of(recommendations));
    }

    @Test
    @DisplayName("A single success should be returned as the unified payload")
    void testSingleSuccessIsUnified() {
        // Given
        SpecialistResult weather = SpecialistResult.success(Category.WEATHER, "Weather Agent",
                Map.of("location", "Pune", "expected_rainfall_mm", 12.5), 0.8, List.of());

        // When
        SynthesizedResponse response = synthesizer.synthesize(List.of(weather));

        // Then
        assertThat(response.success()).isTrue();
        assertThat(response.data()).containsOnlyKeys("location", "expected_rainfall_mm");
        assertThat(response.confidence()).isEqualTo(0.8);
        assertThat(response.source()).isEqualTo("Weather Agent");
        assertThat(response.failures()).isEmpty();
        assertThat(response.isPartial()).isFalse();
    }

    @Test
    @DisplayName("Confidence should be the unweighted mean of successes (0.8, 0.6 -> 0.7)")
    void testMeanConfidence() {
        // When
        SynthesizedResponse response = synthesizer.synthesize(List.of(
                success(Category.WEATHER, "Weather Agent", 0.8),
                success(Category.CROP, "Crop Agent", 0.6)));

        // Then
        assertThat(response.confidence()).isCloseTo(0.7, within(1e-9));
        assertThat(response.data()).containsOnlyKeys("weather", "crop");
        assertThat(response.sources()).containsExactly("Weather Agent", "Crop Agent");
        assertThat(response.source()).isEqualTo("Weather Agent, Crop Agent");
    }

    @Test
    @DisplayName("A second success in the same category should be keyed by its source")
    void testDuplicateCategoryKey() {
        // When
        Map<String, Object> merged = Synthesizer.mergePayloads(List.of(
                success(Category.WEATHER, "Weather Agent", 0.8),
                success(Category.WEATHER, "Satellite Agent", 0.7),
                success(Category.FINANCE, "Finance Agent", 0.7)));

        // Then
        assertThat(merged).containsOnlyKeys("weather", "weather.Satellite Agent", "finance");
        assertThat(merged.get("weather.Satellite Agent")).isEqualTo(Map.of("from", "Satellite Agent"));
    }

    @Test
    @DisplayName("Failures should be reported even when the answer succeeds")
    void testPartialFailure() {
        // When
        SynthesizedResponse response = synthesizer.synthesize(List.of(
                success(Category.WEATHER, "Weather Agent", 0.9),
                SpecialistResult.timeout(Category.CROP, "Crop Agent", Duration.ofSeconds(5))));

        // Then
        assertThat(response.success()).isTrue();
        assertThat(response.isPartial()).isTrue();
        assertThat(response.confidence()).isEqualTo(0.9);
        assertThat(response.data()).containsOnlyKeys("from");
        assertThat(response.failures()).containsExactly(new PartialFailure(Category.CROP, "Crop Agent",
                Outcome.TIMEOUT, "No response within 5000ms"));
    }

    @Test
    @DisplayName("All failures should yield success=false and confidence 0 with every failure listed")
    void testTotalFailure() {
        // When
        SynthesizedResponse response = synthesizer.synthesize(List.of(
                SpecialistResult.failure(Category.WEATHER, "Weather Agent", "upstream down", Duration.ZERO),
                SpecialistResult.timeout(Category.CROP, "Crop Agent", Duration.ofSeconds(5)),
                SpecialistResult.failure(Category.FINANCE, "Finance Agent", "boom", Duration.ZERO)));

        // Then
        assertThat(response.success()).isFalse();
        assertThat(response.confidence()).isZero();
        assertThat(response.data()).isEmpty();
        assertThat(response.sources()).isEmpty();
        assertThat(response.failures()).extracting(PartialFailure::category)
                .containsExactly(Category.WEATHER, Category.CROP, Category.FINANCE);
    }

    @Test
    @DisplayName("An empty result list should be a total failure")
    void testNoResults() {
        SynthesizedResponse response = synthesizer.synthesize(List.of());

        assertThat(response.success()).isFalse();
        assertThat(response.confidence()).isZero();
    }

    @Test
    @DisplayName("Recommendations should be grouped by horizon and ordered HIGH to LOW, stable on ties")
    void testRecommendationRanking() {
        // Given
        Recommendation weatherLow = Recommendation.of(Category.WEATHER, Horizon.SHORT_TERM_PLAN, Priority.LOW, "w-low");
        Recommendation weatherHigh = Recommendation.of(Category.WEATHER, Horizon.SHORT_TERM_PLAN, Priority.HIGH, "w-high");
        Recommendation cropHigh = Recommendation.of(Category.CROP, Horizon.SHORT_TERM_PLAN, Priority.HIGH, "c-high");
        Recommendation cropRisk = Recommendation.of(Category.CROP, Horizon.RISK_MITIGATION, Priority.MEDIUM, "c-risk");
        Recommendation failedAdvice = Recommendation.of(Category.FINANCE, Horizon.OPPORTUNITY, Priority.HIGH, "ignored");

        List<SpecialistResult> results = List.of(
                success(Category.WEATHER, "Weather Agent", 0.8, weatherLow, weatherHigh),
                success(Category.CROP, "Crop Agent", 0.6, cropRisk, cropHigh),
                new SpecialistResult(Category.FINANCE, "Finance Agent", Map.of(), 0.0, Outcome.FAILURE, "down",
                        Duration.ZERO, List.of(failedAdvice)));

        // When
        Map<Horizon, List<Recommendation>> ranked = synthesizer.synthesize(results).recommendations();

        // Then
        assertThat(ranked).containsOnlyKeys(Horizon.SHORT_TERM_PLAN, Horizon.RISK_MITIGATION);
        assertThat(ranked.get(Horizon.SHORT_TERM_PLAN)).extracting(Recommendation::text)
                .containsExactly("w-high", "c-high", "w-low");
        assertThat(ranked.get(Horizon.RISK_MITIGATION)).containsExactly(cropRisk);
    }
}
