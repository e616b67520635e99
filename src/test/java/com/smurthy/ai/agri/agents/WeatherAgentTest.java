package com.smurthy.ai.agri.agents;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Horizon;
import com.smurthy.ai.agri.model.Outcome;
import com.smurthy.ai.agri.model.Priority;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.Recommendation;
import com.smurthy.ai.agri.model.SpecialistResult;
import com.smurthy.ai.agri.service.WeatherService;
import com.smurthy.ai.agri.service.WeatherService.HourlyForecast;
import com.smurthy.ai.agri.service.WeatherService.WeatherData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WeatherAgentTest {

    @Mock
    private WeatherService weatherService;

    private WeatherAgent weatherAgent;

    @BeforeEach
    void setUp() {
        weatherAgent = new WeatherAgent(weatherService);
    }

    private static WeatherData weather(String location, double temperature, double humidity,
                                       List<HourlyForecast> forecast) {
        return new WeatherData(location, 18.52, 73.85, temperature, temperature + 2, humidity, 0.0, 12.0,
                "Clear", "Clear sky", "2026-06-15T10:00", forecast, WeatherService.SUCCESS);
    }

    private static HourlyForecast hour(double precipitation, String condition) {
        return new HourlyForecast("2026-06-15T11:00", 30.0, 60.0, precipitation, condition);
    }

    @Test
    @DisplayName("Should use the context location and report irrigation advice")
    void testHotDryDay() {
        // Given
        when(weatherService.getWeatherByLocation("Pune"))
                .thenReturn(weather("Pune", 33.0, 40.0, List.of(hour(0.0, "Clear"), hour(0.5, "Clear"))));

        // When
        SpecialistResult result = weatherAgent.invoke(Query.of("Should I irrigate today?"),
                Map.of(Query.LOCATION, "Pune"));

        // Then
        assertThat(result.outcome()).isEqualTo(Outcome.SUCCESS);
        assertThat(result.source()).isEqualTo("Weather Agent");
        assertThat(result.payload()).containsEntry("location", "Pune")
                .containsEntry("expected_rainfall_mm", 0.5)
                .containsKeys("current_weather", "forecast", "irrigation_recommendation", "soil_moisture");
        WeatherAgent.IrrigationAdvice advice =
                (WeatherAgent.IrrigationAdvice) result.payload().get("irrigation_recommendation");
        assertThat(advice.priority()).isEqualTo("High");
        assertThat(result.recommendations()).first().satisfies(recommendation -> {
            assertThat(recommendation.horizon()).isEqualTo(Horizon.IMMEDIATE_ACTION);
            assertThat(recommendation.priority()).isEqualTo(Priority.HIGH);
        });
    }

    @Test
    @DisplayName("Should default to Mumbai when no location is known")
    void testDefaultLocation() {
        // Given
        when(weatherService.getWeatherByLocation(anyString()))
                .thenReturn(weather("Mumbai", 28.0, 70.0, List.of()));

        // When
        weatherAgent.invoke(Query.of("Weather today?"), Map.of());

        // Then
        verify(weatherService).getWeatherByLocation("Mumbai");
    }

    @Test
    @DisplayName("Heavy rain ahead should take precedence over irrigation")
    void testHeavyRain() {
        // Given - 6mm over the next hours, plus a storm
        when(weatherService.getWeatherByLocation("Nashik")).thenReturn(weather("Nashik", 36.0, 45.0,
                List.of(hour(2.5, "Rain"), hour(3.5, "Thunderstorm"))));

        // When
        SpecialistResult result = weatherAgent.invoke(Query.of("Will it rain?"), Map.of(Query.LOCATION, "Nashik"));

        // Then
        assertThat(result.payload()).containsEntry("expected_rainfall_mm", 6.0);
        assertThat(result.recommendations()).extracting(Recommendation::horizon)
                .containsExactly(Horizon.IMMEDIATE_ACTION, Horizon.RISK_MITIGATION, Horizon.RISK_MITIGATION);
        assertThat(result.recommendations().get(0).text()).contains("postpone irrigation");
    }

    @Test
    @DisplayName("An upstream error should become a FAILURE naming the location")
    void testUpstreamError() {
        // Given
        when(weatherService.getWeatherByLocation("Atlantis")).thenReturn(new WeatherData("Atlantis", 0, 0, 0, 0, 0,
                0, 0, WeatherService.ERROR, "Location not found", "N/A", List.of(), WeatherService.ERROR));

        // When
        SpecialistResult result = weatherAgent.invoke(Query.of("Rain in Atlantis?"),
                Map.of(Query.LOCATION, "Atlantis"));

        // Then
        assertThat(result.outcome()).isEqualTo(Outcome.FAILURE);
        assertThat(result.category()).isEqualTo(Category.WEATHER);
        assertThat(result.failureReason()).isEqualTo("Weather data unavailable for Atlantis: Location not found");
    }

    @Test
    @DisplayName("An exception from the weather service should become a FAILURE")
    void testServiceThrows() {
        // Given
        when(weatherService.getWeatherByLocation(anyString())).thenThrow(new IllegalStateException("socket closed"));

        // When
        SpecialistResult result = weatherAgent.invoke(Query.of("Rain?"), Map.of());

        // Then
        assertThat(result.outcome()).isEqualTo(Outcome.FAILURE);
        assertThat(result.failureReason()).contains("socket closed");
    }

    @Test
    @DisplayName("Confidence should grow with weather keywords and stay capped")
    void testConfidence() {
        // Given
        when(weatherService.getWeatherByLocation(anyString())).thenReturn(weather("Mumbai", 26.0, 70.0, List.of()));

        // When
        SpecialistResult plain = weatherAgent.invoke(Query.of("Tell me something"), Map.of());
        SpecialistResult rich = weatherAgent.invoke(Query.of(
                "weather rain temperature humidity forecast drought flood monsoon"), Map.of());

        // Then
        assertThat(plain.confidence()).isEqualTo(0.5);
        assertThat(rich.confidence()).isEqualTo(0.95);
    }

    @Test
    @DisplayName("Irrigation analysis should follow the temperature and humidity bands")
    void testAnalyzeIrrigation() {
        assertThat(WeatherAgent.analyzeIrrigation(32, 40).priority()).isEqualTo("High");
        assertThat(WeatherAgent.analyzeIrrigation(32, 40).nextIrrigation()).isEqualTo("Within 24 hours");
        assertThat(WeatherAgent.analyzeIrrigation(28, 55).priority()).isEqualTo("Medium");
        assertThat(WeatherAgent.analyzeIrrigation(28, 55).nextIrrigation()).isEqualTo("Within 48 hours");
        assertThat(WeatherAgent.analyzeIrrigation(32, 70).priority()).isEqualTo("Low");
        assertThat(WeatherAgent.analyzeIrrigation(20, 30).nextIrrigation()).isEqualTo("Within 72 hours");
    }

    @Test
    @DisplayName("Recommendation text should not depend on the default locale")
    void testRecommendationTextUnderTurkishLocale() {
        // Given
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        when(weatherService.getWeatherByLocation("Pune"))
                .thenReturn(weather("Pune", 28.0, 55.0, List.of(hour(0.0, "Clear"))));
        try {
            // When
            SpecialistResult result = weatherAgent.invoke(Query.of("Irrigation plan?"),
                    Map.of(Query.LOCATION, "Pune"));

            // Then
            assertThat(result.recommendations()).first()
                    .extracting(Recommendation::text)
                    .isEqualTo("Plan irrigation within 48 hours");
        } finally {
            Locale.setDefault(original);
        }
    }
}
