package com.smurthy.ai.agri.agents;

import com.smurthy.ai.agri.model.Category;
import com.smurthy.ai.agri.model.Horizon;
import com.smurthy.ai.agri.model.Priority;
import com.smurthy.ai.agri.model.Query;
import com.smurthy.ai.agri.model.Recommendation;
import com.smurthy.ai.agri.model.SpecialistResult;
import com.smurthy.ai.agri.service.WeatherService;
import com.smurthy.ai.agri.service.WeatherService.HourlyForecast;
import com.smurthy.ai.agri.service.WeatherService.WeatherData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Specialized Agent for Weather Queries
 *
 * Fetches current conditions and the next hours of forecast for the farm location and turns
 * them into irrigation advice and weather risk warnings.
 */
@Component
public class WeatherAgent implements Specialist {

    private static final Logger log = LoggerFactory.getLogger(WeatherAgent.class);

    static final String NAME = "Weather Agent";
    static final String DEFAULT_LOCATION = "Mumbai";

    private static final double HEAVY_RAIN_MM = 5.0;
    private static final double HEAT_STRESS_CELSIUS = 35.0;

    private static final SpecialistProfile PROFILE = new SpecialistProfile(
            "Agricultural weather specialist: current conditions, forecasts and irrigation planning",
            List.of("Current weather by location", "24 hour forecast", "Irrigation recommendations",
                    "Soil moisture outlook", "Weather risk alerts"),
            List.of("weather", "rain", "temperature", "irrigation", "humidity", "forecast", "monsoon",
                    "मौसम", "बारिश", "सिंचाई"));

    private final WeatherService weatherService;

    @Autowired(required = false)
    private AdvisoryNarrator narrator;

    public WeatherAgent(WeatherService weatherService) {
        this.weatherService = weatherService;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Category category() {
        return Category.WEATHER;
    }

    @Override
    public SpecialistProfile profile() {
        return PROFILE;
    }

    @Override
    public SpecialistResult invoke(Query query, Map<String, Object> context) {
        log.debug("[WeatherAgent] Processing: {}", query.text());
        long startTime = System.currentTimeMillis();

        try {
            String location = ContextValues.text(context, Query.LOCATION, DEFAULT_LOCATION);
            WeatherData weather = weatherService.getWeatherByLocation(location);

            if (!weather.isSuccess()) {
                long elapsed = System.currentTimeMillis() - startTime;
                log.warn("[WeatherAgent] No weather for {}: {}", location, weather.description());
                return SpecialistResult.failure(Category.WEATHER, NAME,
                        "Weather data unavailable for " + location + ": " + weather.description(),
                        Duration.ofMillis(elapsed));
            }

            IrrigationAdvice irrigation = analyzeIrrigation(weather.temperature(), weather.humidity());
            double expectedRain = expectedRainfall(weather.forecast());

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("location", location);
            data.put("current_weather", currentWeather(weather));
            data.put("forecast", weather.forecast());
            data.put("expected_rainfall_mm", expectedRain);
            data.put("irrigation_recommendation", irrigation);
            data.put("soil_moisture", soilMoisture(weather.humidity(), expectedRain));

            if (narrator != null) {
                narrator.narrate(Category.WEATHER, Relevance.languageOf(query), query.text(), data)
                        .ifPresent(text -> data.put("advisory", text));
            }

            long elapsed = System.currentTimeMillis() - startTime;
            log.info("[WeatherAgent] Completed in {}ms", elapsed);

            return SpecialistResult.success(Category.WEATHER, NAME, data,
                    Relevance.confidence(Category.WEATHER, query),
                    recommendations(weather, irrigation, expectedRain));

        } catch (Exception e) {
            long elapsed = System.currentTimeMillis() - startTime;
            log.error("[WeatherAgent] Error processing query", e);
            return SpecialistResult.failure(Category.WEATHER, NAME,
                    "Failed to analyze weather: " + e.getMessage(), Duration.ofMillis(elapsed));
        }
    }

    /**
     * Irrigation need from temperature (°C) and relative humidity (%).
     */
    static IrrigationAdvice analyzeIrrigation(double temperature, double humidity) {
        String recommendation;
        String priority;
        if (temperature > 30 && humidity < 50) {
            recommendation = "High irrigation needed - high temperature and low humidity";
            priority = "High";
        } else if (temperature > 25 && humidity < 60) {
            recommendation = "Moderate irrigation recommended";
            priority = "Medium";
        } else {
            recommendation = "Low irrigation needed - favorable conditions";
            priority = "Low";
        }

        String nextIrrigation;
        if (temperature > 30) {
            nextIrrigation = "Within 24 hours";
        } else if (temperature > 25) {
            nextIrrigation = "Within 48 hours";
        } else {
            nextIrrigation = "Within 72 hours";
        }

        return new IrrigationAdvice(recommendation, priority,
                "Temperature: " + temperature + "°C, Humidity: " + humidity + "%", nextIrrigation);
    }

    static double expectedRainfall(List<HourlyForecast> forecast) {
        double total = 0.0;
        for (HourlyForecast hour : forecast) {
            total += hour.precipitation();
        }
        return Math.round(total * 10.0) / 10.0;
    }

    private static Map<String, Object> currentWeather(WeatherData weather) {
        Map<String, Object> current = new LinkedHashMap<>();
        current.put("temperature", weather.temperature());
        current.put("feels_like", weather.feelsLike());
        current.put("humidity", weather.humidity());
        current.put("precipitation", weather.precipitation());
        current.put("wind_speed", weather.windSpeed());
        current.put("condition", weather.condition());
        current.put("description", weather.description());
        current.put("time", weather.time());
        return current;
    }

    private static Map<String, Object> soilMoisture(double humidity, double expectedRain) {
        String level = expectedRain > HEAVY_RAIN_MM || humidity >= 80 ? "High"
                : humidity >= 50 ? "Moderate" : "Low";
        return Map.of(
                "soil_moisture", level,
                "recommendation", "Low".equals(level) ? "Check soil moisture before sowing" : "Monitor soil moisture levels",
                "next_check", "24 hours");
    }

    private static List<Recommendation> recommendations(WeatherData weather, IrrigationAdvice irrigation,
                                                        double expectedRain) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (expectedRain > HEAVY_RAIN_MM) {
            recommendations.add(Recommendation.of(Category.WEATHER, Horizon.IMMEDIATE_ACTION, Priority.HIGH,
                    "Rain of about " + expectedRain + " mm expected in the next hours: postpone irrigation and "
                            + "fertilizer application"));
        } else {
            switch (irrigation.priority()) {
                case "High" -> recommendations.add(Recommendation.of(Category.WEATHER, Horizon.IMMEDIATE_ACTION,
                        Priority.HIGH, "Irrigate " + irrigation.nextIrrigation().toLowerCase(Locale.ROOT) + ": "
                                + irrigation.recommendation()));
                case "Medium" -> recommendations.add(Recommendation.of(Category.WEATHER, Horizon.SHORT_TERM_PLAN,
                        Priority.MEDIUM, "Plan irrigation " + irrigation.nextIrrigation().toLowerCase(Locale.ROOT)));
                default -> recommendations.add(Recommendation.of(Category.WEATHER, Horizon.SHORT_TERM_PLAN,
                        Priority.LOW, "No urgent irrigation needed, next irrigation "
                                + irrigation.nextIrrigation().toLowerCase(Locale.ROOT)));
            }
        }

        if (weather.temperature() > HEAT_STRESS_CELSIUS) {
            recommendations.add(Recommendation.of(Category.WEATHER, Horizon.RISK_MITIGATION, Priority.HIGH,
                    "Heat stress risk: irrigate in the early morning or evening and mulch to retain moisture"));
        }

        boolean stormAhead = weather.forecast().stream()
                .anyMatch(hour -> hour.condition().startsWith("Thunderstorm"));
        if (stormAhead) {
            recommendations.add(Recommendation.of(Category.WEATHER, Horizon.RISK_MITIGATION, Priority.HIGH,
                    "Thunderstorm forecast: secure harvested produce and delay spraying"));
        }

        return recommendations;
    }

    public record IrrigationAdvice(String recommendation, String priority, String reasoning,
                                   String nextIrrigation) {}
}
