package com.smurthy.ai.agri.service;

import com.smurthy.ai.agri.config.WeatherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Weather lookups for Indian farm locations using Open-Meteo.
 *
 * - Nominatim (OpenStreetMap) turns a place name into coordinates, restricted to the
 *   configured country
 * - Open-Meteo returns current conditions plus an hourly forecast in metric units
 *
 * Neither API needs a key. Failures are reported through {@link WeatherData#status()} rather
 * than thrown, so callers can decide how to degrade.
 */
@Service
public class WeatherService {

    private static final Logger log = LoggerFactory.getLogger(WeatherService.class);

    public static final String SUCCESS = "SUCCESS";
    public static final String ERROR = "ERROR";

    private static final String CURRENT_FIELDS =
            "temperature_2m,relative_humidity_2m,apparent_temperature,precipitation,weather_code,wind_speed_10m";
    private static final String HOURLY_FIELDS =
            "temperature_2m,relative_humidity_2m,precipitation,weather_code";

    private final RestClient restClient;
    private final WeatherConfig config;
    private final RetryTemplate retryTemplate;

    public WeatherService(RestClient.Builder restClientBuilder,
                          WeatherConfig config,
                          @Qualifier("upstreamRetryTemplate") RetryTemplate retryTemplate) {
        this.restClient = restClientBuilder.build();
        this.config = config;
        this.retryTemplate = retryTemplate;
    }

    /**
     * Current weather and short-range forecast for a place name such as "Pune" or "Ludhiana".
     */
    public WeatherData getWeatherByLocation(String location) {
        try {
            log.info("[WeatherService] Fetching weather for location: {}", location);

            GeoLocation geoLocation = geocodeLocation(location);
            if (geoLocation == null) {
                return createErrorWeather(location, "Location not found");
            }

            return getWeatherByCoordinates(geoLocation, location);

        } catch (RestClientException e) {
            log.error("[WeatherService] Error fetching weather for {}: {}", location, e.getMessage());
            return createErrorWeather(location, "Weather service error: " + e.getMessage());
        }
    }

    @SuppressWarnings("unchecked")
    private WeatherData getWeatherByCoordinates(GeoLocation geo, String locationName) {
        log.debug("[WeatherService] Calling Open-Meteo: lat={}, lon={}", geo.lat(), geo.lon());

        Map<String, Object> response = retryTemplate.execute(context -> restClient.get()
                .uri(config.forecastUrl()
                                + "?latitude={lat}&longitude={lon}&current={current}&hourly={hourly}"
                                + "&forecast_hours={hours}&timezone=auto",
                        geo.lat(), geo.lon(), CURRENT_FIELDS, HOURLY_FIELDS, config.forecastHours())
                .retrieve()
                .body(new ParameterizedTypeReference<Map<String, Object>>() {}));

        if (response == null || !(response.get("current") instanceof Map)) {
            return createErrorWeather(locationName, "No weather data available");
        }

        Map<String, Object> current = (Map<String, Object>) response.get("current");
        int weatherCode = getInt(current, "weather_code");
        double temperature = getDouble(current, "temperature_2m");

        log.info("[WeatherService] Weather retrieved: {} - {}, {}°C",
                locationName, getWeatherCondition(weatherCode), temperature);

        return new WeatherData(
                locationName,
                geo.lat(),
                geo.lon(),
                temperature,
                getDouble(current, "apparent_temperature"),
                getDouble(current, "relative_humidity_2m"),
                getDouble(current, "precipitation"),
                getDouble(current, "wind_speed_10m"),
                getWeatherCondition(weatherCode),
                getWeatherDescription(weatherCode),
                getString(current, "time"),
                readForecast(response.get("hourly")),
                SUCCESS
        );
    }

    private GeoLocation geocodeLocation(String location) {
        log.debug("[WeatherService] Geocoding location: {}", location);

        List<Map<String, Object>> results = retryTemplate.execute(context -> restClient.get()
                .uri(config.geocodingUrl() + "?q={q}&format=json&limit=1&countrycodes={cc}",
                        location, config.countryCode())
                .header("User-Agent", config.userAgent()) // Nominatim requires User-Agent
                .retrieve()
                .body(new ParameterizedTypeReference<List<Map<String, Object>>>() {}));

        if (results == null || results.isEmpty()) {
            log.warn("[WeatherService] Location not found: {}", location);
            return null;
        }

        Map<String, Object> first = results.get(0);
        try {
            double lat = Double.parseDouble(String.valueOf(first.get("lat")));
            double lon = Double.parseDouble(String.valueOf(first.get("lon")));
            return new GeoLocation(lat, lon, getString(first, "display_name"));
        } catch (NumberFormatException e) {
            log.warn("[WeatherService] Unparseable coordinates for {}: {}", location, e.getMessage());
            return null;
        }
    }

    @SuppressWarnings("unchecked")
    private List<HourlyForecast> readForecast(Object hourlyNode) {
        if (!(hourlyNode instanceof Map)) {
            return List.of();
        }
        Map<String, Object> hourly = (Map<String, Object>) hourlyNode;
        List<Object> times = listOf(hourly.get("time"));
        List<Object> temperatures = listOf(hourly.get("temperature_2m"));
        List<Object> humidities = listOf(hourly.get("relative_humidity_2m"));
        List<Object> precipitation = listOf(hourly.get("precipitation"));
        List<Object> codes = listOf(hourly.get("weather_code"));

        int hours = Math.min(times.size(), config.forecastHours());
        List<HourlyForecast> forecast = new ArrayList<>(hours);
        for (int i = 0; i < hours; i++) {
            int code = (int) numberAt(codes, i);
            forecast.add(new HourlyForecast(
                    String.valueOf(times.get(i)),
                    numberAt(temperatures, i),
                    numberAt(humidities, i),
                    numberAt(precipitation, i),
                    getWeatherCondition(code)));
        }
        return forecast;
    }

    /**
     * Convert WMO weather code to human-readable condition
     * WMO codes: https://open-meteo.com/en/docs
     */
    static String getWeatherCondition(int code) {
        return switch (code) {
            case 0 -> "Clear";
            case 1, 2, 3 -> "Partly Cloudy";
            case 45, 48 -> "Foggy";
            case 51, 53, 55 -> "Drizzle";
            case 61, 63, 65 -> "Rain";
            case 80, 81, 82 -> "Rain Showers";
            case 95 -> "Thunderstorm";
            case 96, 99 -> "Thunderstorm with Hail";
            default -> "Unknown";
        };
    }

    private static String getWeatherDescription(int code) {
        return switch (code) {
            case 0 -> "Clear sky";
            case 1 -> "Mainly clear";
            case 2 -> "Partly cloudy";
            case 3 -> "Overcast";
            case 45 -> "Fog";
            case 48 -> "Depositing rime fog";
            case 51 -> "Light drizzle";
            case 53 -> "Moderate drizzle";
            case 55 -> "Dense drizzle";
            case 61 -> "Slight rain";
            case 63 -> "Moderate rain";
            case 65 -> "Heavy rain";
            case 80 -> "Slight rain showers";
            case 81 -> "Moderate rain showers";
            case 82 -> "Violent rain showers";
            case 95 -> "Thunderstorm";
            case 96 -> "Thunderstorm with slight hail";
            case 99 -> "Thunderstorm with heavy hail";
            default -> "Weather condition unknown";
        };
    }

    // Helper methods
    private static double getDouble(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return 0.0;
    }

    private static int getInt(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return 0;
    }

    private static String getString(Map<String, Object> map, String key) {
        Object value = map.get(key);
        return value != null ? value.toString() : "N/A";
    }

    @SuppressWarnings("unchecked")
    private static List<Object> listOf(Object value) {
        return value instanceof List ? (List<Object>) value : List.of();
    }

    private static double numberAt(List<Object> values, int index) {
        if (index < values.size() && values.get(index) instanceof Number) {
            return ((Number) values.get(index)).doubleValue();
        }
        return 0.0;
    }

    private static WeatherData createErrorWeather(String location, String error) {
        return new WeatherData(location, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
                ERROR, error, "N/A", List.of(), ERROR);
    }

    // Response records
    public record WeatherData(
            String location,
            double latitude,
            double longitude,
            double temperature,
            double feelsLike,
            double humidity,
            double precipitation,
            double windSpeed,
            String condition,
            String description,
            String time,
            List<HourlyForecast> forecast,
            String status
    ) {
        public boolean isSuccess() {
            return SUCCESS.equals(status);
        }
    }

    public record HourlyForecast(String time, double temperature, double humidity, double precipitation,
                                 String condition) {}

    record GeoLocation(double lat, double lon, String displayName) {}
}
