package com.smurthy.ai.agri.service;

import com.smurthy.ai.agri.config.RetryConfig;
import com.smurthy.ai.agri.config.WeatherConfig;
import com.smurthy.ai.agri.service.WeatherService.HourlyForecast;
import com.smurthy.ai.agri.service.WeatherService.WeatherData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

/**
 * Unit tests for WeatherService against a mocked Nominatim / Open-Meteo.
 */
class WeatherServiceTest {

    private static final String GEOCODING_URL = "https://nominatim.test/search";
    private static final String FORECAST_URL = "https://meteo.test/v1/forecast";

    private static final String PUNE = """
            [{"lat": "18.5204", "lon": "73.8567", "display_name": "Pune, Maharashtra, India"}]
            """;

    private static final String FORECAST = """
            {
              "current": {
                "time": "2026-06-15T10:00",
                "temperature_2m": 31.5,
                "relative_humidity_2m": 45,
                "apparent_temperature": 34.0,
                "precipitation": 0.0,
                "weather_code": 0,
                "wind_speed_10m": 10.2
              },
              "hourly": {
                "time": ["2026-06-15T11:00", "2026-06-15T12:00", "2026-06-15T13:00", "2026-06-15T14:00"],
                "temperature_2m": [32.0, 33.0, 33.0, 32.0],
                "relative_humidity_2m": [44, 42, 40, 41],
                "precipitation": [0.0, 0.4, 1.1, 0.0],
                "weather_code": [0, 61, 95, 3]
              }
            }
            """;

    private MockRestServiceServer server;
    private WeatherService weatherService;

    @BeforeEach
    void setUp() {
        RetryConfig retryConfig = new RetryConfig();
        ReflectionTestUtils.setField(retryConfig, "maxAttempts", 2);
        ReflectionTestUtils.setField(retryConfig, "initialIntervalMs", 1L);
        RetryTemplate retryTemplate = retryConfig.upstreamRetryTemplate();

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        WeatherConfig config = new WeatherConfig(FORECAST_URL, GEOCODING_URL, "test-agent", "in", 3);
        weatherService = new WeatherService(builder, config, retryTemplate);
    }

    @Test
    @DisplayName("Should geocode the place and read current weather plus the forecast")
    void testWeatherByLocation() {
        // Given
        server.expect(requestTo(startsWith(GEOCODING_URL + "?q=Pune")))
                .andExpect(requestTo(containsString("countrycodes=in")))
                .andExpect(header("User-Agent", "test-agent"))
                .andRespond(withSuccess(PUNE, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(FORECAST_URL + "?latitude=18.5204&longitude=73.8567")))
                .andExpect(requestTo(containsString("forecast_hours=3")))
                .andRespond(withSuccess(FORECAST, MediaType.APPLICATION_JSON));

        // When
        WeatherData weather = weatherService.getWeatherByLocation("Pune");

        // Then
        server.verify();
        assertThat(weather.isSuccess()).isTrue();
        assertThat(weather.location()).isEqualTo("Pune");
        assertThat(weather.temperature()).isEqualTo(31.5);
        assertThat(weather.humidity()).isEqualTo(45.0);
        assertThat(weather.condition()).isEqualTo("Clear");
        assertThat(weather.description()).isEqualTo("Clear sky");
        assertThat(weather.forecast()).hasSize(3)
                .extracting(HourlyForecast::condition)
                .containsExactly("Clear", "Rain", "Thunderstorm");
        assertThat(weather.forecast().get(2).precipitation()).isEqualTo(1.1);
    }

    @Test
    @DisplayName("An unknown place should be reported as not found")
    void testLocationNotFound() {
        // Given
        server.expect(requestTo(startsWith(GEOCODING_URL)))
                .andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        // When
        WeatherData weather = weatherService.getWeatherByLocation("Atlantis");

        // Then
        server.verify();
        assertThat(weather.isSuccess()).isFalse();
        assertThat(weather.status()).isEqualTo(WeatherService.ERROR);
        assertThat(weather.description()).isEqualTo("Location not found");
    }

    @Test
    @DisplayName("A 5xx from the forecast API should be retried")
    void testRetryOnServerError() {
        // Given
        server.expect(requestTo(startsWith(GEOCODING_URL)))
                .andRespond(withSuccess(PUNE, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(FORECAST_URL))).andRespond(withServerError());
        server.expect(requestTo(startsWith(FORECAST_URL)))
                .andRespond(withSuccess(FORECAST, MediaType.APPLICATION_JSON));

        // When
        WeatherData weather = weatherService.getWeatherByLocation("Pune");

        // Then
        server.verify();
        assertThat(weather.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("A 4xx should not be retried and should come back as an error")
    void testClientErrorNotRetried() {
        // Given
        server.expect(requestTo(startsWith(GEOCODING_URL)))
                .andRespond(withSuccess(PUNE, MediaType.APPLICATION_JSON));
        server.expect(requestTo(startsWith(FORECAST_URL))).andRespond(withStatus(HttpStatus.BAD_REQUEST));

        // When
        WeatherData weather = weatherService.getWeatherByLocation("Pune");

        // Then
        server.verify();
        assertThat(weather.isSuccess()).isFalse();
        assertThat(weather.description()).startsWith("Weather service error:");
    }

    @Test
    @DisplayName("Should map WMO weather codes to conditions")
    void testWeatherCondition() {
        assertThat(WeatherService.getWeatherCondition(0)).isEqualTo("Clear");
        assertThat(WeatherService.getWeatherCondition(63)).isEqualTo("Rain");
        assertThat(WeatherService.getWeatherCondition(99)).isEqualTo("Thunderstorm with Hail");
        assertThat(WeatherService.getWeatherCondition(7)).isEqualTo("Unknown");
    }
}
