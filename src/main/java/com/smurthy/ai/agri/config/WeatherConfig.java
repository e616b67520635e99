package com.smurthy.ai.agri.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the weather upstreams (Open-Meteo + Nominatim)
 */
@ConfigurationProperties(prefix = "advisor.weather")
public record WeatherConfig(
        @DefaultValue("https://api.open-meteo.com/v1/forecast") String forecastUrl,
        @DefaultValue("https://nominatim.openstreetmap.org/search") String geocodingUrl,
        @DefaultValue("AgriAdvisor/1.0") String userAgent,
        @DefaultValue("in") String countryCode,
        @DefaultValue("24") int forecastHours
) {
}
