package de.zeus.planner.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Open-Meteo client for daily mean temperatures.
 * Every failure is logged and answered with an empty map, so the risk engine simply
 * runs without a temperature contribution.
 */
@Service
public class TemperatureForecastService implements TemperatureForecastProvider {

    private static final Logger logger = LoggerFactory.getLogger(TemperatureForecastService.class);

    /** Open-Meteo serves at most 16 forecast days. */
    private static final int MAX_FORECAST_DAYS = 16;

    @Value("${planner.weather.enabled:true}")
    private boolean enabled;

    @Value("${planner.weather.base-url:https://api.open-meteo.com/v1/forecast}")
    private String baseUrl;

    @Value("${planner.weather.latitude:59.33}")
    private double latitude;

    @Value("${planner.weather.longitude:18.07}")
    private double longitude;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public TemperatureForecastService(RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Map<Integer, Double> fetchMeanTemperatures(List<Integer> dayOffsets, ZoneId zone, LocalDate today) {
        if (!enabled) {
            logger.debug("Weather API is disabled. Skipping temperature lookup.");
            return Collections.emptyMap();
        }
        if (dayOffsets == null || dayOffsets.isEmpty()) {
            return Collections.emptyMap();
        }
        int forecastDays = Math.min(MAX_FORECAST_DAYS, Collections.max(dayOffsets) + 1);
        URI uri = UriComponentsBuilder.fromHttpUrl(baseUrl)
                .queryParam("latitude", latitude)
                .queryParam("longitude", longitude)
                .queryParam("daily", "temperature_2m_mean")
                .queryParam("timezone", zone.getId())
                .queryParam("forecast_days", forecastDays)
                .build()
                .encode()
                .toUri();

        try {
            ResponseEntity<String> response = restTemplate.getForEntity(uri, String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                logger.warn("Open-Meteo temperature request failed: {}", response.getStatusCode());
                return Collections.emptyMap();
            }
            return parseDailyMeans(response.getBody(), dayOffsets, today);
        } catch (RestClientException | IOException | DateTimeParseException ex) {
            logger.warn("Temperature forecast unavailable: {}", ex.getMessage());
            return Collections.emptyMap();
        }
    }

    private Map<Integer, Double> parseDailyMeans(String body, List<Integer> dayOffsets, LocalDate today) throws IOException {
        JsonNode daily = objectMapper.readTree(body).path("daily");
        JsonNode times = daily.path("time");
        JsonNode means = daily.path("temperature_2m_mean");
        if (!times.isArray() || !means.isArray()) {
            logger.warn("Open-Meteo response has no daily temperature_2m_mean series");
            return Collections.emptyMap();
        }

        Map<Integer, Double> temperatures = new HashMap<>();
        int n = Math.min(times.size(), means.size());
        for (int i = 0; i < n; i++) {
            JsonNode value = means.get(i);
            if (value == null || value.isNull()) {
                continue;
            }
            LocalDate date = LocalDate.parse(times.get(i).asText());
            int offset = (int) ChronoUnit.DAYS.between(today, date);
            if (dayOffsets.contains(offset)) {
                temperatures.put(offset, value.asDouble());
            }
        }
        logger.debug("Fetched mean temperatures {}", temperatures);
        return temperatures;
    }
}
