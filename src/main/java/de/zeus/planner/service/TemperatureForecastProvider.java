package de.zeus.planner.service;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

/**
 * Source of daily mean temperatures used by the risk engine.
 * <p>
 * Implementations must not throw for missing data; days they cannot answer are simply
 * absent from the returned map.
 */
public interface TemperatureForecastProvider {

    /**
     * @param dayOffsets days after {@code today} (1 = tomorrow)
     * @return offset to mean temperature in °C
     */
    Map<Integer, Double> fetchMeanTemperatures(List<Integer> dayOffsets, ZoneId zone, LocalDate today);
}
