package de.zeus.planner.config;

import de.zeus.planner.exception.PlannerConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

/**
 * Copyright 2024 Guido Zeuner - https://tiny-tool.de
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Checks a {@link PlannerProperties} instance before it is used for planning.
 * Hard errors throw {@link PlannerConfigurationException}; inconsistent but harmless
 * hardware toggles are only logged.
 */
public final class PlannerConfigValidator {

    private static final Logger logger = LoggerFactory.getLogger(PlannerConfigValidator.class);

    private static final int MIN_APPETITE = 1;
    private static final int MAX_APPETITE = 5;

    private PlannerConfigValidator() {
    }

    public static void validate(PlannerProperties properties) {
        if (properties == null) {
            throw new PlannerConfigurationException("Planner configuration is missing");
        }
        requireSection(properties.getBattery(), "battery");
        requireSection(properties.getBatteryEconomics(), "battery-economics");
        requireSection(properties.getSystem(), "system");
        requireSection(properties.getRisk(), "risk");
        requireSection(properties.getChargingStrategy(), "charging-strategy");
        requireSection(properties.getWaterHeating(), "water-heating");
        requireSection(properties.getManualPlanning(), "manual-planning");
        requireSection(properties.getForecasting(), "forecasting");
        requireSection(properties.getSolver(), "solver");

        try {
            ZoneId.of(properties.getTimezone());
        } catch (DateTimeException | NullPointerException ex) {
            throw new PlannerConfigurationException("Invalid timezone: " + properties.getTimezone(), ex);
        }

        validateBattery(properties);
        validateRisk(properties.getRisk());

        if (properties.getSolver().getTimeoutSeconds() <= 0) {
            throw new PlannerConfigurationException("solver.timeout-seconds must be positive");
        }

        PlannerProperties.SystemProfile system = properties.getSystem();
        if (system.isHasWaterHeater() && properties.getWaterHeating().getPowerKw() <= 0) {
            logger.warn("has-water-heater is true but water-heating.power-kw is 0. Water heating scheduling is disabled.");
        }
        if (system.isHasSolar() && system.getSolarKwp() <= 0) {
            logger.warn("has-solar is true but system.solar-kwp is 0. Check the PV forecast source.");
        }
    }

    private static void validateBattery(PlannerProperties properties) {
        BatteryProperties battery = properties.getBattery();
        if (properties.getSystem().isHasBattery() && battery.getCapacityKwh() <= 0) {
            throw new PlannerConfigurationException(
                    "system.has-battery is true but battery.capacity-kwh is not set (or is 0). "
                            + "Set battery.capacity-kwh or set system.has-battery to false.");
        }
        double min = battery.getMinSocPercent();
        double max = battery.getMaxSocPercent();
        if (min < 0 || max > 100 || min > max) {
            throw new PlannerConfigurationException(
                    String.format("Battery SoC bounds must satisfy 0 <= min <= max <= 100 (min=%.1f, max=%.1f)", min, max));
        }
        if (battery.getMaxChargePowerKw() < 0 || battery.getMaxDischargePowerKw() < 0) {
            throw new PlannerConfigurationException("Battery power limits must not be negative");
        }
        if (!inUnitInterval(battery.getChargeEfficiency()) || !inUnitInterval(battery.getDischargeEfficiency())) {
            throw new PlannerConfigurationException("Battery efficiencies must be in (0, 1]");
        }
    }

    private static void validateRisk(RiskProperties risk) {
        if (risk.getMode() == null) {
            throw new PlannerConfigurationException("risk.mode must be set");
        }
        if (risk.getRiskAppetite() < MIN_APPETITE || risk.getRiskAppetite() > MAX_APPETITE) {
            throw new PlannerConfigurationException("risk.risk-appetite must be between 1 and 5, was " + risk.getRiskAppetite());
        }
        if (risk.getMaxFactor() < 0 || risk.getMinFactor() > risk.getMaxFactor()) {
            throw new PlannerConfigurationException(
                    String.format("risk factor bounds must satisfy 0 <= min <= max (min=%.2f, max=%.2f)",
                            risk.getMinFactor(), risk.getMaxFactor()));
        }
        if (risk.getWeatherCapPercent() < 0) {
            throw new PlannerConfigurationException("risk.weather-cap-percent must not be negative");
        }
        if (risk.getWeatherVolatility() == null) {
            throw new PlannerConfigurationException("risk.weather-volatility must not be null");
        }
        requireNonIncreasingTable(risk.getBufferMultiplier(), "risk.buffer-multiplier");
        requireNonIncreasingTable(risk.getSigmaByAppetite(), "risk.sigma-by-appetite");
        requireNonIncreasingTable(risk.getBaseBufferPercent(), "risk.base-buffer-percent");
        requireNonIncreasingTable(risk.getTargetPenaltyByAppetite(), "risk.target-penalty-by-appetite");
    }

    /**
     * Appetite tables must cover every level, and a more aggressive level may never
     * buffer more than a more conservative one.
     */
    static void requireNonIncreasingTable(Map<Integer, Double> table, String name) {
        if (table == null) {
            throw new PlannerConfigurationException(name + " must not be null");
        }
        Double previous = null;
        for (int level = MIN_APPETITE; level <= MAX_APPETITE; level++) {
            Double value = table.get(level);
            if (value == null) {
                throw new PlannerConfigurationException(name + " has no entry for appetite level " + level);
            }
            if (previous != null && value > previous) {
                throw new PlannerConfigurationException(
                        String.format("%s must not increase with appetite (level %d: %.2f > %.2f)", name, level, value, previous));
            }
            previous = value;
        }
    }

    private static boolean inUnitInterval(double value) {
        return value > 0 && value <= 1.0;
    }

    private static void requireSection(Object section, String name) {
        if (section == null) {
            throw new PlannerConfigurationException("Missing required config section: " + name);
        }
    }
}
