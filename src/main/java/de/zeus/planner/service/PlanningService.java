package de.zeus.planner.service;

import de.zeus.planner.config.PlannerConfigMerger;
import de.zeus.planner.config.PlannerConfigValidator;
import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.event.PlanPublishedEvent;
import de.zeus.planner.event.PlanningFailedEvent;
import de.zeus.planner.exception.PlanningException;
import de.zeus.planner.exception.SolverException;
import de.zeus.planner.model.InitialState;
import de.zeus.planner.model.PlanResult;
import de.zeus.planner.model.PlannerDebug;
import de.zeus.planner.model.PlannerInput;
import de.zeus.planner.model.PlanningMode;
import de.zeus.planner.model.RecordedSlot;
import de.zeus.planner.model.RiskFactors;
import de.zeus.planner.model.Slot;
import de.zeus.planner.model.TargetSoc;
import de.zeus.planner.model.TerminalValue;
import de.zeus.planner.model.WaterSchedule;
import de.zeus.planner.model.WindowDecision;
import de.zeus.planner.solver.ScheduleSolver;
import de.zeus.planner.solver.SolverAdapter;
import de.zeus.planner.solver.SolverInput;
import de.zeus.planner.solver.SolverResult;
import de.zeus.planner.solver.SolverSettings;
import de.zeus.planner.util.SlotUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

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
 * Runs one planning pass end to end.
 * <p>
 * "Now" is read once and floored to the slot grid; every stage sees the same value. A run
 * either returns a complete {@link PlanResult} or throws, in which case no sink is called.
 */
@Service
public class PlanningService {

    private static final Logger logger = LoggerFactory.getLogger(PlanningService.class);

    private final PlannerProperties properties;
    private final PlannerConfigMerger configMerger;
    private final DataPreparationService dataPreparationService;
    private final RiskFactorService riskFactorService;
    private final WindowIdentificationService windowIdentificationService;
    private final WaterHeatingScheduler waterHeatingScheduler;
    private final ManualPlanService manualPlanService;
    private final SocTargetService socTargetService;
    private final TerminalValueCalculator terminalValueCalculator;
    private final SolverAdapter solverAdapter;
    private final ScheduleSolver scheduleSolver;
    private final DebugPayloadBuilder debugPayloadBuilder;
    private final Clock clock;
    private final AsyncTaskExecutor solverExecutor;

    @Autowired
    private List<ScheduleSink> scheduleSinks = new ArrayList<>();

    @Autowired
    private ApplicationEventPublisher eventPublisher;

    public PlanningService(PlannerProperties properties,
                           PlannerConfigMerger configMerger,
                           DataPreparationService dataPreparationService,
                           RiskFactorService riskFactorService,
                           WindowIdentificationService windowIdentificationService,
                           WaterHeatingScheduler waterHeatingScheduler,
                           ManualPlanService manualPlanService,
                           SocTargetService socTargetService,
                           TerminalValueCalculator terminalValueCalculator,
                           SolverAdapter solverAdapter,
                           ScheduleSolver scheduleSolver,
                           DebugPayloadBuilder debugPayloadBuilder,
                           Clock clock,
                           @Qualifier("solverTaskExecutor") AsyncTaskExecutor solverExecutor) {
        PlannerConfigValidator.validate(properties);
        this.properties = properties;
        this.configMerger = configMerger;
        this.dataPreparationService = dataPreparationService;
        this.riskFactorService = riskFactorService;
        this.windowIdentificationService = windowIdentificationService;
        this.waterHeatingScheduler = waterHeatingScheduler;
        this.manualPlanService = manualPlanService;
        this.socTargetService = socTargetService;
        this.terminalValueCalculator = terminalValueCalculator;
        this.solverAdapter = solverAdapter;
        this.scheduleSolver = scheduleSolver;
        this.debugPayloadBuilder = debugPayloadBuilder;
        this.clock = clock;
        this.solverExecutor = solverExecutor;
    }

    public PlanResult generateSchedule(PlannerInput input, Map<String, Object> overrides, PlanningMode mode) {
        return generateSchedule(input, overrides, mode, clock.instant());
    }

    public PlanResult generateSchedule(PlannerInput input, Map<String, Object> overrides, PlanningMode mode,
                                       Instant instant) {
        PlannerProperties config = configMerger.merge(properties, overrides);
        PlanningMode planningMode = mode != null ? mode : PlanningMode.FULL;
        ZoneId zone = ZoneId.of(config.getTimezone());
        ZonedDateTime now = SlotUtils.floorToSlot(instant.atZone(zone));
        logger.info("Planning run started at {} in {} mode", now, planningMode);

        List<Slot> slots = dataPreparationService.prepare(input, zone);
        if (slots.isEmpty()) {
            throw new PlanningException("No usable price data, nothing to plan");
        }
        if (!config.getSystem().isHasSolar()) {
            dataPreparationService.zeroPv(slots);
        }
        double initialSocKwh = initialSocKwh(input.getInitialState(), config);

        RiskFactors risk = null;
        TargetSoc targetSoc = null;
        if (planningMode == PlanningMode.FULL) {
            risk = riskFactorService.compute(slots, config, input, now);
            dataPreparationService.applySafetyMargins(slots, config, input.getLearningOverlay(), risk.effectiveLoadMargin());
            targetSoc = socTargetService.calculateTarget(risk.futureRisk().rawFactorWithWeather(), config);
        } else {
            dataPreparationService.useRawForecasts(slots);
        }

        for (Slot slot : slots) {
            slot.setHistorical(slot.getStart().isBefore(now));
        }

        WindowDecision windows = windowIdentificationService.identify(slots, config, initialSocKwh, now);
        WaterSchedule water = waterHeatingScheduler.schedule(slots, config, now, input.getInitialState());

        int futureStart = futureStart(slots, now);
        List<Slot> horizon = slots.subList(futureStart, slots.size());

        double riskFactor = risk != null ? risk.futureRisk().riskFactor() : 1.0;
        TerminalValue terminalValue = terminalValueCalculator.calculate(horizon, riskFactor);
        SolverSettings settings = solverAdapter.buildSettings(config, terminalValue, targetSoc);

        if (!horizon.isEmpty()) {
            SolverInput solverInput = solverAdapter.toSolverInput(horizon, initialSocKwh, settings);
            SolverResult result = solve(solverInput, config.getSolver().getTimeoutSeconds());
            solverAdapter.applyResult(horizon, result, config.getBattery().getCapacityKwh(), initialSocKwh);
            logger.info("Solver finished with status '{}' for {} slots", result.status(), horizon.size());
        }

        applyRecordedHistory(slots, futureStart, input.getRecordedHistory(), zone);
        manualPlanService.apply(slots, input.getManualPlan(), config, zone, now);
        socTargetService.applySocTargets(slots, config, futureStart);

        if (slots.isEmpty()) {
            throw new PlanningException("Planning produced an empty schedule");
        }
        PlannerDebug debug = debugPayloadBuilder.build(planningMode, now, slots, config, risk, targetSoc,
                terminalValue, windows, water);
        logger.info("Planning run finished: {} slots, {} in the future", slots.size(), horizon.size());
        return new PlanResult(now, slots, debug);
    }

    /**
     * Plans and hands the result to every registered sink. A failed run publishes a
     * {@link PlanningFailedEvent} and rethrows; the sinks keep the previous plan.
     */
    public PlanResult planAndPublish(PlannerInput input, Map<String, Object> overrides, PlanningMode mode) {
        PlanResult result;
        try {
            result = generateSchedule(input, overrides, mode);
        } catch (RuntimeException ex) {
            logger.error("Planning run failed: {}", ex.getMessage(), ex);
            eventPublisher.publishEvent(new PlanningFailedEvent(this, ex));
            throw ex;
        }
        for (ScheduleSink sink : scheduleSinks) {
            sink.publish(result);
        }
        eventPublisher.publishEvent(new PlanPublishedEvent(this, result));
        return result;
    }

    private SolverResult solve(SolverInput solverInput, long timeoutSeconds) {
        Future<SolverResult> future;
        try {
            future = solverExecutor.submit(() -> scheduleSolver.solve(solverInput));
        } catch (TaskRejectedException ex) {
            throw new SolverException("No solver thread available, earlier runs are still busy", ex);
        }
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new SolverException("Solver did not finish within " + timeoutSeconds + " s", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            throw new SolverException("Solver failed: " + cause.getMessage(), cause);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new SolverException("Interrupted while waiting for the solver", ex);
        }
    }

    private double initialSocKwh(InitialState state, PlannerProperties config) {
        if (state != null && state.getBatteryKwh() != null) {
            return state.getBatteryKwh();
        }
        if (state != null && state.getBatterySocPercent() != null) {
            return state.getBatterySocPercent() / 100.0 * config.getBattery().getCapacityKwh();
        }
        if (config.getSystem().isHasBattery()) {
            logger.warn("No initial battery state reported, assuming an empty battery");
        }
        return 0.0;
    }

    private int futureStart(List<Slot> slots, ZonedDateTime now) {
        for (int i = 0; i < slots.size(); i++) {
            if (!slots.get(i).getStart().isBefore(now)) {
                return i;
            }
        }
        logger.warn("All {} slots lie before {}, planning over the full series", slots.size(), now);
        return 0;
    }

    private void applyRecordedHistory(List<Slot> slots, int futureStart, List<RecordedSlot> history, ZoneId zone) {
        if (history == null || history.isEmpty() || futureStart == 0) {
            return;
        }
        Map<Instant, Double> recorded = new HashMap<>();
        for (RecordedSlot entry : history) {
            if (entry == null || entry.getSocPercent() == null) {
                continue;
            }
            try {
                recorded.put(SlotUtils.parseTimestamp(entry.getStart(), zone).toInstant(), entry.getSocPercent());
            } catch (DateTimeParseException ex) {
                logger.warn("Ignoring recorded SoC with invalid start '{}'", entry.getStart());
            }
        }
        for (int i = 0; i < futureStart; i++) {
            Slot slot = slots.get(i);
            Double soc = recorded.get(slot.getStart().toInstant());
            if (soc != null) {
                slot.setEntrySocPercent(soc);
                slot.setProjectedSocPercent(soc);
            }
        }
    }
}
