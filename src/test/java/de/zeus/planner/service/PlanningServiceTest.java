package de.zeus.planner.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.zeus.planner.PlannerTestData;
import de.zeus.planner.config.PlannerConfigMerger;
import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.event.PlanPublishedEvent;
import de.zeus.planner.event.PlanningFailedEvent;
import de.zeus.planner.exception.PlannerConfigurationException;
import de.zeus.planner.exception.PlanningException;
import de.zeus.planner.exception.SolverException;
import de.zeus.planner.model.ForecastSlot;
import de.zeus.planner.model.InitialState;
import de.zeus.planner.model.ManualAction;
import de.zeus.planner.model.ManualPlanEntry;
import de.zeus.planner.model.PlanResult;
import de.zeus.planner.model.PlannerInput;
import de.zeus.planner.model.PlanningMode;
import de.zeus.planner.model.PriceSlot;
import de.zeus.planner.model.RecordedSlot;
import de.zeus.planner.model.Slot;
import de.zeus.planner.solver.HeuristicDispatchSolver;
import de.zeus.planner.solver.ScheduleSolver;
import de.zeus.planner.solver.SolverAdapter;
import de.zeus.planner.solver.SolverResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs the whole pipeline with the real stages, a mocked temperature source and a
 * replaceable solver.
 */
class PlanningServiceTest {

    private static final ZonedDateTime DAY_START = PlannerTestData.at(2025, 1, 15, 0, 0);
    private static final Instant NOW = PlannerTestData.at(2025, 1, 15, 6, 7).toInstant();

    private PlannerProperties properties;
    private ScheduleSolver solver;
    private ScheduleSink sink;
    private ApplicationEventPublisher eventPublisher;

    @BeforeEach
    void setUp() {
        properties = PlannerTestData.properties();
        solver = new HeuristicDispatchSolver();
        sink = mock(ScheduleSink.class);
        eventPublisher = mock(ApplicationEventPublisher.class);
    }

    @Test
    void generateSchedule_producesCompletePlan() {
        PlanResult result = service().generateSchedule(input(), Map.of(), PlanningMode.FULL, NOW);

        assertEquals(PlannerTestData.at(2025, 1, 15, 6, 0), result.now(), "Now is floored to the slot grid");
        assertEquals(96, result.slots().size());
        for (Slot slot : result.slots()) {
            assertNotNull(slot.getSocTargetPercent(), "Target missing at " + slot.getStart());
            assertTrue(slot.getSocTargetPercent() >= 0.0 && slot.getSocTargetPercent() <= 100.0);
        }
        assertTrue(result.slots().get(0).isHistorical());
        assertFalse(result.slots().get(24).isHistorical());
        assertNotNull(result.slots().get(24).getAction());
        assertNull(result.slots().get(0).getAction(), "History is not re-planned");
        assertNotNull(result.debug().risk());
        assertNotNull(result.debug().targetSoc());
        assertEquals(72, result.debug().metrics().futureSlotCount());
        assertEquals(30, result.debug().sampleSchedule().size());
        assertEquals(6.0, result.debug().water().scheduledKwh(), 1e-9);
    }

    @Test
    void generateSchedule_isDeterministic() {
        PlanningService service = service();

        PlanResult first = service.generateSchedule(input(), Map.of(), PlanningMode.FULL, NOW);
        PlanResult second = service.generateSchedule(input(), Map.of(), PlanningMode.FULL, NOW);

        for (int i = 0; i < first.slots().size(); i++) {
            Slot a = first.slots().get(i);
            Slot b = second.slots().get(i);
            assertEquals(a.getAction(), b.getAction());
            assertEquals(a.getSocTargetPercent(), b.getSocTargetPercent());
            assertEquals(a.getWaterHeatingKw(), b.getWaterHeatingKw());
        }
        assertEquals(first.debug().terminalValue(), second.debug().terminalValue());
    }

    @Test
    void generateSchedule_baselineModeSkipsRiskEngine() {
        PlanResult result = service().generateSchedule(input(), Map.of(), PlanningMode.BASELINE, NOW);

        assertNull(result.debug().risk());
        assertNull(result.debug().targetSoc());
        assertEquals(1.0, result.debug().terminalValue().riskFactor(), 1e-9);
        Slot future = result.slots().get(40);
        assertEquals(future.getLoadForecastKwh(), future.getAdjustedLoadKwh(), 1e-9);
    }

    @Test
    void generateSchedule_appliesManualPlanAndRecordedHistory() {
        PlannerInput input = input();
        input.setManualPlan(List.of(
                new ManualPlanEntry("m1", "Hold", "2025-01-15T12:00:00", "2025-01-15T12:30:00")));
        input.setRecordedHistory(List.of(new RecordedSlot("2025-01-15T05:00:00", 37.0)));

        PlanResult result = service().generateSchedule(input, Map.of(), PlanningMode.FULL, NOW);

        assertEquals(ManualAction.HOLD, result.slots().get(48).getManualAction());
        assertEquals(37.0, result.slots().get(20).getSocTargetPercent(), 1e-9);
    }

    @Test
    void generateSchedule_overridesApplyToThisRunOnly() {
        PlanningService service = service();

        PlanResult result = service.generateSchedule(input(), Map.of("system", Map.of("hasWaterHeater", false)),
                PlanningMode.FULL, NOW);

        assertFalse(result.debug().water().enabled());
        assertEquals(6.0, service.generateSchedule(input(), Map.of(), PlanningMode.FULL, NOW)
                .debug().water().scheduledKwh(), 1e-9);
    }

    @Test
    void generateSchedule_invalidOverrideFails() {
        assertThrows(PlannerConfigurationException.class, () -> service().generateSchedule(input(),
                Map.of("battery", Map.of("minSocPercent", 120.0)), PlanningMode.FULL, NOW));
    }

    @Test
    void generateSchedule_emptyPriceDataFails() {
        assertThrows(PlanningException.class,
                () -> service().generateSchedule(new PlannerInput(), Map.of(), PlanningMode.FULL, NOW));
    }

    @Test
    void planAndPublish_handsCompletePlanToSinks() {
        PlanningService service = service(Clock.fixed(NOW, PlannerTestData.ZONE));

        PlanResult result = service.planAndPublish(input(), Map.of(), PlanningMode.FULL);

        verify(sink).publish(result);
        verify(eventPublisher).publishEvent(any(PlanPublishedEvent.class));
        verify(eventPublisher, never()).publishEvent(any(PlanningFailedEvent.class));
    }

    @Test
    void planAndPublish_solverFailureLeavesSinksUntouched() {
        solver = solverInput -> {
            throw new IllegalStateException("infeasible");
        };
        PlanningService service = service(Clock.fixed(NOW, PlannerTestData.ZONE));

        assertThrows(SolverException.class, () -> service.planAndPublish(input(), Map.of(), PlanningMode.FULL));

        verifyNoInteractions(sink);
        verify(eventPublisher).publishEvent(any(PlanningFailedEvent.class));
    }

    @Test
    void generateSchedule_solverTimeoutFails() {
        solver = solverInput -> {
            try {
                Thread.sleep(5_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new SolverResult(List.of(), "late");
        };
        properties.getSolver().setTimeoutSeconds(1);

        SolverException ex = assertThrows(SolverException.class,
                () -> service().generateSchedule(input(), Map.of(), PlanningMode.FULL, NOW));
        assertTrue(ex.getMessage().contains("1 s"));
    }

    @Test
    void generateSchedule_solverLengthMismatchFails() {
        solver = solverInput -> new SolverResult(List.of(), "broken");

        assertThrows(SolverException.class,
                () -> service().generateSchedule(input(), Map.of(), PlanningMode.FULL, NOW));
    }

    @Test
    void generateSchedule_busySolverPoolFails() {
        AsyncTaskExecutor busy = mock(AsyncTaskExecutor.class);
        when(busy.submit(any(Callable.class))).thenThrow(new TaskRejectedException("pool exhausted"));

        SolverException ex = assertThrows(SolverException.class,
                () -> service(Clock.systemUTC(), busy).generateSchedule(input(), Map.of(), PlanningMode.FULL, NOW));
        assertInstanceOf(TaskRejectedException.class, ex.getCause());
    }

    private PlanningService service() {
        return service(Clock.systemUTC());
    }

    private PlanningService service(Clock clock) {
        return service(clock, new SimpleAsyncTaskExecutor("test-solver-"));
    }

    private PlanningService service(Clock clock, AsyncTaskExecutor solverExecutor) {
        TemperatureForecastProvider temperatures = mock(TemperatureForecastProvider.class);
        PlanningService service = new PlanningService(properties,
                new PlannerConfigMerger(new ObjectMapper()),
                new DataPreparationService(),
                new RiskFactorService(temperatures),
                new WindowIdentificationService(),
                new WaterHeatingScheduler(),
                new ManualPlanService(),
                new SocTargetService(),
                new TerminalValueCalculator(),
                new SolverAdapter(),
                solver,
                new DebugPayloadBuilder(),
                clock,
                solverExecutor);
        inject(service, "scheduleSinks", List.of(sink));
        inject(service, "eventPublisher", eventPublisher);
        return service;
    }

    /**
     * One local day of prices with a cheap night and an expensive evening, flat load and
     * a midday PV bump.
     */
    private static PlannerInput input() {
        List<PriceSlot> prices = new ArrayList<>();
        List<ForecastSlot> forecasts = new ArrayList<>();
        DateTimeFormatter format = DateTimeFormatter.ISO_LOCAL_DATE_TIME;
        for (int i = 0; i < 96; i++) {
            ZonedDateTime start = DAY_START.plusMinutes(15L * i);
            int hour = start.getHour();
            double price = hour < 5 ? 0.3 : (hour >= 17 && hour < 21 ? 2.5 : 1.0 + (i % 4) * 0.01);
            prices.add(new PriceSlot(start.toLocalDateTime().format(format), null, price, price * 0.8));
            double pv = hour >= 10 && hour < 14 ? 0.8 : 0.0;
            forecasts.add(new ForecastSlot(start.toLocalDateTime().format(format), pv, 0.3));
        }
        PlannerInput input = new PlannerInput();
        input.setPriceData(prices);
        input.setForecastData(forecasts);
        input.setInitialState(new InitialState(4.0, null));
        return input;
    }

    private static void inject(Object target, String field, Object value) {
        try {
            var f = target.getClass().getDeclaredField(field);
            f.setAccessible(true);
            f.set(target, value);
        } catch (Exception e) {
            throw new RuntimeException(e);
        }
    }
}
