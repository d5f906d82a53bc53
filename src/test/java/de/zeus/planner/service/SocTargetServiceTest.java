package de.zeus.planner.service;

import de.zeus.planner.PlannerTestData;
import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.model.ManualAction;
import de.zeus.planner.model.Slot;
import de.zeus.planner.model.SlotAction;
import de.zeus.planner.model.TargetSoc;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SocTargetServiceTest {

    private SocTargetService service;
    private PlannerProperties properties;

    @BeforeEach
    void setUp() {
        service = new SocTargetService();
        properties = PlannerTestData.properties();
    }

    @Test
    void calculateTarget_neutralWeatherGivesMinPlusBuffer() {
        TargetSoc target = service.calculateTarget(1.0, properties);

        assertEquals(22.0, target.targetPercent(), 1e-9);
        assertEquals(2.2, target.targetKwh(), 1e-9);
        assertEquals(8.0, target.penaltyPerKwh(), 1e-9);
    }

    @Test
    void calculateTarget_badWeatherAddsCappedAdjustment() {
        assertEquals(30.0, service.calculateTarget(1.2, properties).targetPercent(), 1e-9);
        assertEquals(30.0, service.calculateTarget(2.0, properties).targetPercent(), 1e-9, "Weather adjustment is capped");
        assertEquals(14.0, service.calculateTarget(0.0, properties).targetPercent(), 1e-9);
    }

    @Test
    void calculateTarget_decreasesWithRiskAppetite() {
        double previous = Double.MAX_VALUE;
        for (int appetite = 1; appetite <= 5; appetite++) {
            properties.getRisk().setRiskAppetite(appetite);
            double target = service.calculateTarget(1.1, properties).targetPercent();
            assertTrue(target <= previous, "Appetite " + appetite + " should not raise the target");
            previous = target;
        }
    }

    @Test
    void calculateTarget_neverLeavesFloorAndMax() {
        properties.getBattery().setMinSocPercent(0.0);
        properties.getRisk().setRiskAppetite(5);
        assertEquals(5.0, service.calculateTarget(0.5, properties).targetPercent(), 1e-9);

        properties.getBattery().setMinSocPercent(90.0);
        properties.getRisk().setRiskAppetite(1);
        assertEquals(100.0, service.calculateTarget(1.5, properties).targetPercent(), 1e-9);
    }

    @Test
    void applySocTargets_chargeBlockHoldsOneValue() {
        List<Slot> slots = PlannerTestData.flatSlots(PlannerTestData.at(2025, 1, 15, 0, 0), 6, 1.0);
        double[] projected = {20, 40, 60, 80, 70, 60};
        SlotAction[] actions = {SlotAction.CHARGE, SlotAction.CHARGE, SlotAction.CHARGE, SlotAction.CHARGE,
                SlotAction.DISCHARGE, SlotAction.DISCHARGE};
        for (int i = 0; i < slots.size(); i++) {
            slots.get(i).setProjectedSocPercent(projected[i]);
            slots.get(i).setAction(actions[i]);
        }

        service.applySocTargets(slots, properties, 0);

        for (int i = 0; i < 4; i++) {
            assertEquals(80.0, slots.get(i).getSocTargetPercent(), 1e-9, "Charge slot " + i);
        }
        assertEquals(12.0, slots.get(4).getSocTargetPercent(), 1e-9);
    }

    @Test
    void applySocTargets_manualChargeIsCappedAndManualExportUsesItsTarget() {
        properties.getManualPlanning().setChargeTargetPercent(50.0);
        properties.getManualPlanning().setExportTargetPercent(30.0);
        List<Slot> slots = PlannerTestData.flatSlots(PlannerTestData.at(2025, 1, 15, 0, 0), 4, 1.0);
        slots.get(0).setAction(SlotAction.CHARGE);
        slots.get(0).setManualAction(ManualAction.CHARGE);
        slots.get(0).setProjectedSocPercent(90.0);
        slots.get(2).setAction(SlotAction.EXPORT);
        slots.get(2).setManualAction(ManualAction.EXPORT);
        slots.get(2).setProjectedSocPercent(70.0);
        slots.get(3).setAction(SlotAction.EXPORT);
        slots.get(3).setProjectedSocPercent(60.0);

        service.applySocTargets(slots, properties, 0);

        assertEquals(50.0, slots.get(0).getSocTargetPercent(), 1e-9);
        assertEquals(30.0, slots.get(2).getSocTargetPercent(), 1e-9);
        assertEquals(30.0, slots.get(3).getSocTargetPercent(), 1e-9, "Manual export covers the whole block");
    }

    @Test
    void applySocTargets_exportBlockTakesProjectedSocAtItsEnd() {
        List<Slot> slots = exportBlock(80.0, 65.0, 50.0);

        service.applySocTargets(slots, properties, 0);

        for (int i = 0; i < 3; i++) {
            assertEquals(50.0, slots.get(i).getSocTargetPercent(), 1e-9, "Export slot " + i);
        }
        assertEquals(70.0, slots.get(3).getSocTargetPercent(), 1e-9, "Hold after the block keeps its entry SoC");
    }

    @Test
    void applySocTargets_exportBlockNeverDropsBelowMinSoc() {
        List<Slot> slots = exportBlock(30.0, 15.0, 5.0);

        service.applySocTargets(slots, properties, 0);

        for (int i = 0; i < 3; i++) {
            assertEquals(12.0, slots.get(i).getSocTargetPercent(), 1e-9, "Export slot " + i);
        }
    }

    @Test
    void applySocTargets_historyKeepsEntryAndHoldKeepsEntry() {
        List<Slot> slots = PlannerTestData.flatSlots(PlannerTestData.at(2025, 1, 15, 0, 0), 3, 1.0);
        slots.get(0).setEntrySocPercent(44.444);
        slots.get(1).setAction(SlotAction.HOLD);
        slots.get(1).setEntrySocPercent(41.0);
        slots.get(2).setAction(SlotAction.HOLD);
        slots.get(2).setEntrySocPercent(41.0);

        service.applySocTargets(slots, properties, 1);

        assertEquals(44.44, slots.get(0).getSocTargetPercent(), 1e-9);
        assertEquals(41.0, slots.get(1).getSocTargetPercent(), 1e-9);
        assertEquals(41.0, slots.get(2).getSocTargetPercent(), 1e-9);
    }

    @Test
    void applySocTargets_batteryWaterHeatingAllowsDischargeButGridHeatingHolds() {
        List<Slot> slots = PlannerTestData.flatSlots(PlannerTestData.at(2025, 1, 15, 0, 0), 4, 1.0);
        for (Slot slot : slots) {
            slot.setAction(SlotAction.DISCHARGE);
            slot.setWaterHeatingKw(3.0);
        }
        slots.get(1).setWaterFromBatteryKwh(0.5);
        slots.get(3).setAction(SlotAction.HOLD);
        slots.get(3).setWaterHeatingKw(0.0);

        service.applySocTargets(slots, properties, 0);
        assertEquals(12.0, slots.get(0).getSocTargetPercent(), 1e-9);

        List<Slot> gridSlots = PlannerTestData.flatSlots(PlannerTestData.at(2025, 1, 15, 0, 0), 2, 1.0);
        for (Slot slot : gridSlots) {
            slot.setAction(SlotAction.DISCHARGE);
            slot.setWaterHeatingKw(3.0);
            slot.setWaterFromGridKwh(0.75);
        }
        gridSlots.get(0).setEntrySocPercent(55.0);

        service.applySocTargets(gridSlots, properties, 0);
        assertEquals(55.0, gridSlots.get(1).getSocTargetPercent(), 1e-9);
    }

    /**
     * Three optimizer export slots with the given projected SoC, followed by one hold slot.
     */
    private static List<Slot> exportBlock(double... projected) {
        List<Slot> slots = PlannerTestData.flatSlots(PlannerTestData.at(2025, 1, 15, 17, 0), projected.length + 1, 2.0);
        for (int i = 0; i < projected.length; i++) {
            slots.get(i).setAction(SlotAction.EXPORT);
            slots.get(i).setProjectedSocPercent(projected[i]);
        }
        Slot hold = slots.get(projected.length);
        hold.setAction(SlotAction.HOLD);
        hold.setEntrySocPercent(70.0);
        return slots;
    }
}
