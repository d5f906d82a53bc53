package de.zeus.planner.model;

/**
 * Battery action of one slot as classified from the optimizer output.
 */
public enum SlotAction {
    CHARGE("Charge"),
    DISCHARGE("Discharge"),
    EXPORT("Export"),
    HOLD("Hold");

    /** Power (kW) or energy (kWh) below this is treated as zero. */
    public static final double ACTIVITY_EPSILON = 0.01;

    private final String label;

    SlotAction(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Charging wins over discharging; a discharging slot that also exports is an export slot.
     */
    public static SlotAction classify(double batteryChargeKw, double batteryDischargeKw, double exportKwh) {
        if (batteryChargeKw > ACTIVITY_EPSILON) {
            return CHARGE;
        }
        if (batteryDischargeKw > ACTIVITY_EPSILON) {
            return exportKwh > ACTIVITY_EPSILON ? EXPORT : DISCHARGE;
        }
        return HOLD;
    }
}
