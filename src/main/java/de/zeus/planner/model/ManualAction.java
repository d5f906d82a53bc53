package de.zeus.planner.model;

import java.util.Locale;
import java.util.Optional;

/**
 * User override attached to a slot by the manual plan.
 */
public enum ManualAction {
    CHARGE("Charge"),
    WATER_HEATING("Water Heating"),
    EXPORT("Export"),
    HOLD("Hold");

    private final String label;

    ManualAction(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public static Optional<ManualAction> fromLabel(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT).replace('_', ' ');
        switch (normalized) {
            case "charge":
                return Optional.of(CHARGE);
            case "water heating":
            case "water":
                return Optional.of(WATER_HEATING);
            case "export":
                return Optional.of(EXPORT);
            case "hold":
                return Optional.of(HOLD);
            default:
                return Optional.empty();
        }
    }
}
