package de.zeus.planner.service;

import de.zeus.planner.config.PlannerProperties;
import de.zeus.planner.model.ManualAction;
import de.zeus.planner.model.ManualPlanEntry;
import de.zeus.planner.model.Slot;
import de.zeus.planner.util.SlotUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Overlays user-defined manual actions onto the future slots of a plan. Entries are applied
 * in order, so a later entry wins where ranges overlap. The optimizer's action is kept;
 * the override is recorded in {@code manualAction} and the matching power field.
 */
@Service
public class ManualPlanService {

    private static final Logger logger = LoggerFactory.getLogger(ManualPlanService.class);

    private static final String LANE_SPACER = "lane-spacer";

    /**
     * @return number of entries that were applied
     */
    public int apply(List<Slot> slots, List<ManualPlanEntry> entries, PlannerProperties properties,
                     ZoneId zone, ZonedDateTime now) {
        if (entries == null || entries.isEmpty()) {
            return 0;
        }
        int applied = 0;
        for (ManualPlanEntry entry : entries) {
            if (entry == null || isDecoration(entry)) {
                continue;
            }
            Optional<ManualAction> action = resolveAction(entry);
            if (action.isEmpty()) {
                logger.debug("Manual plan entry {} has no recognisable action, skipping", entry.getId());
                continue;
            }
            ZonedDateTime start;
            ZonedDateTime end;
            try {
                start = SlotUtils.parseTimestamp(entry.getStart(), zone);
                end = SlotUtils.parseTimestamp(entry.getEnd(), zone);
            } catch (DateTimeParseException ex) {
                logger.warn("Skipping manual plan entry {} with invalid time range {} - {}: {}",
                        entry.getId(), entry.getStart(), entry.getEnd(), ex.getMessage());
                continue;
            }

            int matched = 0;
            for (Slot slot : slots) {
                if (slot.getStart().isBefore(now) || slot.getStart().isBefore(start) || !slot.getStart().isBefore(end)) {
                    continue;
                }
                applyTo(slot, action.get(), properties);
                matched++;
            }
            logger.info("Manual {} from {} to {} applied to {} slot(s)", action.get().getLabel(), start, end, matched);
            applied++;
        }
        return applied;
    }

    private void applyTo(Slot slot, ManualAction action, PlannerProperties properties) {
        slot.setManualAction(action);
        switch (action) {
            case CHARGE:
                slot.setChargeKw(properties.getBattery().getMaxChargePowerKw());
                break;
            case WATER_HEATING:
                slot.setWaterHeatingKw(properties.getWaterHeating().getPowerKw());
                break;
            default:
                break;
        }
    }

    private static boolean isDecoration(ManualPlanEntry entry) {
        return "background".equalsIgnoreCase(entry.getType())
                || (entry.getId() != null && entry.getId().startsWith(LANE_SPACER + "-"))
                || (entry.getClassName() != null && entry.getClassName().contains(LANE_SPACER));
    }

    /**
     * Explicit text first, then the entry id, then the timeline group it was placed in.
     */
    static Optional<ManualAction> resolveAction(ManualPlanEntry entry) {
        for (String text : new String[]{entry.getContent(), entry.getAction(), entry.getTitle()}) {
            Optional<ManualAction> action = ManualAction.fromLabel(text);
            if (action.isPresent()) {
                return action;
            }
        }
        if (entry.getId() != null) {
            String id = entry.getId().toLowerCase(Locale.ROOT);
            if (id.contains("charge")) {
                return Optional.of(ManualAction.CHARGE);
            }
            if (id.contains("water")) {
                return Optional.of(ManualAction.WATER_HEATING);
            }
            if (id.contains("export")) {
                return Optional.of(ManualAction.EXPORT);
            }
            if (id.contains("hold")) {
                return Optional.of(ManualAction.HOLD);
            }
        }
        if (entry.getGroup() != null) {
            String group = entry.getGroup().toLowerCase(Locale.ROOT);
            if (group.contains("battery")) {
                return Optional.of(ManualAction.CHARGE);
            }
            return ManualAction.fromLabel(group);
        }
        return Optional.empty();
    }
}
