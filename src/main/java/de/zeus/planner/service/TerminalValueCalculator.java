package de.zeus.planner.service;

import de.zeus.planner.model.Slot;
import de.zeus.planner.model.TerminalValue;
import de.zeus.planner.util.SlotUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Value per kWh of energy left in the battery at the end of the horizon:
 * mean import price of the horizon scaled by the risk factor.
 */
@Component
public class TerminalValueCalculator {

    private static final Logger logger = LoggerFactory.getLogger(TerminalValueCalculator.class);

    public TerminalValue calculate(List<Slot> horizon, double riskFactor) {
        if (horizon == null || horizon.isEmpty()) {
            logger.debug("Empty horizon, terminal value is 0");
            return TerminalValue.none();
        }
        double average = SlotUtils.averageImportPrice(horizon);
        double value = average * riskFactor;
        logger.info("Terminal value {} per kWh (mean import {} x risk {})",
                SlotUtils.round4(value), SlotUtils.round4(average), SlotUtils.round4(riskFactor));
        return new TerminalValue(average, riskFactor, value);
    }
}
