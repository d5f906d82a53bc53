package de.zeus.planner.service;

import de.zeus.planner.entity.PlannedSlot;
import de.zeus.planner.model.PlanResult;
import de.zeus.planner.model.Slot;
import de.zeus.planner.repository.PlannedSlotRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

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
 * Persists the latest plan. The previous plan is replaced as a whole.
 */
@Component
public class JpaScheduleSink implements ScheduleSink {

    private static final Logger logger = LoggerFactory.getLogger(JpaScheduleSink.class);

    private final PlannedSlotRepository plannedSlotRepository;

    public JpaScheduleSink(PlannedSlotRepository plannedSlotRepository) {
        this.plannedSlotRepository = plannedSlotRepository;
    }

    @Override
    @Transactional
    public void publish(PlanResult plan) {
        List<PlannedSlot> entities = new ArrayList<>(plan.slots().size());
        for (Slot slot : plan.slots()) {
            entities.add(toEntity(slot));
        }
        plannedSlotRepository.deleteAllInBatch();
        plannedSlotRepository.saveAll(entities);
        logger.info("Stored plan with {} slots computed at {}", entities.size(), plan.now());
    }

    private PlannedSlot toEntity(Slot slot) {
        PlannedSlot entity = new PlannedSlot();
        entity.setStartTimestamp(slot.getStart().toInstant().toEpochMilli());
        entity.setEndTimestamp(slot.getEnd().toInstant().toEpochMilli());
        entity.setAction(slot.getAction() != null ? slot.getAction().getLabel() : null);
        entity.setManualAction(slot.getManualAction() != null ? slot.getManualAction().getLabel() : null);
        entity.setImportPrice(slot.getImportPrice());
        entity.setChargeKw(slot.getChargeKw());
        entity.setBatteryChargeKw(slot.getBatteryChargeKw());
        entity.setBatteryDischargeKw(slot.getBatteryDischargeKw());
        entity.setExportKwh(slot.getExportKwh());
        entity.setWaterHeatingKw(slot.getWaterHeatingKw());
        entity.setProjectedSocPercent(slot.getProjectedSocPercent());
        entity.setSocTargetPercent(slot.getSocTargetPercent());
        entity.setCheap(slot.isCheap());
        return entity;
    }
}
