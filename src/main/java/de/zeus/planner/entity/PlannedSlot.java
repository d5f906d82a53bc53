package de.zeus.planner.entity;

import javax.persistence.*;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

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

@Entity
@Table(name = "planned_slot")
public class PlannedSlot {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private Long id;
    private Long startTimestamp;
    private Long endTimestamp;
    private String action;
    private String manualAction;
    private Double importPrice;
    private Double chargeKw;
    private Double batteryChargeKw;
    private Double batteryDischargeKw;
    private Double exportKwh;
    private Double waterHeatingKw;
    private Double projectedSocPercent;
    private Double socTargetPercent;
    private Boolean cheap;

    public Long getId() {
        return id;
    }

    public void setId(Long id) {
        this.id = id;
    }

    public Long getStartTimestamp() {
        return startTimestamp;
    }

    public void setStartTimestamp(Long startTimestamp) {
        this.startTimestamp = startTimestamp;
    }

    public Long getEndTimestamp() {
        return endTimestamp;
    }

    public void setEndTimestamp(Long endTimestamp) {
        this.endTimestamp = endTimestamp;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getManualAction() {
        return manualAction;
    }

    public void setManualAction(String manualAction) {
        this.manualAction = manualAction;
    }

    public Double getImportPrice() {
        return importPrice;
    }

    public void setImportPrice(Double importPrice) {
        this.importPrice = importPrice;
    }

    public Double getChargeKw() {
        return chargeKw;
    }

    public void setChargeKw(Double chargeKw) {
        this.chargeKw = chargeKw;
    }

    public Double getBatteryChargeKw() {
        return batteryChargeKw;
    }

    public void setBatteryChargeKw(Double batteryChargeKw) {
        this.batteryChargeKw = batteryChargeKw;
    }

    public Double getBatteryDischargeKw() {
        return batteryDischargeKw;
    }

    public void setBatteryDischargeKw(Double batteryDischargeKw) {
        this.batteryDischargeKw = batteryDischargeKw;
    }

    public Double getExportKwh() {
        return exportKwh;
    }

    public void setExportKwh(Double exportKwh) {
        this.exportKwh = exportKwh;
    }

    public Double getWaterHeatingKw() {
        return waterHeatingKw;
    }

    public void setWaterHeatingKw(Double waterHeatingKw) {
        this.waterHeatingKw = waterHeatingKw;
    }

    public Double getProjectedSocPercent() {
        return projectedSocPercent;
    }

    public void setProjectedSocPercent(Double projectedSocPercent) {
        this.projectedSocPercent = projectedSocPercent;
    }

    public Double getSocTargetPercent() {
        return socTargetPercent;
    }

    public void setSocTargetPercent(Double socTargetPercent) {
        this.socTargetPercent = socTargetPercent;
    }

    public Boolean getCheap() {
        return cheap;
    }

    public void setCheap(Boolean cheap) {
        this.cheap = cheap;
    }

    public String getFormattedStartTimestamp() {
        return formatTimestamp(startTimestamp);
    }

    private String formatTimestamp(Long timestamp) {
        if (timestamp == null) return "N/A";
        return DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
                .withZone(ZoneId.systemDefault())
                .format(Instant.ofEpochMilli(timestamp));
    }

    @Override
    public String toString() {
        return "PlannedSlot{" +
                "start=" + getFormattedStartTimestamp() +
                ", action='" + action + '\'' +
                ", manualAction='" + manualAction + '\'' +
                ", importPrice=" + importPrice +
                ", socTarget=" + socTargetPercent +
                '}';
    }
}
