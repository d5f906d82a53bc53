package de.zeus.planner.model;

/**
 * SoC actually recorded at the start of a past slot.
 */
public class RecordedSlot {

    private String start;
    private Double socPercent;

    public RecordedSlot() {
    }

    public RecordedSlot(String start, Double socPercent) {
        this.start = start;
        this.socPercent = socPercent;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public Double getSocPercent() {
        return socPercent;
    }

    public void setSocPercent(Double socPercent) {
        this.socPercent = socPercent;
    }
}
