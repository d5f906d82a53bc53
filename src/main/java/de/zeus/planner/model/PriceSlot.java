package de.zeus.planner.model;

/**
 * One entry of the price feed. Timestamps are ISO-8601, with or without offset.
 */
public class PriceSlot {

    private String start;
    private String end;
    private Double importPrice;
    private Double exportPrice;

    public PriceSlot() {
    }

    public PriceSlot(String start, String end, Double importPrice, Double exportPrice) {
        this.start = start;
        this.end = end;
        this.importPrice = importPrice;
        this.exportPrice = exportPrice;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    public Double getImportPrice() {
        return importPrice;
    }

    public void setImportPrice(Double importPrice) {
        this.importPrice = importPrice;
    }

    public Double getExportPrice() {
        return exportPrice;
    }

    public void setExportPrice(Double exportPrice) {
        this.exportPrice = exportPrice;
    }
}
