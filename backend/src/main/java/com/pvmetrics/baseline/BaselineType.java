package com.pvmetrics.baseline;

public enum BaselineType {
    LAST_VALUE("last_value_persistence_baseline"),
    LAST_DAY("last_day_persistence_baseline"),
    REFERENCE("reference_baseline"),
    MAX("max_baseline"),
    ZERO("zero_baseline");

    private final String label;

    BaselineType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
