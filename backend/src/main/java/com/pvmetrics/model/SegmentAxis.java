package com.pvmetrics.model;

public enum SegmentAxis {
    DAYLIGHT("daylight"),
    TIME_OF_DAY("time_of_day"),
    PART_OF_DAY("part_of_day"),
    SEASON("season"),
    ENTITY("entity");

    private final String label;

    SegmentAxis(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
