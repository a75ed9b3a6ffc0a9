package com.pvmetrics.model;

import java.time.Month;

/**
 * Meteorological seasons: whole calendar months, Dec-Feb is northern winter.
 */
public enum Season {
    WINTER("winter"),
    SPRING("spring"),
    SUMMER("summer"),
    AUTUMN("autumn");

    private final String label;

    Season(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static Season of(Month month, Hemisphere hemisphere) {
        Month shifted = hemisphere == Hemisphere.SOUTHERN ? month.plus(6) : month;
        return switch (shifted) {
            case DECEMBER, JANUARY, FEBRUARY -> WINTER;
            case MARCH, APRIL, MAY -> SPRING;
            case JUNE, JULY, AUGUST -> SUMMER;
            case SEPTEMBER, OCTOBER, NOVEMBER -> AUTUMN;
        };
    }
}
