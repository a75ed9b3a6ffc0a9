package com.pvmetrics.model;

public enum Representation {
    RAW("raw"),
    NORMALIZED("normalized");

    private final String label;

    Representation(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
