package com.pvmetrics.model;

public enum Hemisphere {
    NORTHERN,
    SOUTHERN
}
