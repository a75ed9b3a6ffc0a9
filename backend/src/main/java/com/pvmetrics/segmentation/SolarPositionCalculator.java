package com.pvmetrics.segmentation;

import net.e175.klaus.solarpositioning.DeltaT;
import net.e175.klaus.solarpositioning.SPA;
import net.e175.klaus.solarpositioning.SolarPosition;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;

/**
 * Sun elevation from the NREL solar position algorithm, at sea level and without
 * atmospheric refraction.
 */
public final class SolarPositionCalculator {

    private static final double SEA_LEVEL_METRES = 0.0;

    private SolarPositionCalculator() {
    }

    public static double elevationDegrees(Instant instant, double latitude, double longitude) {
        ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
        SolarPosition position = SPA.calculateSolarPosition(
            utc, latitude, longitude, SEA_LEVEL_METRES, DeltaT.estimate(utc.toLocalDate()));
        return 90.0 - position.zenithAngle();
    }
}
