package com.pvmetrics.baseline;

import com.pvmetrics.exception.InsufficientHistoryException;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Repeats the observation made at the same time one day earlier. Rows with no
 * observation exactly one day back get NaN.
 */
public class LastDayBaseline implements BaselineGenerator {

    static final Duration LOOKBACK = Duration.ofDays(1);

    @Override
    public BaselineType type() {
        return BaselineType.LAST_DAY;
    }

    @Override
    public double[] generate(EntitySeries series) {
        Instant[] timestamps = series.timestamps();
        if (timestamps.length == 0
                || Duration.between(timestamps[0], timestamps[timestamps.length - 1]).compareTo(LOOKBACK) < 0) {
            throw new InsufficientHistoryException(series.entityId(),
                "same-time-yesterday persistence needs at least " + LOOKBACK + " of history");
        }
        Map<Instant, Integer> indexByTime = new HashMap<>();
        for (int i = 0; i < timestamps.length; i++) {
            indexByTime.put(timestamps[i], i);
        }
        double[] observed = series.observed();
        double[] baseline = new double[observed.length];
        for (int i = 0; i < timestamps.length; i++) {
            Integer yesterday = indexByTime.get(timestamps[i].minus(LOOKBACK));
            baseline[i] = yesterday != null ? observed[yesterday] : Double.NaN;
        }
        return baseline;
    }
}
