package com.pvmetrics.baseline;

public final class Baselines {
    private Baselines() {
    }

    public static BaselineGenerator create(BaselineType type) {
        return switch (type) {
            case LAST_VALUE -> PersistenceBaseline.lastValue();
            case LAST_DAY -> new LastDayBaseline();
            case REFERENCE -> new ReferenceSeriesBaseline();
            case MAX -> ConstantBaseline.max();
            case ZERO -> ConstantBaseline.zero();
        };
    }
}
