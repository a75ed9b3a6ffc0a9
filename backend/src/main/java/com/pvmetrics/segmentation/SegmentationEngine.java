package com.pvmetrics.segmentation;

import com.pvmetrics.model.EvaluationOptions;
import com.pvmetrics.model.EvaluationRow;
import com.pvmetrics.model.EvaluationTable;
import com.pvmetrics.model.Season;
import com.pvmetrics.model.Segment;
import com.pvmetrics.model.SegmentAxis;
import com.pvmetrics.model.SegmentKey;
import org.springframework.stereotype.Component;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Slices an evaluation table along the requested axes.
 *
 * <p>Every requested axis contributes an {@code all} pseudo-bucket followed by its real
 * buckets, and the segments are the cartesian product of those. Empty segments are kept
 * so the set of segment keys depends only on the options (and, for the entity axis, on
 * the entity ids present).
 */
@Component
public class SegmentationEngine {

    static final String DAY = "day";
    static final String NIGHT = "night";

    public List<Segment> segment(EvaluationTable table, EvaluationOptions options) {
        int[] allRows = new int[table.size()];
        Arrays.setAll(allRows, i -> i);

        List<Segment> segments = List.of(new Segment(SegmentKey.unsliced(), allRows));
        for (SegmentAxis axis : options.getRequestedAxes()) {
            AxisPartition partition = partition(axis, table, options);
            List<Segment> next = new ArrayList<>(segments.size() * (partition.buckets().size() + 1));
            for (Segment segment : segments) {
                next.add(new Segment(segment.key().with(axis, SegmentKey.ALL), segment.rowIndices()));
                for (String bucket : partition.buckets()) {
                    next.add(new Segment(segment.key().with(axis, bucket),
                        filter(segment.rowIndices(), partition.rowBuckets(), bucket)));
                }
            }
            segments = next;
        }
        return segments;
    }

    public AxisPartition partition(SegmentAxis axis, EvaluationTable table, EvaluationOptions options) {
        List<EvaluationRow> rows = table.getRows();
        String[] rowBuckets = new String[rows.size()];
        return switch (axis) {
            case DAYLIGHT -> {
                for (int i = 0; i < rowBuckets.length; i++) {
                    rowBuckets[i] = isDaylight(rows.get(i), options) ? DAY : NIGHT;
                }
                yield new AxisPartition(axis, List.of(DAY, NIGHT), rowBuckets);
            }
            case TIME_OF_DAY -> {
                int width = options.getTimeOfDayBucketMinutes();
                for (int i = 0; i < rowBuckets.length; i++) {
                    ZonedDateTime local = local(rows.get(i), options);
                    int minuteOfDay = local.getHour() * 60 + local.getMinute();
                    rowBuckets[i] = timeLabel(minuteOfDay - minuteOfDay % width);
                }
                List<String> buckets = new ArrayList<>();
                for (int start = 0; start < 24 * 60; start += width) {
                    buckets.add(timeLabel(start));
                }
                yield new AxisPartition(axis, List.copyOf(buckets), rowBuckets);
            }
            case PART_OF_DAY -> {
                Map<Integer, String> partByHour = new HashMap<>();
                options.getPartOfDayHours().forEach((part, hours) -> hours.forEach(h -> partByHour.put(h, part)));
                for (int i = 0; i < rowBuckets.length; i++) {
                    rowBuckets[i] = partByHour.get(local(rows.get(i), options).getHour());
                }
                yield new AxisPartition(axis, List.copyOf(options.getPartOfDayHours().keySet()), rowBuckets);
            }
            case SEASON -> {
                for (int i = 0; i < rowBuckets.length; i++) {
                    rowBuckets[i] = Season.of(local(rows.get(i), options).getMonth(), options.getHemisphere()).label();
                }
                yield new AxisPartition(axis,
                    Arrays.stream(Season.values()).map(Season::label).toList(), rowBuckets);
            }
            case ENTITY -> {
                Set<String> entities = new LinkedHashSet<>();
                for (int i = 0; i < rowBuckets.length; i++) {
                    rowBuckets[i] = rows.get(i).getEntityId();
                    entities.add(rowBuckets[i]);
                }
                yield new AxisPartition(axis, List.copyOf(entities), rowBuckets);
            }
        };
    }

    boolean isDaylight(EvaluationRow row, EvaluationOptions options) {
        if (row.hasLocation()) {
            double elevation = SolarPositionCalculator.elevationDegrees(
                row.getTimestamp(), row.getLatitude(), row.getLongitude());
            return elevation > options.getNightSunElevationDegrees();
        }
        int hour = local(row, options).getHour();
        return hour >= options.getDayStartHour() && hour < options.getDayEndHour();
    }

    private static ZonedDateTime local(EvaluationRow row, EvaluationOptions options) {
        return row.getTimestamp().atZone(options.getZoneId());
    }

    private static String timeLabel(int minuteOfDay) {
        return String.format(Locale.ROOT, "%02d:%02d", minuteOfDay / 60, minuteOfDay % 60);
    }

    private static int[] filter(int[] rowIndices, String[] rowBuckets, String bucket) {
        return Arrays.stream(rowIndices)
            .filter(i -> rowBuckets[i].equals(bucket))
            .toArray();
    }
}
