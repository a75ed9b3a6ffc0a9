package com.pvmetrics.segmentation;

import com.pvmetrics.model.EvaluationOptions;
import com.pvmetrics.model.EvaluationRow;
import com.pvmetrics.model.EvaluationTable;
import com.pvmetrics.model.Hemisphere;
import com.pvmetrics.model.Segment;
import com.pvmetrics.model.SegmentAxis;
import com.pvmetrics.model.SegmentKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SegmentationEngineTest {

    private static final Instant START = Instant.parse("2022-01-01T00:00:00Z");

    private SegmentationEngine engine;
    private EvaluationTable table;

    @BeforeEach
    void setUp() {
        engine = new SegmentationEngine();
        EvaluationTable.EvaluationTableBuilder builder = EvaluationTable.builder().horizon(0);
        // two sites, one row every 7h13m across more than a year
        for (int i = 0; i < 1300; i++) {
            Instant ts = START.plus(i * 433L, ChronoUnit.MINUTES);
            builder.row(row(i % 2 == 0 ? "site-a" : "site-b", ts));
        }
        table = builder.build();
    }

    private static EvaluationRow row(String entity, Instant ts) {
        return EvaluationRow.builder()
            .entityId(entity)
            .timestamp(ts)
            .observed(1.0)
            .prediction(0, 1.0)
            .build();
    }

    @Test
    void partition_everyAxisCoversEachRowExactlyOnce() {
        EvaluationOptions options = EvaluationOptions.builder().partOfDay(true).build();

        for (SegmentAxis axis : SegmentAxis.values()) {
            AxisPartition partition = engine.partition(axis, table, options);

            assertThat(partition.rowBuckets()).hasSize(table.size());
            assertThat(partition.buckets()).containsAll(List.of(partition.rowBuckets()));
            long total = partition.buckets().stream().mapToLong(partition::count).sum();
            assertThat(total).as("rows in %s", axis).isEqualTo(table.size());
        }
    }

    @Test
    void partition_timeOfDay_labelsBucketStart() {
        EvaluationTable single = EvaluationTable.builder().horizon(0)
            .row(row("site-a", Instant.parse("2022-05-01T12:45:00Z")))
            .build();
        EvaluationOptions options = EvaluationOptions.builder().timeOfDayBucketMinutes(30).build();

        AxisPartition partition = engine.partition(SegmentAxis.TIME_OF_DAY, single, options);

        assertThat(partition.buckets()).hasSize(48).startsWith("00:00", "00:30");
        assertThat(partition.rowBuckets()).containsExactly("12:30");
    }

    @Test
    void partition_timeOfDay_usesConfiguredZone() {
        EvaluationTable single = EvaluationTable.builder().horizon(0)
            .row(row("site-a", Instant.parse("2022-05-01T12:10:00Z")))
            .build();
        EvaluationOptions options = EvaluationOptions.builder().zoneId(ZoneId.of("Europe/Berlin")).build();

        assertThat(engine.partition(SegmentAxis.TIME_OF_DAY, single, options).rowBuckets())
            .containsExactly("14:00");
    }

    @Test
    void partition_season_followsHemisphere() {
        EvaluationTable january = EvaluationTable.builder().horizon(0)
            .row(row("site-a", Instant.parse("2022-01-15T12:00:00Z")))
            .build();

        EvaluationOptions north = EvaluationOptions.builder().build();
        EvaluationOptions south = EvaluationOptions.builder().hemisphere(Hemisphere.SOUTHERN).build();

        assertThat(engine.partition(SegmentAxis.SEASON, january, north).rowBuckets()).containsExactly("winter");
        assertThat(engine.partition(SegmentAxis.SEASON, january, south).rowBuckets()).containsExactly("summer");
    }

    @Test
    void partition_partOfDay_wrapsAroundMidnight() {
        EvaluationTable rows = EvaluationTable.builder().horizon(0)
            .row(row("site-a", Instant.parse("2022-05-01T22:00:00Z")))
            .row(row("site-a", Instant.parse("2022-05-01T03:59:00Z")))
            .row(row("site-a", Instant.parse("2022-05-01T04:00:00Z")))
            .row(row("site-a", Instant.parse("2022-05-01T15:30:00Z")))
            .row(row("site-a", Instant.parse("2022-05-01T20:00:00Z")))
            .build();

        AxisPartition partition = engine.partition(SegmentAxis.PART_OF_DAY, rows,
            EvaluationOptions.builder().partOfDay(true).build());

        assertThat(partition.buckets()).containsExactly("night", "morning", "afternoon", "evening");
        assertThat(partition.rowBuckets()).containsExactly("night", "night", "morning", "afternoon", "evening");
    }

    @Test
    void daylight_withoutLocation_usesHourWindow() {
        EvaluationOptions options = EvaluationOptions.builder().build();

        assertThat(engine.isDaylight(row("site-a", Instant.parse("2022-05-01T06:00:00Z")), options)).isTrue();
        assertThat(engine.isDaylight(row("site-a", Instant.parse("2022-05-01T17:59:00Z")), options)).isTrue();
        assertThat(engine.isDaylight(row("site-a", Instant.parse("2022-05-01T18:00:00Z")), options)).isFalse();
        assertThat(engine.isDaylight(row("site-a", Instant.parse("2022-05-01T02:00:00Z")), options)).isFalse();
    }

    @Test
    void daylight_withLocation_usesSunElevation() {
        EvaluationOptions options = EvaluationOptions.builder().build();
        EvaluationRow noon = row("site-a", Instant.parse("2022-06-21T12:00:00Z")).toBuilder()
            .latitude(51.5).longitude(-0.13).build();
        EvaluationRow midnight = noon.toBuilder().timestamp(Instant.parse("2022-06-21T00:00:00Z")).build();
        // 20:30 UTC in June: sun below the horizon but above -5 degrees in London
        EvaluationRow dusk = noon.toBuilder().timestamp(Instant.parse("2022-06-21T20:30:00Z")).build();

        assertThat(engine.isDaylight(noon, options)).isTrue();
        assertThat(engine.isDaylight(midnight, options)).isFalse();
        assertThat(engine.isDaylight(dusk, options)).isTrue();
    }

    @Test
    void segment_isCartesianProductIncludingAll() {
        EvaluationOptions options = EvaluationOptions.builder().build();

        List<Segment> segments = engine.segment(table, options);

        // daylight (2+1) x time of day (24+1) x season (4+1) x entity (2+1)
        assertThat(segments).hasSize(3 * 25 * 5 * 3);
        assertThat(segments.stream().map(s -> s.key().describe()).distinct()).hasSize(segments.size());
        Segment first = segments.get(0);
        assertThat(first.key().describe()).isEqualTo(SegmentKey.ALL);
        assertThat(first.size()).isEqualTo(table.size());
    }

    @Test
    void segment_singleAxisBucketsPartitionTheRows() {
        EvaluationOptions options = EvaluationOptions.builder()
            .daylight(false).timeOfDay(false).perEntity(false)
            .build();

        List<Segment> segments = engine.segment(table, options);

        assertThat(segments).extracting(s -> s.key().describe())
            .containsExactly("all", "season=winter", "season=spring", "season=summer", "season=autumn");
        int sliced = segments.subList(1, segments.size()).stream().mapToInt(Segment::size).sum();
        assertThat(sliced).isEqualTo(table.size());
    }

    @Test
    void segment_noAxes_yieldsOnlyUnslicedSegment() {
        EvaluationOptions options = EvaluationOptions.builder()
            .daylight(false).timeOfDay(false).season(false).perEntity(false)
            .build();

        assertThat(engine.segment(table, options)).singleElement()
            .satisfies(s -> assertThat(s.size()).isEqualTo(table.size()));
    }

    @Test
    void segment_emptyTable_keepsFixedKeysWithNoRows() {
        EvaluationTable empty = EvaluationTable.builder().horizon(0).build();

        List<Segment> segments = engine.segment(empty, EvaluationOptions.builder().build());

        // entity axis has only its 'all' bucket
        assertThat(segments).hasSize(3 * 25 * 5);
        assertThat(segments).allMatch(Segment::isEmpty);
    }
}
