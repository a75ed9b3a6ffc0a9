package com.pvmetrics.service;

import com.pvmetrics.baseline.BaselineGenerator;
import com.pvmetrics.baseline.BaselineType;
import com.pvmetrics.baseline.Baselines;
import com.pvmetrics.baseline.EntitySeries;
import com.pvmetrics.exception.InsufficientHistoryException;
import com.pvmetrics.exception.InvalidEvaluationOptionsException;
import com.pvmetrics.exception.SchemaException;
import com.pvmetrics.metrics.MetricSuite;
import com.pvmetrics.model.EvaluationOptions;
import com.pvmetrics.model.EvaluationResult;
import com.pvmetrics.model.EvaluationRow;
import com.pvmetrics.model.EvaluationTable;
import com.pvmetrics.model.Representation;
import com.pvmetrics.model.Segment;
import com.pvmetrics.model.SegmentKey;
import com.pvmetrics.segmentation.SegmentationEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntFunction;

/**
 * Scores a model's predictions, and the baselines, against the observations for every
 * horizon, value representation and segment.
 *
 * <p>Stateless: every call builds its own series and result and never modifies the table.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EvaluationService {

    static final String OBSERVED_COLUMN = "observed";
    static final String REFERENCE_COLUMN = "reference";

    private final SegmentationEngine segmentationEngine;
    private final EvaluationOptions defaultOptions;

    public EvaluationOptions getDefaultOptions() {
        return defaultOptions;
    }

    public EvaluationResult evaluate(EvaluationTable table, String modelName) {
        return evaluate(table, modelName, defaultOptions);
    }

    public EvaluationResult evaluate(EvaluationTable table, String modelName, EvaluationOptions options) {
        options.validate();
        validateModelName(modelName, options);
        validateSchema(table, options);
        log.info("Evaluation started | model={} | rows={} | horizons={} | baselines={}",
                 modelName, table.size(), table.getHorizons(), options.getBaselines());

        List<EvaluationRow> rows = table.getRows();
        double[] observed = rows.stream().mapToDouble(r -> valueOf(r.getObserved())).toArray();
        Map<String, int[]> entityRows = rowsByEntity(rows);
        Map<String, EntitySeries> entitySeries = new LinkedHashMap<>();
        entityRows.forEach((entity, indices) -> entitySeries.put(entity, toEntitySeries(entity, indices, rows)));
        double[] capacity = capacityPerRow(rows.size(), entityRows, entitySeries);

        // series label -> values per horizon
        Map<String, IntFunction<double[]>> series = new LinkedHashMap<>();
        Map<Integer, double[]> predictions = new LinkedHashMap<>();
        for (int horizon : table.getHorizons()) {
            predictions.put(horizon, rows.stream().mapToDouble(r -> valueOf(r.prediction(horizon))).toArray());
        }
        series.put(modelName, predictions::get);
        for (BaselineType type : options.getBaselines()) {
            double[] values = baselineValues(Baselines.create(type), rows.size(), entityRows, entitySeries);
            series.put(type.label(), horizon -> values);
        }

        List<Representation> representations = options.isNormalize()
            ? List.of(Representation.RAW, Representation.NORMALIZED)
            : List.of(Representation.RAW);
        List<Segment> segments = segmentationEngine.segment(table, options);
        MetricSuite suite = new MetricSuite(options.getLargeErrorThresholds());

        Map<String, Map<String, Map<String, Map<String, Double>>>> metrics = new LinkedHashMap<>();
        Map<String, Map<String, Map<String, Double>>> overall = new LinkedHashMap<>();
        for (Map.Entry<String, IntFunction<double[]>> entry : series.entrySet()) {
            for (Representation representation : representations) {
                double[] scale = representation == Representation.NORMALIZED ? capacity : null;
                Map<String, Map<String, Map<String, Double>>> byHorizon = new LinkedHashMap<>();
                Map<String, Map<String, Double>> overallByHorizon = new LinkedHashMap<>();
                for (int horizon : table.getHorizons()) {
                    double[] predicted = entry.getValue().apply(horizon);
                    Map<String, Map<String, Double>> bySegment = new LinkedHashMap<>();
                    for (Segment segment : segments) {
                        bySegment.put(segment.key().describe(),
                            score(suite, predicted, observed, scale, segment.rowIndices()));
                    }
                    byHorizon.put(EvaluationResult.horizonKey(horizon), Collections.unmodifiableMap(bySegment));
                    overallByHorizon.put(EvaluationResult.horizonKey(horizon), bySegment.get(SegmentKey.ALL));
                }
                String key = EvaluationResult.seriesKey(entry.getKey(), representation);
                metrics.put(key, Collections.unmodifiableMap(byHorizon));
                overall.put(key, Collections.unmodifiableMap(overallByHorizon));
            }
        }

        long metricCount = (long) metrics.size() * table.getHorizons().size() * segments.size() * suite.names().size();
        log.info("Evaluation complete | model={} | rows={} | segments={} | metrics={}",
                 modelName, rows.size(), segments.size(), metricCount);
        return EvaluationResult.builder()
            .modelName(modelName)
            .rowCount(rows.size())
            .horizons(List.copyOf(table.getHorizons()))
            .segments(segments.stream().map(s -> s.key().describe()).toList())
            .metrics(Collections.unmodifiableMap(metrics))
            .overall(Collections.unmodifiableMap(overall))
            .build();
    }

    private Map<String, Double> score(MetricSuite suite, double[] predicted, double[] observed,
                                      double[] scale, int[] rowIndices) {
        double[] p = new double[rowIndices.length];
        double[] o = new double[rowIndices.length];
        int n = 0;
        for (int i : rowIndices) {
            double divisor = scale != null ? scale[i] : 1.0;
            if (!Double.isFinite(predicted[i]) || !Double.isFinite(observed[i])
                    || !Double.isFinite(divisor) || divisor == 0.0) {
                continue;
            }
            p[n] = predicted[i] / divisor;
            o[n] = observed[i] / divisor;
            n++;
        }
        return suite.score(Arrays.copyOf(p, n), Arrays.copyOf(o, n));
    }

    private double[] baselineValues(BaselineGenerator generator, int rowCount,
                                    Map<String, int[]> entityRows, Map<String, EntitySeries> entitySeries) {
        double[] values = new double[rowCount];
        Arrays.fill(values, Double.NaN);
        for (Map.Entry<String, int[]> entity : entityRows.entrySet()) {
            try {
                double[] generated = generator.generate(entitySeries.get(entity.getKey()));
                int[] indices = entity.getValue();
                for (int i = 0; i < indices.length; i++) {
                    values[indices[i]] = generated[i];
                }
            } catch (InsufficientHistoryException ex) {
                log.debug("Baseline not computable | baseline={} | entity={} | reason={}",
                          generator.type().label(), entity.getKey(), ex.getMessage());
            }
        }
        return values;
    }

    /**
     * Row indices of each entity in first-seen order, sorted by timestamp within the entity.
     */
    private Map<String, int[]> rowsByEntity(List<EvaluationRow> rows) {
        Map<String, List<Integer>> grouped = new LinkedHashMap<>();
        for (int i = 0; i < rows.size(); i++) {
            grouped.computeIfAbsent(rows.get(i).getEntityId(), k -> new ArrayList<>()).add(i);
        }
        Map<String, int[]> sorted = new LinkedHashMap<>();
        grouped.forEach((entity, indices) -> sorted.put(entity, indices.stream()
            .sorted(Comparator.comparing(i -> rows.get(i).getTimestamp()))
            .mapToInt(Integer::intValue)
            .toArray()));
        return sorted;
    }

    private EntitySeries toEntitySeries(String entity, int[] indices, List<EvaluationRow> rows) {
        Instant[] timestamps = new Instant[indices.length];
        double[] observed = new double[indices.length];
        double[] reference = new double[indices.length];
        double capacity = Double.NaN;
        for (int i = 0; i < indices.length; i++) {
            EvaluationRow row = rows.get(indices[i]);
            timestamps[i] = row.getTimestamp();
            observed[i] = valueOf(row.getObserved());
            reference[i] = valueOf(row.getReference());
            if (Double.isNaN(capacity) && row.getCapacity() != null) {
                capacity = row.getCapacity();
            }
        }
        return new EntitySeries(entity, timestamps, observed, reference, capacity);
    }

    private double[] capacityPerRow(int rowCount, Map<String, int[]> entityRows, Map<String, EntitySeries> entitySeries) {
        double[] capacity = new double[rowCount];
        entityRows.forEach((entity, indices) -> {
            double entityCapacity = entitySeries.get(entity).effectiveCapacity();
            for (int i : indices) {
                capacity[i] = entityCapacity;
            }
        });
        return capacity;
    }

    private void validateModelName(String modelName, EvaluationOptions options) {
        if (modelName == null || modelName.isBlank()) {
            throw new InvalidEvaluationOptionsException("modelName is required");
        }
        if (options.getBaselines().stream().anyMatch(b -> b.label().equals(modelName))) {
            throw new InvalidEvaluationOptionsException("modelName '" + modelName + "' clashes with a baseline name");
        }
    }

    private void validateSchema(EvaluationTable table, EvaluationOptions options) {
        List<Integer> horizons = table.getHorizons();
        if (horizons.stream().anyMatch(h -> h == null || h < 0) || new HashSet<>(horizons).size() != horizons.size()) {
            throw new SchemaException("horizons", "horizon labels must be distinct and >= 0, got " + horizons);
        }
        Set<Integer> declared = new HashSet<>(horizons);
        List<EvaluationRow> rows = table.getRows();
        for (int i = 0; i < rows.size(); i++) {
            EvaluationRow row = rows.get(i);
            if (row.getEntityId() == null || row.getEntityId().isBlank()) {
                throw new SchemaException("entity_id", "missing on row " + i);
            }
            if (SegmentKey.ALL.equals(row.getEntityId())) {
                throw new SchemaException("entity_id", "'" + SegmentKey.ALL + "' is reserved, found on row " + i);
            }
            if (row.getTimestamp() == null) {
                throw new SchemaException("timestamp", "missing on row " + i);
            }
            for (Integer horizon : row.getPredictions().keySet()) {
                if (!declared.contains(horizon)) {
                    throw new SchemaException(predictionColumn(horizon),
                        "row " + i + " predicts a horizon the table does not declare");
                }
            }
        }
        if (rows.isEmpty()) {
            return;
        }
        if (rows.stream().allMatch(r -> r.getObserved() == null)) {
            throw new SchemaException(OBSERVED_COLUMN);
        }
        for (int horizon : horizons) {
            if (rows.stream().allMatch(r -> r.prediction(horizon) == null)) {
                throw new SchemaException(predictionColumn(horizon));
            }
        }
        if (options.getBaselines().contains(BaselineType.REFERENCE)
                && rows.stream().allMatch(r -> r.getReference() == null)) {
            throw new SchemaException(REFERENCE_COLUMN);
        }
    }

    static String predictionColumn(int horizon) {
        return "forecast_horizon_" + horizon;
    }

    private static double valueOf(Double value) {
        return value != null ? value : Double.NaN;
    }
}
