package com.pvmetrics.segmentation;

import com.pvmetrics.model.SegmentAxis;

import java.util.List;

/**
 * The buckets of one axis, in output order, and the bucket each table row falls into.
 */
public record AxisPartition(SegmentAxis axis, List<String> buckets, String[] rowBuckets) {

    public long count(String bucket) {
        long count = 0;
        for (String rowBucket : rowBuckets) {
            if (rowBucket.equals(bucket)) {
                count++;
            }
        }
        return count;
    }
}
