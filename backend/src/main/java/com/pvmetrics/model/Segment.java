package com.pvmetrics.model;

import java.util.Arrays;

/**
 * A sub-table: the segment key and the indices of the table rows that fall into it.
 */
public record Segment(SegmentKey key, int[] rowIndices) {

    public int size() {
        return rowIndices.length;
    }

    public boolean isEmpty() {
        return rowIndices.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Segment other)) {
            return false;
        }
        return key.equals(other.key) && Arrays.equals(rowIndices, other.rowIndices);
    }

    @Override
    public int hashCode() {
        return 31 * key.hashCode() + Arrays.hashCode(rowIndices);
    }

    @Override
    public String toString() {
        return "Segment[" + key.describe() + ", rows=" + rowIndices.length + "]";
    }
}
