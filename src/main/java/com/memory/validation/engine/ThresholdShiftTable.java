package com.memory.validation.engine;

import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Monotone range table from significance (0-10) to a recommended threshold shift.
 * Rows are lower bounds; the row with the greatest bound not above the significance wins.
 */
public final class ThresholdShiftTable {

    private final NavigableMap<Double, Double> rows;

    public ThresholdShiftTable(Map<Double, Double> rows) {
        this.rows = new TreeMap<>(rows);
        double previous = Double.POSITIVE_INFINITY;
        for (double shift : this.rows.values()) {
            if (shift > previous) {
                throw new IllegalArgumentException("Shift table must not increase with significance: " + rows);
            }
            previous = shift;
        }
    }

    public static ThresholdShiftTable standard() {
        return new ThresholdShiftTable(Map.of(
                8.0, -0.20,
                6.0, -0.10,
                4.0, -0.05));
    }

    public double shiftFor(double significance) {
        Map.Entry<Double, Double> row = rows.floorEntry(significance);
        return row == null ? 0.0 : row.getValue();
    }
}
