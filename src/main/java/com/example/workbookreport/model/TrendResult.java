package com.example.workbookreport.model;

import java.util.List;

public class TrendResult {
    public static final String PERIOD_COLUMN = "period";
    public static final String GROWTH_RATE_COLUMN = "growth_rate";

    private final String valueColumn;
    private final List<TrendPoint> points;

    public TrendResult(String valueColumn, List<TrendPoint> points) {
        this.valueColumn = valueColumn;
        this.points = List.copyOf(points);
    }

    public static TrendResult empty(String valueColumn) {
        return new TrendResult(valueColumn, List.of());
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public List<TrendPoint> getPoints() {
        return points;
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    /**
     * Tabular form with columns {@value #PERIOD_COLUMN} (yyyy-MM), the value column and
     * {@value #GROWTH_RATE_COLUMN}.
     */
    public Dataset toDataset() {
        Dataset.Builder builder = Dataset.builder(PERIOD_COLUMN, valueColumn, GROWTH_RATE_COLUMN);
        points.forEach(point -> builder.addRow(point.period().toString(), point.total(), point.growthRatePercent()));
        return builder.build();
    }
}
