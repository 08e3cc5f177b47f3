package com.example.workbookreport.report;

import com.example.workbookreport.model.ChartSpec;

import java.util.Optional;

/**
 * Outcome of a chart binding: either the bound chart or the reason it was skipped.
 */
public final class ChartBindingResult {
    private final ChartSpec chart;
    private final String skipReason;

    private ChartBindingResult(ChartSpec chart, String skipReason) {
        this.chart = chart;
        this.skipReason = skipReason;
    }

    public static ChartBindingResult bound(ChartSpec chart) {
        return new ChartBindingResult(chart, null);
    }

    public static ChartBindingResult skipped(String reason) {
        return new ChartBindingResult(null, reason);
    }

    public boolean isBound() {
        return chart != null;
    }

    public Optional<ChartSpec> getChart() {
        return Optional.ofNullable(chart);
    }

    public Optional<String> getSkipReason() {
        return Optional.ofNullable(skipReason);
    }

    @Override
    public String toString() {
        return isBound() ? "bound " + chart : "skipped: " + skipReason;
    }
}
