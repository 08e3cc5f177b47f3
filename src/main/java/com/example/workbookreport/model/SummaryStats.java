package com.example.workbookreport.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

public class SummaryStats {
    private final int totalRecords;
    private final DateRange dateRange;
    private final Map<String, ColumnStats> numericSummary;

    public SummaryStats(int totalRecords, DateRange dateRange, Map<String, ColumnStats> numericSummary) {
        this.totalRecords = totalRecords;
        this.dateRange = dateRange;
        this.numericSummary = Collections.unmodifiableMap(new LinkedHashMap<>(numericSummary));
    }

    public int getTotalRecords() {
        return totalRecords;
    }

    public Optional<DateRange> getDateRange() {
        return Optional.ofNullable(dateRange);
    }

    /**
     * @return statistics per numeric column in dataset column order; empty when there are none
     */
    public Map<String, ColumnStats> getNumericSummary() {
        return numericSummary;
    }

    public boolean hasNumericSummary() {
        return !numericSummary.isEmpty();
    }
}
