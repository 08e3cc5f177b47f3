package com.example.workbookreport.model;

import java.util.List;

/**
 * Groups ordered by descending total. Ties keep the order in which their keys first appeared.
 */
public class RankingResult {
    private final String groupColumn;
    private final String valueColumn;
    private final List<RankingEntry> entries;

    public RankingResult(String groupColumn, String valueColumn, List<RankingEntry> entries) {
        this.groupColumn = groupColumn;
        this.valueColumn = valueColumn;
        this.entries = List.copyOf(entries);
    }

    public static RankingResult empty(String groupColumn, String valueColumn) {
        return new RankingResult(groupColumn, valueColumn, List.of());
    }

    public String getGroupColumn() {
        return groupColumn;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public List<RankingEntry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Dataset toDataset() {
        Dataset.Builder builder = Dataset.builder(groupColumn, valueColumn);
        entries.forEach(entry -> builder.addRow(entry.groupKey(), entry.total()));
        return builder.build();
    }
}
