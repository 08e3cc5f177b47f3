package com.example.workbookreport.analysis;

import com.example.workbookreport.model.ColumnStats;
import com.example.workbookreport.model.Dataset;
import com.example.workbookreport.model.DateRange;
import com.example.workbookreport.model.RankingEntry;
import com.example.workbookreport.model.RankingResult;
import com.example.workbookreport.model.SummaryStats;
import com.example.workbookreport.model.TrendPoint;
import com.example.workbookreport.model.TrendResult;
import com.example.workbookreport.util.CellValues;

import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Summary statistics, rankings and monthly trends over a {@link Dataset}. Absent columns never
 * raise; they produce empty or partial results.
 */
public class ReportAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReportAnalyzer.class);
    public static final String DEFAULT_DATE_COLUMN = "date";

    public SummaryStats summaryStats(Dataset dataset) {
        return summaryStats(dataset, DEFAULT_DATE_COLUMN);
    }

    public SummaryStats summaryStats(Dataset dataset, String dateColumn) {
        DateRange dateRange = dateRange(dataset, dateColumn).orElse(null);

        Map<String, ColumnStats> numericSummary = new LinkedHashMap<>();
        for (String column : dataset.getColumns()) {
            numericValues(dataset, column)
                    .map(this::describe)
                    .ifPresent(stats -> numericSummary.put(column, stats));
        }
        if (numericSummary.isEmpty()) {
            LOGGER.debug("Dataset has no numeric columns, numeric summary left empty");
        }
        return new SummaryStats(dataset.getRowCount(), dateRange, numericSummary);
    }

    /**
     * Sums {@code valueColumn} per distinct {@code groupColumn} value and keeps the {@code n} largest.
     */
    public RankingResult topPerformers(Dataset dataset, String groupColumn, String valueColumn, int n) {
        if (!dataset.hasColumn(groupColumn) || !dataset.hasColumn(valueColumn)) {
            LOGGER.warn("Cannot rank by '{}' over '{}': column missing from dataset {}",
                    groupColumn, valueColumn, dataset.getColumns());
            return RankingResult.empty(groupColumn, valueColumn);
        }
        if (n <= 0) {
            return RankingResult.empty(groupColumn, valueColumn);
        }

        Map<Object, Double> totals = sumBy(dataset, groupColumn, valueColumn);
        List<RankingEntry> entries = new ArrayList<>();
        totals.forEach((key, total) -> entries.add(new RankingEntry(key, total)));
        // List.sort is stable, so equal totals stay in first-seen order
        entries.sort(Comparator.comparingDouble(RankingEntry::total).reversed());
        return new RankingResult(groupColumn, valueColumn, entries.subList(0, Math.min(n, entries.size())));
    }

    /**
     * Sums {@code valueColumn} per calendar month of {@code dateColumn}, oldest month first.
     */
    public TrendResult trend(Dataset dataset, String dateColumn, String valueColumn) {
        if (!dataset.hasColumn(dateColumn) || !dataset.hasColumn(valueColumn)) {
            LOGGER.warn("Cannot build trend of '{}' by '{}': column missing from dataset {}",
                    valueColumn, dateColumn, dataset.getColumns());
            return TrendResult.empty(valueColumn);
        }

        int dateIndex = dataset.columnIndex(dateColumn);
        int valueIndex = dataset.columnIndex(valueColumn);
        TreeMap<YearMonth, Double> monthly = new TreeMap<>();
        for (List<Object> row : dataset.getRows()) {
            Optional<LocalDateTime> date = CellValues.asDateTime(row.get(dateIndex));
            if (date.isEmpty()) {
                continue;
            }
            double value = CellValues.asDouble(row.get(valueIndex)).orElse(0.0);
            monthly.merge(YearMonth.from(date.get()), value, Double::sum);
        }

        List<TrendPoint> points = new ArrayList<>();
        Double previous = null;
        for (Map.Entry<YearMonth, Double> month : monthly.entrySet()) {
            double total = month.getValue();
            Double growth = previous == null || previous == 0.0 ? null : (total - previous) / previous * 100.0;
            points.add(new TrendPoint(month.getKey(), total, growth));
            previous = total;
        }
        return new TrendResult(valueColumn, points);
    }

    /**
     * Per-group sums of several value columns, groups in first-seen order. Returns a dataset with the
     * group column followed by the value columns; it has no rows when any requested column is absent.
     */
    public Dataset groupTotals(Dataset dataset, String groupColumn, List<String> valueColumns) {
        List<String> columns = new ArrayList<>();
        columns.add(groupColumn);
        columns.addAll(valueColumns);
        if (!columns.stream().allMatch(dataset::hasColumn)) {
            LOGGER.warn("Cannot total {} by '{}': column missing from dataset {}",
                    valueColumns, groupColumn, dataset.getColumns());
            return Dataset.empty(columns);
        }

        Map<Object, double[]> totals = new LinkedHashMap<>();
        int groupIndex = dataset.columnIndex(groupColumn);
        for (List<Object> row : dataset.getRows()) {
            Object key = row.get(groupIndex);
            if (key == null) {
                continue;
            }
            double[] sums = totals.computeIfAbsent(key, k -> new double[valueColumns.size()]);
            for (int i = 0; i < valueColumns.size(); i++) {
                sums[i] += CellValues.asDouble(row.get(dataset.columnIndex(valueColumns.get(i)))).orElse(0.0);
            }
        }

        Dataset.Builder builder = Dataset.builder(columns);
        totals.forEach((key, sums) -> {
            List<Object> values = new ArrayList<>();
            values.add(key);
            for (double sum : sums) {
                values.add(sum);
            }
            builder.addRow(values);
        });
        return builder.build();
    }

    private Optional<DateRange> dateRange(Dataset dataset, String dateColumn) {
        if (dateColumn == null || !dataset.hasColumn(dateColumn)) {
            LOGGER.debug("Date column '{}' not present, no date range", dateColumn);
            return Optional.empty();
        }
        int index = dataset.columnIndex(dateColumn);
        LocalDateTime start = null;
        LocalDateTime end = null;
        for (List<Object> row : dataset.getRows()) {
            Optional<LocalDateTime> value = CellValues.asDateTime(row.get(index));
            if (value.isEmpty()) {
                continue;
            }
            LocalDateTime date = value.get();
            if (start == null || date.isBefore(start)) {
                start = date;
            }
            if (end == null || date.isAfter(end)) {
                end = date;
            }
        }
        return start == null ? Optional.empty() : Optional.of(new DateRange(start, end));
    }

    private Map<Object, Double> sumBy(Dataset dataset, String groupColumn, String valueColumn) {
        int groupIndex = dataset.columnIndex(groupColumn);
        int valueIndex = dataset.columnIndex(valueColumn);
        Map<Object, Double> totals = new LinkedHashMap<>();
        for (List<Object> row : dataset.getRows()) {
            Object key = row.get(groupIndex);
            if (key == null) {
                continue;
            }
            double value = CellValues.asDouble(row.get(valueIndex)).orElse(0.0);
            totals.merge(key, value, Double::sum);
        }
        return totals;
    }

    /**
     * @return the non-null values of the column when all of them are numbers and there is at least one
     */
    private Optional<double[]> numericValues(Dataset dataset, String column) {
        int index = dataset.columnIndex(column);
        List<Double> values = new ArrayList<>();
        for (List<Object> row : dataset.getRows()) {
            Object value = row.get(index);
            if (value == null) {
                continue;
            }
            Optional<Double> number = CellValues.asDouble(value);
            if (number.isEmpty()) {
                return Optional.empty();
            }
            values.add(number.get());
        }
        if (values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(values.stream().mapToDouble(Double::doubleValue).toArray());
    }

    private ColumnStats describe(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int count = sorted.length;
        double mean = Arrays.stream(sorted).sum() / count;
        Double std = null;
        if (count > 1) {
            double squares = Arrays.stream(sorted).map(v -> (v - mean) * (v - mean)).sum();
            std = Math.sqrt(squares / (count - 1));
        }
        return new ColumnStats(count, mean, std,
                sorted[0],
                percentile(sorted, 0.25),
                percentile(sorted, 0.50),
                percentile(sorted, 0.75),
                sorted[count - 1]);
    }

    private double percentile(double[] sorted, double fraction) {
        double position = fraction * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }
}
