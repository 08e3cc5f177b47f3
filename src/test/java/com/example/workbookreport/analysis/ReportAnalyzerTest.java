package com.example.workbookreport.analysis;

import com.example.workbookreport.model.ColumnStats;
import com.example.workbookreport.model.Dataset;
import com.example.workbookreport.model.DateRange;
import com.example.workbookreport.model.RankingEntry;
import com.example.workbookreport.model.RankingResult;
import com.example.workbookreport.model.SummaryStats;
import com.example.workbookreport.model.TrendPoint;
import com.example.workbookreport.model.TrendResult;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ReportAnalyzerTest {

    private final ReportAnalyzer analyzer = new ReportAnalyzer();

    private Dataset regionSales() {
        return Dataset.builder("region", "amount")
                .addRow("North", 100)
                .addRow("South", 50)
                .addRow("North", 25)
                .build();
    }

    /**************************************************************************
     * Top performers
     **************************************************************************/

    @Test
    public void testTopPerformersSumsPerGroupDescending() {
        RankingResult result = analyzer.topPerformers(regionSales(), "region", "amount", 5);

        assertEquals(List.of(new RankingEntry("North", 125.0), new RankingEntry("South", 50.0)), result.getEntries());
    }

    @Test
    public void testTopPerformersTruncatesToN() {
        Dataset dataset = Dataset.builder("seller", "value")
                .addRow("a", 1).addRow("b", 5).addRow("c", 3).addRow("d", 4)
                .build();

        RankingResult result = analyzer.topPerformers(dataset, "seller", "value", 2);

        assertEquals(2, result.size());
        assertEquals("b", result.getEntries().get(0).groupKey());
        assertEquals("d", result.getEntries().get(1).groupKey());
    }

    @Test
    public void testTopPerformersKeepsFirstSeenOrderForTies() {
        Dataset dataset = Dataset.builder("seller", "value")
                .addRow("late", 10)
                .addRow("early", 10)
                .addRow("big", 20)
                .addRow("late", 0)
                .build();

        RankingResult result = analyzer.topPerformers(dataset, "seller", "value", 3);

        assertEquals(List.of("big", "late", "early"),
                result.getEntries().stream().map(RankingEntry::groupKey).toList());
    }

    @Test
    public void testTopPerformersIsEmptyWhenAColumnIsMissing() {
        assertTrue(analyzer.topPerformers(regionSales(), "country", "amount", 5).isEmpty());
        assertTrue(analyzer.topPerformers(regionSales(), "region", "revenue", 5).isEmpty());
    }

    @Test
    public void testTopPerformersIgnoresNullKeysAndTreatsNullValuesAsZero() {
        Dataset dataset = Dataset.builder("region", "amount")
                .addRow(null, 500)
                .addRow("East", null)
                .addRow("West", 7)
                .build();

        RankingResult result = analyzer.topPerformers(dataset, "region", "amount", 5);

        assertEquals(List.of(new RankingEntry("West", 7.0), new RankingEntry("East", 0.0)), result.getEntries());
    }

    @Test
    public void testRankingConvertsToTwoColumnDataset() {
        Dataset ranked = analyzer.topPerformers(regionSales(), "region", "amount", 5).toDataset();

        assertEquals(List.of("region", "amount"), ranked.getColumns());
        assertEquals(List.of("North", 125.0), ranked.getRows().get(0));
    }

    /**************************************************************************
     * Trend
     **************************************************************************/

    @Test
    public void testTrendSumsPerMonthWithGrowthRate() {
        Dataset dataset = Dataset.builder("date", "amount")
                .addRow(LocalDate.of(2024, 1, 3), 60)
                .addRow(LocalDate.of(2024, 1, 28), 40)
                .addRow(LocalDateTime.of(2024, 2, 1, 9, 30), 150)
                .build();

        TrendResult trend = analyzer.trend(dataset, "date", "amount");

        assertEquals(List.of(
                new TrendPoint(YearMonth.of(2024, 1), 100.0, null),
                new TrendPoint(YearMonth.of(2024, 2), 150.0, 50.0)), trend.getPoints());
    }

    @Test
    public void testTrendIsChronologicalAndSkipsMonthsWithoutData() {
        Dataset dataset = Dataset.builder("date", "amount")
                .addRow(LocalDate.of(2024, 5, 1), 10)
                .addRow(LocalDate.of(2023, 12, 31), 20)
                .addRow(null, 99)
                .addRow(LocalDate.of(2024, 2, 10), 5)
                .build();

        TrendResult trend = analyzer.trend(dataset, "date", "amount");

        assertEquals(List.of(YearMonth.of(2023, 12), YearMonth.of(2024, 2), YearMonth.of(2024, 5)),
                trend.getPoints().stream().map(TrendPoint::period).toList());
        assertNull(trend.getPoints().get(0).growthRatePercent());
        assertEquals(-75.0, trend.getPoints().get(1).growthRatePercent().doubleValue(), 1e-9);
        assertEquals(100.0, trend.getPoints().get(2).growthRatePercent().doubleValue(), 1e-9);
    }

    @Test
    public void testTrendGrowthIsNullAfterAZeroMonth() {
        Dataset dataset = Dataset.builder("date", "amount")
                .addRow(LocalDate.of(2024, 1, 1), 0)
                .addRow(LocalDate.of(2024, 2, 1), 10)
                .build();

        TrendResult trend = analyzer.trend(dataset, "date", "amount");

        assertNull(trend.getPoints().get(1).growthRatePercent());
    }

    @Test
    public void testTrendIsEmptyWhenAColumnIsMissing() {
        assertTrue(analyzer.trend(regionSales(), "date", "amount").isEmpty());
    }

    @Test
    public void testTrendDatasetUsesMonthLabels() {
        Dataset dataset = Dataset.builder("date", "amount")
                .addRow(LocalDate.of(2024, 3, 15), 10)
                .build();

        Dataset table = analyzer.trend(dataset, "date", "amount").toDataset();

        assertEquals(List.of("period", "amount", "growth_rate"), table.getColumns());
        assertEquals("2024-03", table.getValue(0, "period"));
        assertNull(table.getValue(0, "growth_rate"));
    }

    /**************************************************************************
     * Summary statistics
     **************************************************************************/

    @Test
    public void testSummaryStatsDescribesNumericColumns() {
        Dataset dataset = Dataset.builder("date", "label", "value", "partly")
                .addRow(LocalDate.of(2024, 1, 10), "a", 1, 5.0)
                .addRow(LocalDate.of(2024, 3, 2), "b", 2, null)
                .addRow(LocalDate.of(2023, 11, 20), "c", 3, 7.0)
                .addRow(LocalDate.of(2024, 2, 1), "d", 4, null)
                .build();

        SummaryStats stats = analyzer.summaryStats(dataset);

        assertEquals(4, stats.getTotalRecords());
        assertEquals(new DateRange(LocalDateTime.of(2023, 11, 20, 0, 0), LocalDateTime.of(2024, 3, 2, 0, 0)),
                stats.getDateRange().orElseThrow());
        assertEquals(List.of("value", "partly"), List.copyOf(stats.getNumericSummary().keySet()));

        ColumnStats value = stats.getNumericSummary().get("value");
        assertEquals(4, value.count());
        assertEquals(2.5, value.mean(), 1e-9);
        assertEquals(1.2909944487, value.std().doubleValue(), 1e-9);
        assertEquals(1.0, value.min());
        assertEquals(1.75, value.firstQuartile(), 1e-9);
        assertEquals(2.5, value.median(), 1e-9);
        assertEquals(3.25, value.thirdQuartile(), 1e-9);
        assertEquals(4.0, value.max());

        ColumnStats partly = stats.getNumericSummary().get("partly");
        assertEquals(2, partly.count());
        assertEquals(6.0, partly.mean(), 1e-9);
    }

    @Test
    public void testSummaryStatsWithoutDateOrNumericColumnsIsPartial() {
        Dataset dataset = Dataset.builder("name", "city")
                .addRow("Ann", "Lisbon")
                .build();

        SummaryStats stats = analyzer.summaryStats(dataset);

        assertEquals(1, stats.getTotalRecords());
        assertTrue(stats.getDateRange().isEmpty());
        assertFalse(stats.hasNumericSummary());
    }

    @Test
    public void testSummaryStatsOfEmptyDatasetHasNoNumericBlock() {
        Dataset dataset = Dataset.empty(List.of("date", "amount"));

        SummaryStats stats = analyzer.summaryStats(dataset);

        assertEquals(0, stats.getTotalRecords());
        assertTrue(stats.getDateRange().isEmpty());
        assertTrue(stats.getNumericSummary().isEmpty());
    }

    @Test
    public void testSingleValueColumnHasNoStandardDeviation() {
        Dataset dataset = Dataset.builder("amount").addRow(42).build();

        ColumnStats stats = analyzer.summaryStats(dataset).getNumericSummary().get("amount");

        assertNull(stats.std());
        assertEquals(42.0, stats.median());
    }

    @Test
    public void testSummaryStatsUsesDesignatedDateColumn() {
        Dataset dataset = Dataset.builder("ordered_on", "amount")
                .addRow(LocalDate.of(2024, 6, 1), 1)
                .build();

        assertTrue(analyzer.summaryStats(dataset).getDateRange().isEmpty());
        assertTrue(analyzer.summaryStats(dataset, "ordered_on").getDateRange().isPresent());
    }

    /**************************************************************************
     * Group totals
     **************************************************************************/

    @Test
    public void testGroupTotalsSumsEachValueColumn() {
        Dataset dataset = Dataset.builder("region", "net", "qty")
                .addRow("North", 10.0, 1)
                .addRow("South", 5.0, 2)
                .addRow("North", 2.5, 3)
                .build();

        Dataset totals = analyzer.groupTotals(dataset, "region", List.of("net", "qty"));

        assertEquals(List.of("region", "net", "qty"), totals.getColumns());
        assertEquals(List.of(List.of("North", 12.5, 4.0), List.of("South", 5.0, 2.0)), totals.getRows());
    }

    @Test
    public void testGroupTotalsIsEmptyWhenAColumnIsMissing() {
        Dataset totals = analyzer.groupTotals(regionSales(), "region", List.of("amount", "qty"));

        assertEquals(List.of("region", "amount", "qty"), totals.getColumns());
        assertTrue(totals.isEmpty());
    }
}
