package com.example.workbookreport.report;

import com.example.workbookreport.config.ReportConfig;
import com.example.workbookreport.model.CellRole;
import com.example.workbookreport.model.ColumnStats;
import com.example.workbookreport.model.DateRange;
import com.example.workbookreport.model.SheetRange;
import com.example.workbookreport.model.SummaryStats;
import com.example.workbookreport.model.WorksheetModel;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays out the executive summary sheet as labelled lines rather than a table with a header row.
 */
public class SummaryComposer {
    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryComposer.class);
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("dd/MM/yyyy");

    public static final String SHEET_NAME = "Executive Summary";
    static final int TITLE_COLUMN_SPAN = 5;
    static final List<String> NUMERIC_SUMMARY_HEADERS =
            List.of("column", "count", "mean", "std", "min", "25%", "50%", "75%", "max");

    private final Clock clock;

    public SummaryComposer(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param sheetRecordCounts record count of every data sheet, in sheet order
     */
    public void compose(WorksheetModel sheet, ReportConfig config, SummaryStats stats, Map<String, Integer> sheetRecordCounts) {
        sheet.markPopulated();

        sheet.setCell(1, 1, "EXECUTIVE REPORT - " + config.companyName(), CellRole.TITLE);
        sheet.mergeCells(new SheetRange(sheet.getName(), 1, TITLE_COLUMN_SPAN, 1, 1));
        sheet.setCell(2, 1, config.title(), CellRole.BODY);
        sheet.setCell(3, 1, "Generated at: " + TIMESTAMP_FORMATTER.format(LocalDateTime.now(clock)), CellRole.BODY);

        int row = 5;
        sheet.setCell(row, 1, "GENERAL STATISTICS", CellRole.SECTION);
        sheet.setCell(++row, 1, "Total records: " + stats.getTotalRecords(), CellRole.BODY);
        Optional<DateRange> dateRange = stats.getDateRange();
        if (dateRange.isPresent()) {
            sheet.setCell(++row, 1, String.format("Period: %s to %s",
                    DATE_FORMATTER.format(dateRange.get().start()),
                    DATE_FORMATTER.format(dateRange.get().end())), CellRole.BODY);
        }

        row = writeSheetOverview(sheet, row + 2, sheetRecordCounts);
        if (stats.hasNumericSummary()) {
            writeNumericSummary(sheet, row + 2, stats.getNumericSummary());
        }

        LOGGER.info("Summary sheet '{}' created", sheet.getName());
    }

    private int writeSheetOverview(WorksheetModel sheet, int startRow, Map<String, Integer> sheetRecordCounts) {
        int row = startRow;
        sheet.setCell(row, 1, "SHEETS", CellRole.SECTION);
        row++;
        sheet.setCell(row, 1, "sheet", CellRole.HEADER);
        sheet.setCell(row, 2, "records", CellRole.HEADER);
        for (Map.Entry<String, Integer> entry : sheetRecordCounts.entrySet()) {
            row++;
            sheet.setCell(row, 1, entry.getKey(), CellRole.BODY);
            sheet.setCell(row, 2, entry.getValue(), CellRole.BODY);
        }
        return row;
    }

    private void writeNumericSummary(WorksheetModel sheet, int startRow, Map<String, ColumnStats> numericSummary) {
        int row = startRow;
        sheet.setCell(row, 1, "NUMERIC SUMMARY", CellRole.SECTION);
        row++;
        for (int i = 0; i < NUMERIC_SUMMARY_HEADERS.size(); i++) {
            sheet.setCell(row, i + 1, NUMERIC_SUMMARY_HEADERS.get(i), CellRole.HEADER);
        }
        for (Map.Entry<String, ColumnStats> entry : numericSummary.entrySet()) {
            row++;
            ColumnStats stats = entry.getValue();
            Object[] values = {
                    entry.getKey(),
                    stats.count(),
                    round(stats.mean()),
                    stats.std() == null ? null : round(stats.std()),
                    round(stats.min()),
                    round(stats.firstQuartile()),
                    round(stats.median()),
                    round(stats.thirdQuartile()),
                    round(stats.max())
            };
            for (int i = 0; i < values.length; i++) {
                sheet.setCell(row, i + 1, values[i], CellRole.BODY);
            }
        }
    }

    private static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
