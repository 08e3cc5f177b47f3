package com.example.workbookreport.report;

import com.example.workbookreport.model.CellPosition;
import com.example.workbookreport.model.ChartKind;
import com.example.workbookreport.model.ChartSpec;
import com.example.workbookreport.model.SheetRange;
import com.example.workbookreport.model.WorksheetModel;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches chart definitions to sheets. Charts are decoration: anything that cannot be charted is
 * skipped with a warning instead of failing the report.
 */
public class ChartBinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChartBinder.class);
    static final int DEFAULT_ANCHOR_ROW = 2;

    public ChartBindingResult bind(WorksheetModel sheet, String kind, SheetRange range, String title, CellPosition anchor) {
        Optional<ChartKind> chartKind = ChartKind.fromName(kind);
        if (chartKind.isEmpty()) {
            return skip(sheet, "unsupported chart kind '" + kind + "'");
        }
        if (!sheet.getName().equals(range.sheetName())) {
            return skip(sheet, "range " + range + " belongs to another sheet");
        }
        if (range.lastRow() > sheet.getRowCount() || range.lastColumn() > sheet.getColumnCount()) {
            return skip(sheet, "range " + range + " lies outside the populated cells");
        }
        if (range.rowCount() < 2) {
            return skip(sheet, "range " + range + " has no data rows below its title row");
        }

        ChartSpec chart = new ChartSpec(chartKind.get(), title, range, anchor);
        sheet.addChart(chart);
        LOGGER.info("Chart '{}' ({}) added to sheet '{}' at {}", title, chartKind.get(), sheet.getName(), anchor);
        return ChartBindingResult.bound(chart);
    }

    /**
     * Binds a chart over the full height of the given columns, anchored next to the data.
     */
    public ChartBindingResult bindColumns(WorksheetModel sheet, String kind, String title, int firstColumn, int lastColumn) {
        if (sheet.getRowCount() < 1 || firstColumn < 1 || lastColumn < firstColumn) {
            return skip(sheet, "columns " + firstColumn + "-" + lastColumn + " cannot be charted");
        }
        SheetRange range = new SheetRange(sheet.getName(), firstColumn, lastColumn, 1, sheet.getRowCount());
        return bind(sheet, kind, range, title, defaultAnchor(sheet));
    }

    /**
     * Row 2, leaving one empty column between the data and the chart.
     */
    public CellPosition defaultAnchor(WorksheetModel sheet) {
        return new CellPosition(DEFAULT_ANCHOR_ROW, sheet.getColumnCount() + 2);
    }

    private ChartBindingResult skip(WorksheetModel sheet, String reason) {
        LOGGER.warn("Skipping chart on sheet '{}': {}", sheet.getName(), reason);
        return ChartBindingResult.skipped(reason);
    }
}
