package com.example.workbookreport.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One named sheet of a report: a sparse grid of cells addressed by 1-indexed row and column,
 * plus merged regions, bound charts and formatting state.
 */
public class WorksheetModel {
    private final String name;
    private final NavigableMap<Integer, NavigableMap<Integer, SheetCell>> cells = new TreeMap<>();
    private final List<SheetRange> mergedRegions = new ArrayList<>();
    private final List<ChartSpec> charts = new ArrayList<>();
    private SheetStyle style = SheetStyle.unstyled();
    private boolean populated;
    private boolean sealed;

    public WorksheetModel(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public void setCell(int row, int column, Object value, CellRole role) {
        checkWritable();
        CellPosition position = new CellPosition(row, column);
        cells.computeIfAbsent(position.row(), r -> new TreeMap<>())
                .put(position.column(), new SheetCell(value, role, null));
    }

    public void setCellFormat(int row, int column, CellFormat format) {
        checkWritable();
        SheetCell cell = getCell(row, column)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No cell at " + new CellPosition(row, column).toA1() + " in sheet " + name));
        cells.get(row).put(column, cell.withFormat(format));
    }

    public Optional<SheetCell> getCell(int row, int column) {
        NavigableMap<Integer, SheetCell> rowCells = cells.get(row);
        return rowCells == null ? Optional.empty() : Optional.ofNullable(rowCells.get(column));
    }

    public Object getValue(int row, int column) {
        return getCell(row, column).map(SheetCell::value).orElse(null);
    }

    /**
     * Visits every populated cell in row-major order.
     */
    public void forEachCell(CellVisitor visitor) {
        cells.forEach((row, rowCells) -> rowCells.forEach((column, cell) -> visitor.visit(row, column, cell)));
    }

    /**
     * @return populated cells of one row keyed by column
     */
    public Map<Integer, SheetCell> getRow(int row) {
        NavigableMap<Integer, SheetCell> rowCells = cells.get(row);
        return rowCells == null ? Map.of() : Collections.unmodifiableMap(rowCells);
    }

    public List<Object> getRowValues(int row) {
        List<Object> values = new ArrayList<>();
        for (int column = 1; column <= getColumnCount(); column++) {
            values.add(getValue(row, column));
        }
        return values;
    }

    /**
     * @return the last populated row, 0 for an empty sheet
     */
    public int getRowCount() {
        return cells.isEmpty() ? 0 : cells.lastKey();
    }

    /**
     * @return the last populated column over all rows, 0 for an empty sheet
     */
    public int getColumnCount() {
        return cells.values().stream()
                .filter(rowCells -> !rowCells.isEmpty())
                .mapToInt(NavigableMap::lastKey)
                .max()
                .orElse(0);
    }

    public boolean isPopulated() {
        return populated;
    }

    public void markPopulated() {
        checkWritable();
        if (populated) {
            throw new IllegalStateException("Sheet '" + name + "' has already been populated");
        }
        populated = true;
    }

    public void mergeCells(SheetRange range) {
        checkWritable();
        if (!name.equals(range.sheetName())) {
            throw new IllegalArgumentException("Range " + range + " does not belong to sheet " + name);
        }
        mergedRegions.add(range);
    }

    public List<SheetRange> getMergedRegions() {
        return Collections.unmodifiableList(mergedRegions);
    }

    public void addChart(ChartSpec chart) {
        checkWritable();
        charts.add(chart);
    }

    public List<ChartSpec> getCharts() {
        return Collections.unmodifiableList(charts);
    }

    public SheetStyle getStyle() {
        return style;
    }

    public void setStyle(SheetStyle style) {
        checkWritable();
        this.style = style;
    }

    public boolean isSealed() {
        return sealed;
    }

    void seal() {
        sealed = true;
    }

    private void checkWritable() {
        if (sealed) {
            throw new IllegalStateException("Sheet '" + name + "' is sealed and can no longer change");
        }
    }

    @FunctionalInterface
    public interface CellVisitor {
        void visit(int row, int column, SheetCell cell);
    }
}
