package com.example.workbookreport.model;

import org.apache.poi.ss.util.CellRangeAddress;

/**
 * Rectangular block of cells on a named sheet, 1-indexed and inclusive on both ends.
 */
public record SheetRange(String sheetName, int firstColumn, int lastColumn, int firstRow, int lastRow) {

    public SheetRange {
        if (firstColumn < 1 || firstRow < 1 || lastColumn < firstColumn || lastRow < firstRow) {
            throw new IllegalArgumentException(String.format("Invalid range columns %d-%d rows %d-%d",
                    firstColumn, lastColumn, firstRow, lastRow));
        }
    }

    public int columnCount() {
        return lastColumn - firstColumn + 1;
    }

    public int rowCount() {
        return lastRow - firstRow + 1;
    }

    public CellRangeAddress toCellRangeAddress() {
        return new CellRangeAddress(firstRow - 1, lastRow - 1, firstColumn - 1, lastColumn - 1);
    }

    @Override
    public String toString() {
        return toCellRangeAddress().formatAsString(sheetName, true);
    }
}
