package com.example.workbookreport.model;

import org.apache.poi.ss.util.CellReference;

/**
 * One-based row and column of a cell.
 */
public record CellPosition(int row, int column) {

    public CellPosition {
        if (row < 1 || column < 1) {
            throw new IllegalArgumentException("Cell positions are 1-indexed: " + row + "," + column);
        }
    }

    public String toA1() {
        return CellReference.convertNumToColString(column - 1) + row;
    }

    @Override
    public String toString() {
        return toA1();
    }
}
