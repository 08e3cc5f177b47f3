package com.example.workbookreport.model;

/**
 * Chart drawn from a block of sheet cells. The first row of {@code source} holds the series titles,
 * the first column the category labels.
 */
public record ChartSpec(ChartKind kind, String title, SheetRange source, CellPosition anchor) {
}
