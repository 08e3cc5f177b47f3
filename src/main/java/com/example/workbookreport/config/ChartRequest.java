package com.example.workbookreport.config;

/**
 * Chart to draw over columns {@code firstColumn..lastColumn} (1-indexed) of a named sheet.
 */
public record ChartRequest(String sheetName, String kind, String title, int firstColumn, int lastColumn) {
}
