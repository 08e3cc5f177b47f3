package com.example.workbookreport.model;

/**
 * Descriptive statistics of one numeric column. {@code std} is the sample standard deviation and is
 * {@code null} when fewer than two values are present.
 */
public record ColumnStats(long count,
                          double mean,
                          Double std,
                          double min,
                          double firstQuartile,
                          double median,
                          double thirdQuartile,
                          double max) {
}
