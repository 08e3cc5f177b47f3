package com.example.workbookreport.model;

import java.time.YearMonth;

/**
 * Total of one calendar month. {@code growthRatePercent} is relative to the previous month present in
 * the data and is {@code null} for the first month or when the previous total is zero.
 */
public record TrendPoint(YearMonth period, double total, Double growthRatePercent) {
}
