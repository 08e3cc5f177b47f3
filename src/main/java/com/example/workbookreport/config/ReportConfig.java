package com.example.workbookreport.config;

import com.example.workbookreport.analysis.ReportAnalyzer;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings of a single report generation.
 *
 * @param summarySourceSheet name of the dataset the executive summary analyses, {@code null} for the
 *                           first supplied dataset
 */
public record ReportConfig(String title,
                           Path outputPath,
                           boolean includeCharts,
                           boolean includeSummary,
                           boolean autoFormat,
                           String companyName,
                           String summarySourceSheet,
                           String summaryDateColumn,
                           List<ChartRequest> charts) {

    public static final String DEFAULT_COMPANY_NAME = "Company XYZ";

    public ReportConfig {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(outputPath, "outputPath");
        companyName = companyName == null ? DEFAULT_COMPANY_NAME : companyName;
        summarySourceSheet = summarySourceSheet == null || summarySourceSheet.isBlank() ? null : summarySourceSheet;
        summaryDateColumn = summaryDateColumn == null ? ReportAnalyzer.DEFAULT_DATE_COLUMN : summaryDateColumn;
        charts = charts == null ? List.of() : List.copyOf(charts);
    }

    public static Builder builder(String title, Path outputPath) {
        return new Builder(title, outputPath);
    }

    public Optional<String> getSummarySourceSheet() {
        return Optional.ofNullable(summarySourceSheet);
    }

    public static class Builder {
        private final String title;
        private final Path outputPath;
        private boolean includeCharts = true;
        private boolean includeSummary = true;
        private boolean autoFormat = true;
        private String companyName = DEFAULT_COMPANY_NAME;
        private String summarySourceSheet;
        private String summaryDateColumn = ReportAnalyzer.DEFAULT_DATE_COLUMN;
        private final List<ChartRequest> charts = new ArrayList<>();

        private Builder(String title, Path outputPath) {
            this.title = title;
            this.outputPath = outputPath;
        }

        public Builder includeCharts(boolean includeCharts) {
            this.includeCharts = includeCharts;
            return this;
        }

        public Builder includeSummary(boolean includeSummary) {
            this.includeSummary = includeSummary;
            return this;
        }

        public Builder autoFormat(boolean autoFormat) {
            this.autoFormat = autoFormat;
            return this;
        }

        public Builder companyName(String companyName) {
            this.companyName = companyName;
            return this;
        }

        public Builder summarySourceSheet(String summarySourceSheet) {
            this.summarySourceSheet = summarySourceSheet;
            return this;
        }

        public Builder summaryDateColumn(String summaryDateColumn) {
            this.summaryDateColumn = summaryDateColumn;
            return this;
        }

        public Builder chart(ChartRequest chart) {
            this.charts.add(chart);
            return this;
        }

        public Builder charts(List<ChartRequest> charts) {
            this.charts.addAll(charts);
            return this;
        }

        public ReportConfig build() {
            return new ReportConfig(title, outputPath, includeCharts, includeSummary, autoFormat,
                    companyName, summarySourceSheet, summaryDateColumn, charts);
        }
    }
}
