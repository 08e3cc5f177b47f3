package com.example.workbookreport.config;

import com.example.workbookreport.analysis.ReportAnalyzer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Properties;

public class AppConfig {
    private final Properties properties = new Properties();

    public AppConfig() {
        this("config.properties");
    }

    public AppConfig(String resourceName) {
        loadProperties(resourceName);
    }

    public void loadProperties(String resourceName) {
        try (InputStream inputStream = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (inputStream == null) {
                throw new IllegalStateException("Unable to find configuration file: " + resourceName);
            }
            properties.load(inputStream);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load configuration file: " + resourceName, e);
        }
    }

    public String getReportTitle() {
        return properties.getProperty("report.title", "Automated Report");
    }

    public String getCompanyName() {
        return properties.getProperty("report.company", ReportConfig.DEFAULT_COMPANY_NAME);
    }

    public Path getOutputDirectory() {
        String directory = properties.getProperty("output.directory", "generated-reports");
        return Paths.get(directory).toAbsolutePath().normalize();
    }

    public DateTimeFormatter getOutputFileFormatter() {
        String pattern = properties.getProperty("output.file.pattern", "'automatic_report_'yyyyMMdd_HHmmss'.xlsx'");
        try {
            return DateTimeFormatter.ofPattern(pattern);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid output.file.pattern: " + pattern, e);
        }
    }

    public Path resolveOutputPath(LocalDateTime timestamp) {
        return getOutputDirectory().resolve(getOutputFileFormatter().format(timestamp));
    }

    public boolean isChartsEnabled() {
        return Boolean.parseBoolean(properties.getProperty("report.include.charts", "true"));
    }

    public boolean isSummaryEnabled() {
        return Boolean.parseBoolean(properties.getProperty("report.include.summary", "true"));
    }

    public boolean isAutoFormatEnabled() {
        return Boolean.parseBoolean(properties.getProperty("report.auto.format", "true"));
    }

    public String getSummarySourceSheet() {
        String sheet = properties.getProperty("summary.source.sheet", "");
        return sheet.isBlank() ? null : sheet.trim();
    }

    public String getSummaryDateColumn() {
        return properties.getProperty("summary.date.column", ReportAnalyzer.DEFAULT_DATE_COLUMN);
    }

    public int getRankingTopN() {
        return getInt("ranking.top.n", 5);
    }

    public long getSampleSeed() {
        String value = properties.getProperty("sample.seed", "42");
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid sample.seed: " + value, e);
        }
    }

    public int getSampleSalesDays() {
        return getInt("sample.sales.days", 90);
    }

    public int getSampleFinancialMonths() {
        return getInt("sample.financial.months", 12);
    }

    public ReportConfig toReportConfig(Path outputPath, List<ChartRequest> charts) {
        return ReportConfig.builder(getReportTitle(), outputPath)
                .companyName(getCompanyName())
                .includeCharts(isChartsEnabled())
                .includeSummary(isSummaryEnabled())
                .autoFormat(isAutoFormatEnabled())
                .summarySourceSheet(getSummarySourceSheet())
                .summaryDateColumn(getSummaryDateColumn())
                .charts(charts)
                .build();
    }

    private int getInt(String key, int defaultValue) {
        String value = properties.getProperty(key, String.valueOf(defaultValue));
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid value for " + key + ": " + value, e);
        }
    }
}
