package com.example.workbookreport;

import com.example.workbookreport.analysis.ReportAnalyzer;
import com.example.workbookreport.config.AppConfig;
import com.example.workbookreport.config.ChartRequest;
import com.example.workbookreport.config.ReportConfig;
import com.example.workbookreport.data.SampleDataGenerator;
import com.example.workbookreport.file.XlsxReportWriter;
import com.example.workbookreport.model.Dataset;
import com.example.workbookreport.report.GenerationResult;
import com.example.workbookreport.report.WorkbookAssembler;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    static final String SALES_SHEET = "Sales Detail";
    static final String FINANCIAL_SHEET = "Financials";
    static final String TOP_SELLERS_SHEET = "Top Sellers";
    static final String TOP_PRODUCTS_SHEET = "Top Products";
    static final String REGION_SHEET = "Region Summary";
    static final String TREND_SHEET = "Monthly Trend";

    public static void main(String[] args) {
        App app = new App();
        try {
            GenerationResult result = app.run(new AppConfig(), Clock.systemDefaultZone());
            if (!result.isSuccess()) {
                System.exit(1);
            }
        } catch (Exception e) {
            LOGGER.error("Failed to generate report", e);
            System.exit(1);
        }
    }

    GenerationResult run(AppConfig config, Clock clock) {
        SampleDataGenerator generator = new SampleDataGenerator(config.getSampleSeed(), clock);
        Map<String, Dataset> datasets = buildDatasets(config,
                generator.generateSales(config.getSampleSalesDays()),
                generator.generateFinancials(config.getSampleFinancialMonths()));

        Path outputPath = config.resolveOutputPath(LocalDateTime.now(clock));
        ReportConfig reportConfig = config.toReportConfig(outputPath, List.of(
                new ChartRequest(TOP_SELLERS_SHEET, "bar", "Top Sellers by Net Value", 1, 2),
                new ChartRequest(TREND_SHEET, "line", "Monthly Net Value", 1, 2)));

        WorkbookAssembler assembler = new WorkbookAssembler(reportConfig, new XlsxReportWriter(), clock);
        GenerationResult result = assembler.generate(datasets);
        if (result.isSuccess()) {
            LOGGER.info("Report written to {} with sheets {}", result.getOutputPath(), result.getSheetNames());
        } else {
            LOGGER.error("Report generation failed ({}): {}",
                    result.getFailureCause().orElseThrow(), result.getMessage().orElse(""));
        }
        return result;
    }

    Map<String, Dataset> buildDatasets(AppConfig config, Dataset sales, Dataset financials) {
        ReportAnalyzer analyzer = new ReportAnalyzer();
        int topN = config.getRankingTopN();

        Map<String, Dataset> datasets = new LinkedHashMap<>();
        datasets.put(SALES_SHEET, sales);
        datasets.put(FINANCIAL_SHEET, financials);
        datasets.put(TOP_SELLERS_SHEET, analyzer.topPerformers(sales, "seller", "net_value", topN).toDataset());
        datasets.put(TOP_PRODUCTS_SHEET, analyzer.topPerformers(sales, "product", "net_value", topN).toDataset());
        datasets.put(REGION_SHEET, analyzer.groupTotals(sales, "region", List.of("net_value", "quantity")));
        datasets.put(TREND_SHEET, analyzer.trend(sales, "date", "net_value").toDataset());
        return datasets;
    }
}
