package com.example.workbookreport.report;

import com.example.workbookreport.analysis.ReportAnalyzer;
import com.example.workbookreport.config.ChartRequest;
import com.example.workbookreport.config.ReportConfig;
import com.example.workbookreport.file.SaveResult;
import com.example.workbookreport.file.WorkbookPersistence;
import com.example.workbookreport.file.XlsxReportWriter;
import com.example.workbookreport.model.Dataset;
import com.example.workbookreport.model.FailureCause;
import com.example.workbookreport.model.ReportWorkbook;
import com.example.workbookreport.model.SummaryStats;
import com.example.workbookreport.model.WorksheetModel;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the complete report workbook from datasets and persists it once at the end.
 */
public class WorkbookAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorkbookAssembler.class);

    private final ReportConfig config;
    private final WorkbookPersistence persistence;
    private final SheetPopulator populator;
    private final SheetFormatter formatter;
    private final ChartBinder chartBinder;
    private final ReportAnalyzer analyzer;
    private final SummaryComposer summaryComposer;

    public WorkbookAssembler(ReportConfig config) {
        this(config, new XlsxReportWriter(), Clock.systemDefaultZone());
    }

    public WorkbookAssembler(ReportConfig config, WorkbookPersistence persistence, Clock clock) {
        this(config, persistence, new SheetPopulator(), new SheetFormatter(new StylePolicy()),
                new ChartBinder(), new ReportAnalyzer(), new SummaryComposer(clock));
    }

    public WorkbookAssembler(ReportConfig config,
                             WorkbookPersistence persistence,
                             SheetPopulator populator,
                             SheetFormatter formatter,
                             ChartBinder chartBinder,
                             ReportAnalyzer analyzer,
                             SummaryComposer summaryComposer) {
        this.config = config;
        this.persistence = persistence;
        this.populator = populator;
        this.formatter = formatter;
        this.chartBinder = chartBinder;
        this.analyzer = analyzer;
        this.summaryComposer = summaryComposer;
    }

    /**
     * Generates the report for the datasets, keyed by sheet name in the order the sheets should appear.
     * Never throws: every failure is reported through the returned result.
     */
    public GenerationResult generate(Map<String, Dataset> datasets) {
        LOGGER.info("Generating report '{}' with {} dataset(s)", config.title(), datasets.size());

        ReportWorkbook workbook;
        try {
            workbook = assemble(datasets);
        } catch (RuntimeException e) {
            LOGGER.error("Failed to assemble report '{}'", config.title(), e);
            return GenerationResult.failure(config.outputPath(), FailureCause.ASSEMBLY_ERROR, e.getMessage());
        }

        SaveResult saved = persistence.save(workbook, config.outputPath());
        if (!saved.isSuccess()) {
            LOGGER.error("Report '{}' was not saved: {}", config.title(), saved.message());
            return GenerationResult.failure(saved.path(), saved.failureCause(), saved.message());
        }

        LOGGER.info("Report '{}' generated with sheets {}", config.title(), workbook.getSheetNames());
        return GenerationResult.success(saved.path(), workbook.getSheetNames());
    }

    ReportWorkbook assemble(Map<String, Dataset> datasets) {
        ReportWorkbook workbook = new ReportWorkbook();
        LOGGER.debug("Workbook created");

        for (Map.Entry<String, Dataset> entry : datasets.entrySet()) {
            WorksheetModel sheet = workbook.createSheet(entry.getKey());
            populator.populate(sheet, entry.getValue());
            if (config.autoFormat()) {
                formatter.format(sheet);
            }
        }

        if (config.includeCharts()) {
            bindCharts(workbook);
        }

        if (config.includeSummary()) {
            if (datasets.isEmpty()) {
                LOGGER.info("No datasets supplied, skipping the summary sheet");
            } else {
                addSummarySheet(workbook, datasets);
            }
        }

        workbook.seal();
        return workbook;
    }

    private void bindCharts(ReportWorkbook workbook) {
        for (ChartRequest request : config.charts()) {
            Optional<WorksheetModel> sheet = workbook.getSheet(request.sheetName());
            if (sheet.isEmpty()) {
                LOGGER.warn("Skipping chart '{}': no sheet named '{}'", request.title(), request.sheetName());
                continue;
            }
            chartBinder.bindColumns(sheet.get(), request.kind(), request.title(),
                    request.firstColumn(), request.lastColumn());
        }
    }

    private void addSummarySheet(ReportWorkbook workbook, Map<String, Dataset> datasets) {
        Dataset source = summarySource(datasets);
        SummaryStats stats = analyzer.summaryStats(source, config.summaryDateColumn());

        Map<String, Integer> recordCounts = new LinkedHashMap<>();
        datasets.forEach((name, dataset) -> recordCounts.put(name, dataset.getRowCount()));

        WorksheetModel summarySheet = workbook.createSheet(SummaryComposer.SHEET_NAME);
        summaryComposer.compose(summarySheet, config, stats, recordCounts);
        formatter.format(summarySheet);
    }

    private Dataset summarySource(Map<String, Dataset> datasets) {
        Dataset first = datasets.values().iterator().next();
        Optional<String> designated = config.getSummarySourceSheet();
        if (designated.isEmpty()) {
            return first;
        }
        Dataset source = datasets.get(designated.get());
        if (source == null) {
            LOGGER.warn("Summary source sheet '{}' not found, analysing the first dataset instead", designated.get());
            return first;
        }
        return source;
    }
}
