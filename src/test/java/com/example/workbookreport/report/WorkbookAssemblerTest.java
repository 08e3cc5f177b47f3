package com.example.workbookreport.report;

import com.example.workbookreport.config.ChartRequest;
import com.example.workbookreport.config.ReportConfig;
import com.example.workbookreport.file.SaveResult;
import com.example.workbookreport.file.WorkbookPersistence;
import com.example.workbookreport.model.CellRole;
import com.example.workbookreport.model.ChartKind;
import com.example.workbookreport.model.Dataset;
import com.example.workbookreport.model.FailureCause;
import com.example.workbookreport.model.ReportWorkbook;
import com.example.workbookreport.model.SheetStyle;
import com.example.workbookreport.model.WorksheetModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class WorkbookAssemblerTest {

    private static final Path OUTPUT = Path.of("target", "assembler-test.xlsx").toAbsolutePath();
    private final Clock clock = Clock.fixed(Instant.parse("2024-05-10T09:00:00Z"), ZoneOffset.UTC);

    @Mock
    private WorkbookPersistence persistence;

    @Captor
    private ArgumentCaptor<ReportWorkbook> workbookCaptor;

    private Map<String, Dataset> datasets;

    @BeforeEach
    public void setUp() {
        datasets = new LinkedHashMap<>();
        datasets.put("Sales", Dataset.builder("date", "seller", "amount")
                .addRow(LocalDate.of(2024, 1, 5), "Ann", 100.0)
                .addRow(LocalDate.of(2024, 2, 9), "Bob", 40.0)
                .addRow(LocalDate.of(2024, 2, 20), "Ann", 60.0)
                .build());
        datasets.put("Ranking", Dataset.builder("seller", "amount")
                .addRow("Ann", 160.0)
                .addRow("Bob", 40.0)
                .build());
    }

    private ReportConfig.Builder config() {
        return ReportConfig.builder("Monthly Report", OUTPUT);
    }

    private void persistenceSucceeds() {
        when(persistence.save(any(ReportWorkbook.class), any(Path.class)))
                .thenAnswer(invocation -> SaveResult.success(invocation.getArgument(1)));
    }

    private ReportWorkbook generateAndCapture(ReportConfig config) {
        GenerationResult result = new WorkbookAssembler(config, persistence, clock).generate(datasets);
        assertTrue(result.isSuccess());
        verify(persistence).save(workbookCaptor.capture(), eq(OUTPUT));
        return workbookCaptor.getValue();
    }

    /**************************************************************************
     * Sheet layout
     **************************************************************************/

    @Test
    public void testSheetsFollowInputOrderWithSummaryLast() {
        persistenceSucceeds();

        GenerationResult result = new WorkbookAssembler(config().build(), persistence, clock).generate(datasets);

        assertTrue(result.isSuccess());
        assertEquals(OUTPUT, result.getOutputPath());
        assertEquals(List.of("Sales", "Ranking", SummaryComposer.SHEET_NAME), result.getSheetNames());
        assertTrue(result.getFailureCause().isEmpty());
    }

    @Test
    public void testSummaryCanBeTurnedOff() {
        persistenceSucceeds();

        ReportWorkbook workbook = generateAndCapture(config().includeSummary(false).build());

        assertEquals(List.of("Sales", "Ranking"), workbook.getSheetNames());
    }

    @Test
    public void testNoDatasetsMeansNoSummarySheet() {
        persistenceSucceeds();
        datasets.clear();

        ReportWorkbook workbook = generateAndCapture(config().build());

        assertEquals(0, workbook.getSheetCount());
    }

    @Test
    public void testWorkbookIsSealedBeforeSaving() {
        persistenceSucceeds();

        ReportWorkbook workbook = generateAndCapture(config().build());

        assertTrue(workbook.isSealed());
        WorksheetModel sales = workbook.getSheet("Sales").orElseThrow();
        assertThrows(IllegalStateException.class, () -> sales.setCell(10, 1, "late", CellRole.BODY));
    }

    /**************************************************************************
     * Formatting
     **************************************************************************/

    @Test
    public void testDataSheetsAreFormattedByDefault() {
        persistenceSucceeds();

        ReportWorkbook workbook = generateAndCapture(config().build());

        SheetStyle style = workbook.getSheet("Ranking").orElseThrow().getStyle();
        assertTrue(style.headerStyled());
        assertTrue(style.bordered());
        assertEquals(List.of(1, 2), List.copyOf(style.columnWidths().keySet()));
    }

    @Test
    public void testAutoFormatOffLeavesDataSheetsUnstyledButFormatsSummary() {
        persistenceSucceeds();

        ReportWorkbook workbook = generateAndCapture(config().autoFormat(false).build());

        assertEquals(SheetStyle.unstyled(), workbook.getSheet("Sales").orElseThrow().getStyle());
        assertEquals(SheetStyle.unstyled(), workbook.getSheet("Ranking").orElseThrow().getStyle());
        assertTrue(workbook.getSheet(SummaryComposer.SHEET_NAME).orElseThrow().getStyle().bordered());
    }

    /**************************************************************************
     * Summary source
     **************************************************************************/

    @Test
    public void testSummaryAnalysesFirstDatasetByDefault() {
        persistenceSucceeds();

        ReportWorkbook workbook = generateAndCapture(config().build());

        WorksheetModel summary = workbook.getSheet(SummaryComposer.SHEET_NAME).orElseThrow();
        assertEquals("Total records: 3", summary.getValue(6, 1));
        assertEquals("Period: 05/01/2024 to 20/02/2024", summary.getValue(7, 1));
    }

    @Test
    public void testSummaryAnalysesDesignatedSheet() {
        persistenceSucceeds();

        ReportWorkbook workbook = generateAndCapture(config().summarySourceSheet("Ranking").build());

        WorksheetModel summary = workbook.getSheet(SummaryComposer.SHEET_NAME).orElseThrow();
        assertEquals("Total records: 2", summary.getValue(6, 1));
        assertEquals("SHEETS", summary.getValue(8, 1));
    }

    @Test
    public void testUnknownSummarySheetFallsBackToFirstDataset() {
        persistenceSucceeds();

        ReportWorkbook workbook = generateAndCapture(config().summarySourceSheet("Missing").build());

        WorksheetModel summary = workbook.getSheet(SummaryComposer.SHEET_NAME).orElseThrow();
        assertEquals("Total records: 3", summary.getValue(6, 1));
    }

    /**************************************************************************
     * Charts
     **************************************************************************/

    @Test
    public void testRequestedChartsAreBound() {
        persistenceSucceeds();

        ReportWorkbook workbook = generateAndCapture(config()
                .chart(new ChartRequest("Ranking", "bar", "Top Sellers", 1, 2))
                .chart(new ChartRequest("Nowhere", "line", "Lost", 1, 2))
                .chart(new ChartRequest("Sales", "pie", "Share", 2, 3))
                .build());

        WorksheetModel ranking = workbook.getSheet("Ranking").orElseThrow();
        assertEquals(1, ranking.getCharts().size());
        assertEquals(ChartKind.BAR, ranking.getCharts().get(0).kind());
        assertTrue(workbook.getSheet("Sales").orElseThrow().getCharts().isEmpty());
    }

    @Test
    public void testChartsCanBeTurnedOff() {
        persistenceSucceeds();

        ReportWorkbook workbook = generateAndCapture(config()
                .includeCharts(false)
                .chart(new ChartRequest("Ranking", "bar", "Top Sellers", 1, 2))
                .build());

        assertTrue(workbook.getSheet("Ranking").orElseThrow().getCharts().isEmpty());
    }

    /**************************************************************************
     * Failures
     **************************************************************************/

    @Test
    public void testPersistenceFailureIsReported() {
        when(persistence.save(any(ReportWorkbook.class), any(Path.class)))
                .thenReturn(SaveResult.failure(OUTPUT, FailureCause.OUTPUT_UNWRITABLE, "disk full"));

        GenerationResult result = new WorkbookAssembler(config().build(), persistence, clock).generate(datasets);

        assertFalse(result.isSuccess());
        assertEquals(FailureCause.OUTPUT_UNWRITABLE, result.getFailureCause().orElseThrow());
        assertEquals("disk full", result.getMessage().orElseThrow());
        assertTrue(result.getSheetNames().isEmpty());
    }

    @Test
    public void testSheetNamesDifferingOnlyInCaseFailAssembly() {
        datasets.put("SALES", Dataset.builder("x").addRow(1).build());

        GenerationResult result = new WorkbookAssembler(config().build(), persistence, clock).generate(datasets);

        assertEquals(FailureCause.ASSEMBLY_ERROR, result.getFailureCause().orElseThrow());
        verify(persistence, never()).save(any(), any());
    }

    @Test
    public void testIllegalSheetNameFailsAssembly() {
        datasets.put("Q1/Q2", Dataset.builder("x").addRow(1).build());

        GenerationResult result = new WorkbookAssembler(config().build(), persistence, clock).generate(datasets);

        assertFalse(result.isSuccess());
        assertEquals(FailureCause.ASSEMBLY_ERROR, result.getFailureCause().orElseThrow());
        verify(persistence, never()).save(any(), any());
    }

    @Test
    public void testDataSheetNamedLikeSummaryFailsAssembly() {
        datasets.put(SummaryComposer.SHEET_NAME, Dataset.builder("x").addRow(1).build());

        GenerationResult result = new WorkbookAssembler(config().build(), persistence, clock).generate(datasets);

        assertEquals(FailureCause.ASSEMBLY_ERROR, result.getFailureCause().orElseThrow());
        verify(persistence, never()).save(any(), any());
    }
}
