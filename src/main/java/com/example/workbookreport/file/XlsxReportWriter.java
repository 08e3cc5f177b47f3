package com.example.workbookreport.file;

import com.example.workbookreport.model.CellFormat;
import com.example.workbookreport.model.FailureCause;
import com.example.workbookreport.model.ReportWorkbook;
import com.example.workbookreport.model.WorksheetModel;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saves a {@link ReportWorkbook} as an .xlsx file. The document is rendered fully in memory, written
 * to a temporary file next to the target and then moved into place.
 */
public class XlsxReportWriter implements WorkbookPersistence {
    private static final Logger LOGGER = LoggerFactory.getLogger(XlsxReportWriter.class);
    private static final String DATE_FORMAT = "yyyy-mm-dd";
    private static final String DATE_TIME_FORMAT = "yyyy-mm-dd hh:mm:ss";
    private static final int MAX_EXCEL_COLUMN_WIDTH = 255;

    private final XlsxChartWriter chartWriter = new XlsxChartWriter();

    @Override
    public SaveResult save(ReportWorkbook workbook, Path target) {
        Path path = target.toAbsolutePath().normalize();

        byte[] content;
        try {
            content = render(workbook);
        } catch (IOException | RuntimeException e) {
            LOGGER.error("Failed to serialize workbook for {}", path, e);
            return SaveResult.failure(path, FailureCause.SERIALIZATION_ERROR,
                    "Failed to serialize workbook: " + e.getMessage());
        }

        try {
            write(content, path);
        } catch (IOException e) {
            LOGGER.error("Failed to write report to {}", path, e);
            return SaveResult.failure(path, FailureCause.OUTPUT_UNWRITABLE,
                    "Failed to write report to " + path + ": " + e.getMessage());
        }

        LOGGER.info("Report saved to {}", path);
        return SaveResult.success(path);
    }

    byte[] render(ReportWorkbook workbook) throws IOException {
        try (XSSFWorkbook xssfWorkbook = new XSSFWorkbook();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            StyleCache styles = new StyleCache(xssfWorkbook);
            for (WorksheetModel model : workbook.getSheets()) {
                renderSheet(xssfWorkbook, model, styles);
            }
            xssfWorkbook.write(outputStream);
            return outputStream.toByteArray();
        }
    }

    private void renderSheet(XSSFWorkbook xssfWorkbook, WorksheetModel model, StyleCache styles) {
        XSSFSheet sheet = xssfWorkbook.createSheet(model.getName());

        model.forEachCell((row, column, cell) -> {
            XSSFRow xssfRow = sheet.getRow(row - 1);
            if (xssfRow == null) {
                xssfRow = sheet.createRow(row - 1);
            }
            XSSFCell xssfCell = xssfRow.createCell(column - 1);
            String dataFormat = writeValue(xssfCell, cell.value(), model.getName());
            XSSFCellStyle style = styles.styleFor(cell.format(), dataFormat);
            if (style != null) {
                xssfCell.setCellStyle(style);
            }
        });

        model.getStyle().columnWidths().forEach((column, width) ->
                sheet.setColumnWidth(column - 1, Math.min(width, MAX_EXCEL_COLUMN_WIDTH) * 256));
        model.getMergedRegions().forEach(region -> sheet.addMergedRegion(region.toCellRangeAddress()));
        model.getCharts().forEach(chart -> chartWriter.draw(sheet, model, chart));
    }

    /**
     * @return the number format the value needs, {@code null} for none
     */
    private String writeValue(XSSFCell cell, Object value, String sheetName) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            cell.setCellValue(text);
            return null;
        }
        if (value instanceof Number number) {
            cell.setCellValue(number.doubleValue());
            return null;
        }
        if (value instanceof LocalDateTime dateTime) {
            cell.setCellValue(dateTime);
            return DATE_TIME_FORMAT;
        }
        if (value instanceof LocalDate date) {
            cell.setCellValue(date);
            return DATE_FORMAT;
        }
        throw new IllegalArgumentException(String.format("Cannot write value of type %s to %s!%s",
                value.getClass().getName(), sheetName, cell.getReference()));
    }

    private void write(byte[] content, Path target) throws IOException {
        Path directory = target.getParent();
        Files.createDirectories(directory);

        Path tempFile = Files.createTempFile(directory, "." + target.getFileName(), ".tmp");
        try {
            try (OutputStream outputStream = Files.newOutputStream(tempFile)) {
                outputStream.write(content);
            }
            try {
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                LOGGER.debug("Atomic move not supported in {}, replacing target directly", directory);
                Files.move(tempFile, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            deleteQuietly(tempFile);
        }
    }

    private void deleteQuietly(Path tempFile) {
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            LOGGER.warn("Could not remove temporary file {}", tempFile, e);
        }
    }

    /**
     * One cell style per distinct format, since a workbook holds a limited number of styles.
     */
    private static class StyleCache {
        private final XSSFWorkbook workbook;
        private final Map<StyleKey, XSSFCellStyle> styles = new HashMap<>();

        StyleCache(XSSFWorkbook workbook) {
            this.workbook = workbook;
        }

        XSSFCellStyle styleFor(CellFormat format, String dataFormat) {
            if (format == null && dataFormat == null) {
                return null;
            }
            return styles.computeIfAbsent(new StyleKey(format, dataFormat), this::createStyle);
        }

        private XSSFCellStyle createStyle(StyleKey key) {
            XSSFCellStyle style = workbook.createCellStyle();
            if (key.dataFormat() != null) {
                style.setDataFormat(workbook.createDataFormat().getFormat(key.dataFormat()));
            }
            CellFormat format = key.format();
            if (format == null) {
                return style;
            }

            XSSFFont font = workbook.createFont();
            font.setBold(format.bold());
            font.setFontHeightInPoints(format.fontSize());
            if (format.fontColor() != null) {
                font.setColor(color(format.fontColor()));
            }
            style.setFont(font);

            if (format.fillColor() != null) {
                style.setFillForegroundColor(color(format.fillColor()));
                style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            }
            if (format.centered()) {
                style.setAlignment(HorizontalAlignment.CENTER);
                style.setVerticalAlignment(VerticalAlignment.CENTER);
            }
            if (format.thinBorder()) {
                style.setBorderTop(BorderStyle.THIN);
                style.setBorderBottom(BorderStyle.THIN);
                style.setBorderLeft(BorderStyle.THIN);
                style.setBorderRight(BorderStyle.THIN);
            }
            return style;
        }

        private XSSFColor color(String rgbHex) {
            return new XSSFColor(HexFormat.of().parseHex(rgbHex), null);
        }
    }

    private record StyleKey(CellFormat format, String dataFormat) {
    }
}
