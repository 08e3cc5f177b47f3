package com.example.workbookreport.file;

import com.example.workbookreport.model.ChartKind;
import com.example.workbookreport.model.ChartSpec;
import com.example.workbookreport.model.SheetRange;
import com.example.workbookreport.model.WorksheetModel;
import com.example.workbookreport.util.CellValues;

import org.apache.poi.ss.util.CellReference;
import org.apache.poi.xddf.usermodel.chart.AxisCrosses;
import org.apache.poi.xddf.usermodel.chart.AxisPosition;
import org.apache.poi.xddf.usermodel.chart.BarDirection;
import org.apache.poi.xddf.usermodel.chart.ChartTypes;
import org.apache.poi.xddf.usermodel.chart.LegendPosition;
import org.apache.poi.xddf.usermodel.chart.XDDFBarChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFCategoryAxis;
import org.apache.poi.xddf.usermodel.chart.XDDFCategoryDataSource;
import org.apache.poi.xddf.usermodel.chart.XDDFChartData;
import org.apache.poi.xddf.usermodel.chart.XDDFChartLegend;
import org.apache.poi.xddf.usermodel.chart.XDDFDataSourcesFactory;
import org.apache.poi.xddf.usermodel.chart.XDDFNumericalDataSource;
import org.apache.poi.xddf.usermodel.chart.XDDFValueAxis;
import org.apache.poi.xssf.usermodel.XSSFChart;
import org.apache.poi.xssf.usermodel.XSSFClientAnchor;
import org.apache.poi.xssf.usermodel.XSSFDrawing;
import org.apache.poi.xssf.usermodel.XSSFSheet;

/**
 * Draws {@link ChartSpec}s as native spreadsheet charts. The first row of the source range titles each
 * series, the first column (when the range has more than one) labels the categories.
 */
class XlsxChartWriter {
    static final int CHART_WIDTH_COLUMNS = 8;
    static final int CHART_HEIGHT_ROWS = 15;

    void draw(XSSFSheet sheet, WorksheetModel model, ChartSpec chart) {
        XSSFDrawing drawing = sheet.createDrawingPatriarch();
        int anchorColumn = chart.anchor().column() - 1;
        int anchorRow = chart.anchor().row() - 1;
        XSSFClientAnchor anchor = drawing.createAnchor(0, 0, 0, 0,
                anchorColumn, anchorRow, anchorColumn + CHART_WIDTH_COLUMNS, anchorRow + CHART_HEIGHT_ROWS);

        XSSFChart xssfChart = drawing.createChart(anchor);
        xssfChart.setTitleText(chart.title());
        xssfChart.setTitleOverlay(false);
        XDDFChartLegend legend = xssfChart.getOrAddLegend();
        legend.setPosition(LegendPosition.BOTTOM);

        XDDFCategoryAxis bottomAxis = xssfChart.createCategoryAxis(AxisPosition.BOTTOM);
        XDDFValueAxis leftAxis = xssfChart.createValueAxis(AxisPosition.LEFT);
        leftAxis.setCrosses(AxisCrosses.AUTO_ZERO);

        XDDFChartData data = xssfChart.createData(
                chart.kind() == ChartKind.BAR ? ChartTypes.BAR : ChartTypes.LINE, bottomAxis, leftAxis);
        data.setVaryColors(false);
        if (data instanceof XDDFBarChartData barData) {
            barData.setBarDirection(BarDirection.COL);
        }

        SheetRange source = chart.source();
        int firstDataRow = source.firstRow() + 1;
        boolean hasCategories = source.columnCount() > 1;
        XDDFCategoryDataSource categories = categories(model, source, firstDataRow, hasCategories);
        int firstSeriesColumn = hasCategories ? source.firstColumn() + 1 : source.firstColumn();
        for (int column = firstSeriesColumn; column <= source.lastColumn(); column++) {
            XDDFNumericalDataSource<Double> values = XDDFDataSourcesFactory.fromArray(
                    numbers(model, column, firstDataRow, source.lastRow()),
                    new SheetRange(source.sheetName(), column, column, firstDataRow, source.lastRow()).toString());
            XDDFChartData.Series series = data.addSeries(categories, values);
            series.setTitle(CellValues.displayTextOrEmpty(model.getValue(source.firstRow(), column)),
                    new CellReference(sheet.getSheetName(), source.firstRow() - 1, column - 1, true, true));
        }
        xssfChart.plot(data);
    }

    private XDDFCategoryDataSource categories(WorksheetModel model, SheetRange source, int firstDataRow, boolean hasCategories) {
        int rows = source.lastRow() - firstDataRow + 1;
        String[] labels = new String[rows];
        for (int i = 0; i < rows; i++) {
            labels[i] = hasCategories
                    ? CellValues.displayTextOrEmpty(model.getValue(firstDataRow + i, source.firstColumn()))
                    : String.valueOf(i + 1);
        }
        if (!hasCategories) {
            return XDDFDataSourcesFactory.fromArray(labels);
        }
        return XDDFDataSourcesFactory.fromArray(labels,
                new SheetRange(source.sheetName(), source.firstColumn(), source.firstColumn(), firstDataRow, source.lastRow()).toString());
    }

    private Double[] numbers(WorksheetModel model, int column, int firstRow, int lastRow) {
        Double[] values = new Double[lastRow - firstRow + 1];
        for (int row = firstRow; row <= lastRow; row++) {
            values[row - firstRow] = CellValues.asDouble(model.getValue(row, column)).orElse(null);
        }
        return values;
    }
}
