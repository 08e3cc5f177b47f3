package com.example.workbookreport.report;

import com.example.workbookreport.model.CellRole;
import com.example.workbookreport.model.Dataset;
import com.example.workbookreport.model.WorksheetModel;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a dataset into an empty sheet: column names on row 1, one sheet row per data row from row 2.
 */
public class SheetPopulator {
    private static final Logger LOGGER = LoggerFactory.getLogger(SheetPopulator.class);
    static final int HEADER_ROW = 1;

    public void populate(WorksheetModel sheet, Dataset data) {
        sheet.markPopulated();

        List<String> columns = data.getColumns();
        for (int column = 0; column < columns.size(); column++) {
            sheet.setCell(HEADER_ROW, column + 1, columns.get(column), CellRole.HEADER);
        }

        int rowNumber = HEADER_ROW + 1;
        for (List<Object> row : data.getRows()) {
            for (int column = 0; column < row.size(); column++) {
                sheet.setCell(rowNumber, column + 1, row.get(column), CellRole.BODY);
            }
            rowNumber++;
        }

        LOGGER.info("Sheet '{}' populated with {} records", sheet.getName(), data.getRowCount());
    }
}
