package com.example.workbookreport.report;

import com.example.workbookreport.model.CellPosition;
import com.example.workbookreport.model.CellRole;
import com.example.workbookreport.model.SheetStyle;
import com.example.workbookreport.model.WorksheetModel;
import com.example.workbookreport.util.CellValues;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the {@link StylePolicy} to every populated cell of a sheet and sizes its columns.
 * Formatting is derived from cell content only, so applying it again changes nothing.
 */
public class SheetFormatter {
    private static final Logger LOGGER = LoggerFactory.getLogger(SheetFormatter.class);
    public static final int WIDTH_PADDING = 2;
    public static final int MAX_COLUMN_WIDTH = 50;

    private final StylePolicy stylePolicy;

    public SheetFormatter(StylePolicy stylePolicy) {
        this.stylePolicy = stylePolicy;
    }

    public void format(WorksheetModel sheet) {
        Map<Integer, Integer> longestText = new HashMap<>();
        Map<Integer, Integer> longestHeader = new HashMap<>();
        List<CellPosition> positions = new ArrayList<>();
        boolean[] headerStyled = {false};

        sheet.forEachCell((row, column, cell) -> {
            positions.add(new CellPosition(row, column));
            headerStyled[0] |= cell.role() == CellRole.HEADER;

            // titles are not measured
            if (cell.role() == CellRole.TITLE) {
                longestText.putIfAbsent(column, 0);
                return;
            }
            int length = CellValues.displayTextOrEmpty(cell.value()).length();
            longestText.merge(column, length, Math::max);
            if (cell.role() == CellRole.HEADER) {
                longestHeader.merge(column, length, Math::max);
            }
        });

        for (CellPosition position : positions) {
            CellRole role = sheet.getCell(position.row(), position.column()).orElseThrow().role();
            sheet.setCellFormat(position.row(), position.column(), stylePolicy.formatFor(role));
        }

        Map<Integer, Integer> widths = new HashMap<>();
        longestText.forEach((column, length) ->
                widths.put(column, columnWidth(length, longestHeader.getOrDefault(column, 0))));

        sheet.setStyle(new SheetStyle(headerStyled[0], !positions.isEmpty(), widths));
        LOGGER.info("Formatting applied to sheet '{}'", sheet.getName());
    }

    static int columnWidth(int longestText, int longestHeader) {
        return Math.max(Math.min(longestText + WIDTH_PADDING, MAX_COLUMN_WIDTH), longestHeader);
    }
}
