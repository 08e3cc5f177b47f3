package com.example.workbookreport.report;

import com.example.workbookreport.model.CellFormat;
import com.example.workbookreport.model.CellRole;

/**
 * Maps a cell's layout role to the formatting it receives. Every role carries a thin border.
 */
public class StylePolicy {
    public static final String HEADER_FONT_COLOR = "FFFFFF";
    public static final String HEADER_FILL_COLOR = "366092";
    public static final short TITLE_FONT_SIZE = 16;

    private static final CellFormat HEADER = new CellFormat(
            true, CellFormat.DEFAULT_FONT_SIZE, HEADER_FONT_COLOR, HEADER_FILL_COLOR, true, true);
    private static final CellFormat BODY = new CellFormat(
            false, CellFormat.DEFAULT_FONT_SIZE, null, null, false, true);
    private static final CellFormat TITLE = new CellFormat(
            true, TITLE_FONT_SIZE, null, null, false, true);
    private static final CellFormat SECTION = new CellFormat(
            true, CellFormat.DEFAULT_FONT_SIZE, null, null, false, true);

    public CellFormat formatFor(CellRole role) {
        return switch (role) {
            case HEADER -> HEADER;
            case BODY -> BODY;
            case TITLE -> TITLE;
            case SECTION -> SECTION;
        };
    }
}
