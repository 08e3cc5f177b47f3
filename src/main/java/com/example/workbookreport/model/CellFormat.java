package com.example.workbookreport.model;

/**
 * Formatting directive for a single cell. Colors are six digit RGB hex strings, {@code null} when unset.
 */
public record CellFormat(boolean bold,
                         short fontSize,
                         String fontColor,
                         String fillColor,
                         boolean centered,
                         boolean thinBorder) {

    public static final short DEFAULT_FONT_SIZE = 11;
}
