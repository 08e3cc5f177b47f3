package com.example.workbookreport.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Formatting state of a sheet. Column widths are keyed by 1-indexed column, in character units.
 */
public record SheetStyle(boolean headerStyled, boolean bordered, Map<Integer, Integer> columnWidths) {

    public SheetStyle {
        columnWidths = Collections.unmodifiableMap(new TreeMap<>(columnWidths));
    }

    public static SheetStyle unstyled() {
        return new SheetStyle(false, false, Map.of());
    }
}
