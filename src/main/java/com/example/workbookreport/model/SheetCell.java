package com.example.workbookreport.model;

public record SheetCell(Object value, CellRole role, CellFormat format) {

    public SheetCell withFormat(CellFormat newFormat) {
        return new SheetCell(value, role, newFormat);
    }

    public boolean isFormatted() {
        return format != null;
    }
}
