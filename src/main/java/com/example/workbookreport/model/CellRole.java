package com.example.workbookreport.model;

/**
 * Position of a cell within a sheet's layout, used to pick its formatting.
 */
public enum CellRole {
    HEADER,
    BODY,
    TITLE,
    SECTION
}
