package com.example.workbookreport.model;

public enum FailureCause {
    /** The target directory or file could not be created or written. */
    OUTPUT_UNWRITABLE,
    /** The in-memory workbook could not be rendered to the spreadsheet format. */
    SERIALIZATION_ERROR,
    /** Building the workbook failed before anything was written. */
    ASSEMBLY_ERROR
}
