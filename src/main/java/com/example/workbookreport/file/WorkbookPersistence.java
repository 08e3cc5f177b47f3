package com.example.workbookreport.file;

import com.example.workbookreport.model.ReportWorkbook;

import java.nio.file.Path;

/**
 * Writes a finished workbook to a file. Implementations create missing parent directories and never
 * leave a partially written file at the target path.
 */
public interface WorkbookPersistence {

    SaveResult save(ReportWorkbook workbook, Path target);
}
