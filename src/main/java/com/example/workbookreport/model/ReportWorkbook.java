package com.example.workbookreport.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.apache.poi.ss.util.WorkbookUtil;

/**
 * In-memory report document: sheets in creation order, starting with none.
 */
public class ReportWorkbook {
    private final Map<String, WorksheetModel> sheets = new LinkedHashMap<>();
    private boolean sealed;

    /**
     * Adds an empty sheet at the end of the workbook.
     *
     * @throws IllegalArgumentException when the name is not a legal sheet name or is already taken
     */
    public WorksheetModel createSheet(String name) {
        if (sealed) {
            throw new IllegalStateException("Workbook is sealed and can no longer change");
        }
        WorkbookUtil.validateSheetName(name);
        String key = name.toLowerCase(Locale.ROOT);
        if (sheets.containsKey(key)) {
            throw new IllegalArgumentException("Duplicate sheet name: " + name);
        }
        WorksheetModel sheet = new WorksheetModel(name);
        sheets.put(key, sheet);
        return sheet;
    }

    public Optional<WorksheetModel> getSheet(String name) {
        return Optional.ofNullable(sheets.get(name.toLowerCase(Locale.ROOT)));
    }

    public List<WorksheetModel> getSheets() {
        return Collections.unmodifiableList(new ArrayList<>(sheets.values()));
    }

    public List<String> getSheetNames() {
        return sheets.values().stream().map(WorksheetModel::getName).toList();
    }

    public int getSheetCount() {
        return sheets.size();
    }

    /**
     * Freezes the workbook and all of its sheets ahead of persistence.
     */
    public void seal() {
        sealed = true;
        sheets.values().forEach(WorksheetModel::seal);
    }

    public boolean isSealed() {
        return sealed;
    }
}
