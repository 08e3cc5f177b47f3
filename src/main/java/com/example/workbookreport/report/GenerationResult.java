package com.example.workbookreport.report;

import com.example.workbookreport.model.FailureCause;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one report generation. A failed generation has a cause and no sheets.
 */
public class GenerationResult {
    private final Path outputPath;
    private final List<String> sheetNames;
    private final FailureCause failureCause;
    private final String message;

    private GenerationResult(Path outputPath, List<String> sheetNames, FailureCause failureCause, String message) {
        this.outputPath = outputPath;
        this.sheetNames = List.copyOf(sheetNames);
        this.failureCause = failureCause;
        this.message = message;
    }

    public static GenerationResult success(Path outputPath, List<String> sheetNames) {
        return new GenerationResult(outputPath, sheetNames, null, null);
    }

    public static GenerationResult failure(Path outputPath, FailureCause cause, String message) {
        return new GenerationResult(outputPath, List.of(), cause, message);
    }

    public boolean isSuccess() {
        return failureCause == null;
    }

    public Path getOutputPath() {
        return outputPath;
    }

    public List<String> getSheetNames() {
        return sheetNames;
    }

    public Optional<FailureCause> getFailureCause() {
        return Optional.ofNullable(failureCause);
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }
}
