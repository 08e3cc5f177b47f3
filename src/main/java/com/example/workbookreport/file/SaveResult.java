package com.example.workbookreport.file;

import com.example.workbookreport.model.FailureCause;

import java.nio.file.Path;
import java.util.Optional;

public record SaveResult(Path path, FailureCause failureCause, String message) {

    public static SaveResult success(Path path) {
        return new SaveResult(path, null, null);
    }

    public static SaveResult failure(Path path, FailureCause cause, String message) {
        return new SaveResult(path, cause, message);
    }

    public boolean isSuccess() {
        return failureCause == null;
    }

    public Optional<FailureCause> getFailureCause() {
        return Optional.ofNullable(failureCause);
    }
}
