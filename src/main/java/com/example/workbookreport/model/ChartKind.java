package com.example.workbookreport.model;

import java.util.Locale;
import java.util.Optional;

public enum ChartKind {
    BAR,
    LINE;

    public static Optional<ChartKind> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "bar" -> Optional.of(BAR);
            case "line" -> Optional.of(LINE);
            default -> Optional.empty();
        };
    }
}
