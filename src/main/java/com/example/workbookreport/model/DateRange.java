package com.example.workbookreport.model;

import java.time.LocalDateTime;

public record DateRange(LocalDateTime start, LocalDateTime end) {
}
