package com.example.workbookreport.model;

public record RankingEntry(Object groupKey, double total) {
}
