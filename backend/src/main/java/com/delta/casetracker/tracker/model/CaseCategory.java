package com.delta.casetracker.tracker.model;

import java.util.Locale;

public enum CaseCategory {
    INBOUND,
    GENERATED;

    public static CaseCategory fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "INBOUND", "RECEIVED", "RECEBIDOS" -> INBOUND;
            case "GENERATED", "GERADOS" -> GENERATED;
            default -> throw new IllegalArgumentException("Unknown case category: " + raw);
        };
    }
}
