package org.example.coach.service.content;

import java.util.Locale;

public enum ScenarioOutcome {
    SUCCESS,
    FAIL,
    REPORT;

    public static ScenarioOutcome fromCode(String value) {
        if (value == null || value.isBlank()) {
            return FAIL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return FAIL;
        }
    }
}
