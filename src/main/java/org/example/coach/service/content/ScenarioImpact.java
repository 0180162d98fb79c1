package org.example.coach.service.content;

import java.util.Locale;

/**
 * Consequence tag attached to a scenario option.
 */
public enum ScenarioImpact {
    SAFE("✅"),
    WARNING("⚠️"),
    DANGER("❌"),
    REPORT("🛡️"),
    NEUTRAL("➖");

    private final String icon;

    ScenarioImpact(String icon) {
        this.icon = icon;
    }

    public String icon() {
        return icon;
    }

    public static ScenarioImpact fromCode(String value) {
        if (value == null || value.isBlank()) {
            return NEUTRAL;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NEUTRAL;
        }
    }
}
