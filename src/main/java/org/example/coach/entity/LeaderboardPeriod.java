package org.example.coach.entity;

import java.util.Locale;
import java.util.Optional;

public enum LeaderboardPeriod {
    ALL_TIME("all_time"),
    WEEKLY("weekly"),
    MONTHLY("monthly");

    private final String code;

    LeaderboardPeriod(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static Optional<LeaderboardPeriod> fromCode(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("all")) {
            return Optional.of(ALL_TIME);
        }
        for (LeaderboardPeriod period : values()) {
            if (period.code.equals(normalized) || period.name().equalsIgnoreCase(normalized)) {
                return Optional.of(period);
            }
        }
        return Optional.empty();
    }
}
