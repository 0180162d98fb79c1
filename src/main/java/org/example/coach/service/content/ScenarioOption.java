package org.example.coach.service.content;

/**
 * One choice on a decision node. A null or blank {@code next} ends the walk.
 */
public record ScenarioOption(
        String label,
        String feedback,
        ScenarioImpact impact,
        String next
) {
    public ScenarioOption {
        impact = impact == null ? ScenarioImpact.NEUTRAL : impact;
    }

    public boolean hasNext() {
        return next != null && !next.isBlank();
    }
}
