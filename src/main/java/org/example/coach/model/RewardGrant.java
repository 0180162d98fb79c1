package org.example.coach.model;

import java.util.Set;

/**
 * Result of one ledger grant. {@code badgeGranted} is null when no new badge was added.
 */
public record RewardGrant(
        int coinsGranted,
        String badgeGranted,
        int newScore,
        Set<String> allBadges
) {
}
