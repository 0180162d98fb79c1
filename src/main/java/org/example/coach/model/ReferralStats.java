package org.example.coach.model;

public record ReferralStats(
        String code,
        long completed,
        long total,
        int referralsToNextBonus
) {
}
