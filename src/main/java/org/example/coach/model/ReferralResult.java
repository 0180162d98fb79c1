package org.example.coach.model;

public record ReferralResult(
        Status status,
        Long referrerId,
        int signupBonus,
        boolean milestoneGranted
) {

    public enum Status {
        COMPLETED,
        INVALID_CODE,
        ALREADY_USED
    }

    public static ReferralResult rejected(Status status) {
        return new ReferralResult(status, null, 0, false);
    }

    public boolean success() {
        return status == Status.COMPLETED;
    }
}
