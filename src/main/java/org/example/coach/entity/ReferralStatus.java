package org.example.coach.entity;

public enum ReferralStatus {
    PENDING,
    COMPLETED
}
