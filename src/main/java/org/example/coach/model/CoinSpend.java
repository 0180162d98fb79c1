package org.example.coach.model;

public record CoinSpend(
        boolean accepted,
        int cost,
        int balance
) {
}
