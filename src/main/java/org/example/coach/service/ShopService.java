package org.example.coach.service;

import org.example.coach.config.CoachProperties;
import org.example.coach.entity.UserEventType;
import org.example.coach.model.CoinSpend;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class ShopService {

    private final RewardLedgerService rewardLedgerService;
    private final AnalyticsService analyticsService;
    private final CoachProperties properties;

    public ShopService(
            RewardLedgerService rewardLedgerService,
            AnalyticsService analyticsService,
            CoachProperties properties) {
        this.rewardLedgerService = rewardLedgerService;
        this.analyticsService = analyticsService;
        this.properties = properties;
    }

    public int hintCost() {
        return properties.getShop().getHintCost();
    }

    public CoinSpend buyHint(long userId) {
        CoinSpend spend = rewardLedgerService.spendCoins(userId, hintCost(), "hint");
        if (spend.accepted()) {
            analyticsService.track(userId, UserEventType.HINT_PURCHASE, Map.of("cost", spend.cost()));
        }
        return spend;
    }
}
