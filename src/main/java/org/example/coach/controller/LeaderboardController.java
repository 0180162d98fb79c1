package org.example.coach.controller;

import org.example.coach.config.CoachProperties;
import org.example.coach.entity.LeaderboardPeriod;
import org.example.coach.model.LeaderboardSnapshot;
import org.example.coach.service.LeaderboardService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Optional;

@RestController
@RequestMapping("/api/leaderboard")
public class LeaderboardController {

    private static final int MAX_LIMIT = 100;

    private final LeaderboardService leaderboardService;
    private final CoachProperties properties;

    public LeaderboardController(LeaderboardService leaderboardService, CoachProperties properties) {
        this.leaderboardService = leaderboardService;
        this.properties = properties;
    }

    @GetMapping("/{period}")
    public ResponseEntity<LeaderboardSnapshot> getLeaderboard(
            @PathVariable String period,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Long userId) {
        Optional<LeaderboardPeriod> resolved = LeaderboardPeriod.fromCode(period);
        if (resolved.isEmpty()) {
            return ResponseEntity.badRequest().build();
        }
        int effectiveLimit = limit == null ? properties.getLeaderboard().getDefaultLimit() : limit;
        if (effectiveLimit < 1) {
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.ok(leaderboardService.getLeaderboard(
                resolved.get(), Math.min(effectiveLimit, MAX_LIMIT), userId));
    }
}
