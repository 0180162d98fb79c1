package org.example.coach.service;

import org.example.coach.config.CoachProperties;
import org.example.coach.entity.ReferralEntity;
import org.example.coach.entity.ReferralStatus;
import org.example.coach.model.ReferralResult;
import org.example.coach.model.ReferralStats;
import org.example.coach.repository.ReferralRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Invite codes, signup attribution and the every-N-completions referrer bonus.
 * <p>
 * A referrer holds at most one pending code at a time. Once it is redeemed a fresh code is
 * minted on the next request, so completed referrals accumulate toward the milestone.
 */
@Service
public class ReferralService {

    private static final Logger log = LoggerFactory.getLogger(ReferralService.class);
    private static final int CODE_LENGTH = 8;

    private final ReferralRepository referralRepository;
    private final RewardLedgerService rewardLedgerService;
    private final ConversationMetricsService metricsService;
    private final CoachProperties properties;
    private final Clock clock;

    public ReferralService(
            ReferralRepository referralRepository,
            RewardLedgerService rewardLedgerService,
            ConversationMetricsService metricsService,
            CoachProperties properties,
            Clock clock) {
        this.referralRepository = referralRepository;
        this.rewardLedgerService = rewardLedgerService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.clock = clock;
    }

    @Transactional
    public String getOrCreateCode(long userId) {
        return referralRepository.findFirstByReferrerIdAndStatusOrderByIdDesc(userId, ReferralStatus.PENDING)
                .map(ReferralEntity::getReferralCode)
                .orElseGet(() -> mintCode(userId));
    }

    @Transactional
    public ReferralResult processReferral(String code, long newUserId) {
        if (code == null || code.isBlank()) {
            return ReferralResult.rejected(ReferralResult.Status.INVALID_CODE);
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        ReferralEntity referral = referralRepository.findByReferralCode(normalized).orElse(null);
        if (referral == null || referral.getReferrerId() == newUserId) {
            log.warn("Rejected referral code {} for user {}", normalized, newUserId);
            return ReferralResult.rejected(ReferralResult.Status.INVALID_CODE);
        }
        if (referral.getStatus() != ReferralStatus.PENDING) {
            log.warn("Referral code {} already redeemed", normalized);
            return ReferralResult.rejected(ReferralResult.Status.ALREADY_USED);
        }

        referral.setReferredId(newUserId);
        referral.setStatus(ReferralStatus.COMPLETED);
        referral.setCompletedAt(LocalDateTime.now(clock));
        referralRepository.saveAndFlush(referral);

        CoachProperties.Referral config = properties.getReferral();
        rewardLedgerService.creditCoins(newUserId, config.getSignupBonus(), "referral signup");

        // Recounted from the store so replayed or reordered completions cannot skew the milestone.
        long completed = referralRepository.countByReferrerIdAndStatus(referral.getReferrerId(), ReferralStatus.COMPLETED);
        boolean milestone = completed > 0 && completed % config.getMilestoneEvery() == 0;
        if (milestone) {
            rewardLedgerService.creditCoins(referral.getReferrerId(), config.getMilestoneBonus(), "referral milestone");
        }
        metricsService.recordReferralCompleted();
        log.info("Referral {} completed: referrer={}, newUser={}, completedCount={}, milestone={}",
                normalized, referral.getReferrerId(), newUserId, completed, milestone);
        return new ReferralResult(ReferralResult.Status.COMPLETED, referral.getReferrerId(), config.getSignupBonus(), milestone);
    }

    @Transactional
    public ReferralStats getStats(long userId) {
        String code = getOrCreateCode(userId);
        long total = referralRepository.countByReferrerId(userId);
        long completed = referralRepository.countByReferrerIdAndStatus(userId, ReferralStatus.COMPLETED);
        int every = properties.getReferral().getMilestoneEvery();
        int remainder = (int) (completed % every);
        return new ReferralStats(code, completed, total, every - remainder);
    }

    private String mintCode(long userId) {
        String code = generateCode(userId, 0);
        int attempt = 1;
        while (referralRepository.existsByReferralCode(code)) {
            code = generateCode(userId, attempt++);
        }
        ReferralEntity referral = referralRepository.save(new ReferralEntity(code, userId));
        log.info("Minted referral code {} for user {}", referral.getReferralCode(), userId);
        return referral.getReferralCode();
    }

    String generateCode(long userId, int attempt) {
        Instant now = clock.instant();
        String input = userId + "_" + now.getEpochSecond() + now.getNano() + "_" + attempt;
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] hash = md.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, CODE_LENGTH).toUpperCase(Locale.ROOT);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest unavailable", e);
        }
    }
}
