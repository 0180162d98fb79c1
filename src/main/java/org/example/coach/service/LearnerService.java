package org.example.coach.service;

import org.example.coach.entity.LearnerEntity;
import org.example.coach.model.LearnerProfile;
import org.example.coach.model.SenderProfile;
import org.example.coach.repository.LearnerRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
public class LearnerService {

    private static final Logger log = LoggerFactory.getLogger(LearnerService.class);

    private final LearnerRepository learnerRepository;

    public LearnerService(LearnerRepository learnerRepository) {
        this.learnerRepository = learnerRepository;
    }

    /**
     * Returns the learner, creating a zero-state record on first contact.
     */
    @Transactional
    public LearnerEntity loadOrCreate(long userId) {
        return learnerRepository.findById(userId)
                .orElseGet(() -> {
                    log.info("Creating learner record for user {}", userId);
                    return learnerRepository.save(new LearnerEntity(userId));
                });
    }

    /**
     * Creates or refreshes a learner from the sender's platform identity.
     */
    @Transactional
    public Registration register(long userId, SenderProfile sender) {
        Optional<LearnerEntity> existing = learnerRepository.findById(userId);
        LearnerEntity learner = existing.orElseGet(() -> new LearnerEntity(userId));
        if (sender != null) {
            if (sender.username() != null) {
                learner.setUsername(sender.username());
            }
            if (sender.firstName() != null) {
                learner.setFirstName(sender.firstName());
            }
            if (sender.lastName() != null) {
                learner.setLastName(sender.lastName());
            }
        }
        LearnerEntity saved = learnerRepository.save(learner);
        if (existing.isEmpty()) {
            log.info("Registered new learner {}", userId);
        }
        return new Registration(saved, existing.isEmpty());
    }

    @Transactional(readOnly = true)
    public Optional<LearnerEntity> find(long userId) {
        return learnerRepository.findById(userId);
    }

    @Transactional(readOnly = true)
    public Optional<LearnerProfile> getProfile(long userId) {
        return learnerRepository.findById(userId).map(this::toProfile);
    }

    public static String displayName(LearnerEntity learner) {
        if (learner == null) {
            return null;
        }
        if (learner.getUsername() != null && !learner.getUsername().isBlank()) {
            return "@" + learner.getUsername();
        }
        StringBuilder name = new StringBuilder();
        if (learner.getFirstName() != null && !learner.getFirstName().isBlank()) {
            name.append(learner.getFirstName().trim());
        }
        if (learner.getLastName() != null && !learner.getLastName().isBlank()) {
            if (name.length() > 0) {
                name.append(' ');
            }
            name.append(learner.getLastName().trim());
        }
        if (name.length() > 0) {
            return name.toString();
        }
        return "User " + learner.getUserId();
    }

    private LearnerProfile toProfile(LearnerEntity learner) {
        return new LearnerProfile(
                learner.getUserId(),
                displayName(learner),
                learner.getCoins(),
                learner.getQuizzesPassed(),
                learner.getMaxUnlockedLevel(),
                learner.getScenarioScore(),
                learner.getBadgeSet(),
                LeaderboardService.score(learner)
        );
    }

    public record Registration(LearnerEntity learner, boolean created) {
    }
}
