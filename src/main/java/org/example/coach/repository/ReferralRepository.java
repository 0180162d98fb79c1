package org.example.coach.repository;

import org.example.coach.entity.ReferralEntity;
import org.example.coach.entity.ReferralStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ReferralRepository extends JpaRepository<ReferralEntity, Long> {

    Optional<ReferralEntity> findByReferralCode(String referralCode);

    Optional<ReferralEntity> findFirstByReferrerIdAndStatusOrderByIdDesc(Long referrerId, ReferralStatus status);

    boolean existsByReferralCode(String referralCode);

    boolean existsByReferredId(Long referredId);

    long countByReferrerId(Long referrerId);

    long countByReferrerIdAndStatus(Long referrerId, ReferralStatus status);
}
