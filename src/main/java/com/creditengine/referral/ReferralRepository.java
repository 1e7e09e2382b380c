package com.creditengine.referral;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReferralRepository extends JpaRepository<Referral, String> {

    Optional<Referral> findByRefereeUserId(String refereeUserId);

    List<Referral> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(ReferralStatus status, Instant cutoff);
}
