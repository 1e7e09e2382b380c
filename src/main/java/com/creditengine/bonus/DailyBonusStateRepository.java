package com.creditengine.bonus;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for daily bonus state.
 */
@Repository
public interface DailyBonusStateRepository extends JpaRepository<DailyBonusState, String> {
}
