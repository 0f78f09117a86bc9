package com.jeevo.validation.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DisclaimerTrackingRepository extends JpaRepository<DisclaimerTracking, Long> {

    List<DisclaimerTracking> findByUserIdOrderByShownAtDesc(String userId, Pageable pageable);
}
