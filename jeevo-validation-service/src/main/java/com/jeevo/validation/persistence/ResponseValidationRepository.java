package com.jeevo.validation.persistence;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;

public interface ResponseValidationRepository extends JpaRepository<ResponseValidation, Long> {

    List<ResponseValidation> findByMessageIdOrderByCreatedAtDesc(String messageId);

    List<ResponseValidation> findByUserIdAndCreatedAtBetweenOrderByCreatedAtDesc(
            String userId, Instant from, Instant to, Pageable pageable);

    List<ResponseValidation> findByCreatedAtBetweenOrderByCreatedAtDesc(Instant from, Instant to, Pageable pageable);

    List<ResponseValidation> findByRequiresEscalationTrueOrderByCreatedAtDesc(Pageable pageable);

    long countByUserId(String userId);
}
