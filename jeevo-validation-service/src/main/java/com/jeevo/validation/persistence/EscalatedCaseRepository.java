package com.jeevo.validation.persistence;

import com.jeevo.validation.domain.CaseStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface EscalatedCaseRepository extends JpaRepository<EscalatedCase, Long> {

    List<EscalatedCase> findByAssignedExpertIdAndStatusInOrderByCreatedAtAsc(Long expertId, Collection<CaseStatus> statuses);

    List<EscalatedCase> findByUserIdOrderByCreatedAtDesc(String userId);

    List<EscalatedCase> findByValidationId(Long validationId);
}
