package com.jeevo.validation.persistence;

import com.jeevo.validation.domain.Language;
import com.jeevo.validation.domain.RiskLevel;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DisclaimerRepository extends JpaRepository<Disclaimer, Long> {

    Optional<Disclaimer> findFirstByRiskLevelAndLanguageAndActiveTrueOrderByPriorityDesc(RiskLevel riskLevel, Language language);

    List<Disclaimer> findByRiskLevelAndLanguageAndActiveTrue(RiskLevel riskLevel, Language language);

    long countByRiskLevelAndLanguageAndActiveTrue(RiskLevel riskLevel, Language language);
}
