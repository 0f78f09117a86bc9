package com.jeevo.validation.disclaimer;

import com.jeevo.validation.domain.Language;
import com.jeevo.validation.domain.RiskLevel;
import com.jeevo.validation.persistence.Disclaimer;
import com.jeevo.validation.persistence.DisclaimerRepository;
import com.jeevo.validation.persistence.DisclaimerTracking;
import com.jeevo.validation.persistence.DisclaimerTrackingRepository;
import com.jeevo.validation.rules.DisclaimerCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the disclaimer for a risk level and language and records that users saw it.
 * Missing defaults are created on first use; the {@code active_key} unique column keeps
 * concurrent first use down to a single active row.
 */
@Service
public class DisclaimerSelector {

    private static final Logger log = LoggerFactory.getLogger(DisclaimerSelector.class);

    static final int CREATE_ATTEMPTS = 3;
    static final int DEFAULT_PRIORITY = 1;
    static final int MAX_HISTORY = 100;

    private final DisclaimerRepository disclaimers;
    private final DisclaimerTrackingRepository tracking;
    private final DisclaimerCatalog catalog;
    private final TransactionTemplate newTransaction;
    private final TransactionTemplate transaction;

    public DisclaimerSelector(DisclaimerRepository disclaimers,
                              DisclaimerTrackingRepository tracking,
                              DisclaimerCatalog catalog,
                              PlatformTransactionManager transactionManager) {
        this.disclaimers = disclaimers;
        this.tracking = tracking;
        this.catalog = catalog;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.transaction = new TransactionTemplate(transactionManager);
    }

    public Disclaimer getDisclaimer(RiskLevel riskLevel, Language language) {
        DataAccessException lastFailure = null;
        for (int attempt = 1; attempt <= CREATE_ATTEMPTS; attempt++) {
            Optional<Disclaimer> existing = findActive(riskLevel, language);
            if (existing.isPresent()) {
                return existing.get();
            }
            try {
                Disclaimer created = newTransaction.execute(status -> disclaimers.saveAndFlush(defaultDisclaimer(riskLevel, language)));
                log.info("Created default {} disclaimer for language {}", riskLevel.value(), language.code());
                return created;
            } catch (DataAccessException e) {
                // another caller inserted the same active pair first
                log.debug("Default disclaimer insert for {}:{} lost a race (attempt {}): {}",
                        riskLevel.value(), language.code(), attempt, e.getMessage());
                lastFailure = e;
            }
        }
        DataAccessException cause = lastFailure;
        return findActive(riskLevel, language).orElseThrow(() ->
                new IllegalStateException("No disclaimer available for " + riskLevel.value() + "/" + language.code(), cause));
    }

    /**
     * Records that a disclaimer was shown. Never throws; an empty result means the record was not stored.
     */
    public Optional<DisclaimerTracking> trackShown(String userId, Long disclaimerId, Map<String, String> context, String messageId) {
        try {
            DisclaimerTracking entry = new DisclaimerTracking();
            entry.setUserId(userId);
            entry.setDisclaimerId(disclaimerId);
            entry.setMessageId(messageId);
            entry.setContext(context == null ? new LinkedHashMap<>() : new LinkedHashMap<>(context));
            DisclaimerTracking saved = tracking.save(entry);
            log.info("Tracked disclaimer {} for user {}", disclaimerId, userId);
            return Optional.of(saved);
        } catch (RuntimeException e) {
            log.error("Failed to track disclaimer {} for user {}: {}", disclaimerId, userId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Replaces the active disclaimer for the pair. The previous row stays, inactive.
     */
    public Disclaimer override(RiskLevel riskLevel, Language language, String content, int priority) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Disclaimer content is required");
        }
        Disclaimer saved = transaction.execute(status -> {
            for (Disclaimer current : disclaimers.findByRiskLevelAndLanguageAndActiveTrue(riskLevel, language)) {
                current.setActive(false);
                disclaimers.saveAndFlush(current);
            }
            Disclaimer replacement = new Disclaimer();
            replacement.setRiskLevel(riskLevel);
            replacement.setLanguage(language);
            replacement.setContent(content.trim());
            replacement.setPriority(priority);
            replacement.setActive(true);
            return disclaimers.saveAndFlush(replacement);
        });
        log.info("Disclaimer for {}:{} overridden (id {})", riskLevel.value(), language.code(), saved.getId());
        return saved;
    }

    public List<DisclaimerTracking> history(String userId, int limit) {
        int size = Math.max(1, Math.min(limit, MAX_HISTORY));
        return tracking.findByUserIdOrderByShownAtDesc(userId, PageRequest.of(0, size));
    }

    private Optional<Disclaimer> findActive(RiskLevel riskLevel, Language language) {
        return disclaimers.findFirstByRiskLevelAndLanguageAndActiveTrueOrderByPriorityDesc(riskLevel, language);
    }

    private Disclaimer defaultDisclaimer(RiskLevel riskLevel, Language language) {
        Disclaimer disclaimer = new Disclaimer();
        disclaimer.setRiskLevel(riskLevel);
        disclaimer.setLanguage(language);
        disclaimer.setContent(catalog.defaultText(riskLevel, language));
        disclaimer.setPriority(DEFAULT_PRIORITY);
        disclaimer.setActive(true);
        return disclaimer;
    }
}
