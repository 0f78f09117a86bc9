package com.jeevo.validation.escalation;

import com.jeevo.validation.domain.CaseStatus;
import com.jeevo.validation.domain.RiskLevel;
import com.jeevo.validation.messaging.MessagingGateway;
import com.jeevo.validation.persistence.EscalatedCase;
import com.jeevo.validation.persistence.EscalatedCaseRepository;
import com.jeevo.validation.persistence.Expert;
import com.jeevo.validation.persistence.ExpertRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Opens review cases, assigns the first available expert and drives the case lifecycle.
 * Assignment takes no lock on the expert row, so two cases opened together may land on the same expert.
 */
@Service
public class EscalationManager {

    private static final Logger log = LoggerFactory.getLogger(EscalationManager.class);

    private static final int PREVIEW_LENGTH = 160;

    private final EscalatedCaseRepository cases;
    private final ExpertRepository experts;
    private final MessagingGateway messaging;
    private final Clock clock;

    public EscalationManager(EscalatedCaseRepository cases,
                             ExpertRepository experts,
                             MessagingGateway messaging,
                             Optional<Clock> clock) {
        this.cases = cases;
        this.experts = experts;
        this.messaging = messaging;
        this.clock = clock.orElse(Clock.systemUTC());
    }

    public record OpenCaseCommand(
            String userId,
            String userQuery,
            String botResponse,
            RiskLevel severity,
            String reason,
            List<String> keywords,
            Long validationId
    ) {}

    /**
     * Creates the case even when no expert is free; the assignee is then null.
     * The expert is notified once the case row has committed; a failed notification is logged
     * and does not affect the case.
     */
    @Transactional
    public EscalatedCase openCase(OpenCaseCommand command) {
        EscalatedCase escalatedCase = new EscalatedCase();
        escalatedCase.setUserId(command.userId());
        escalatedCase.setUserQuery(command.userQuery());
        escalatedCase.setBotResponse(command.botResponse());
        escalatedCase.setSeverity(command.severity());
        escalatedCase.setReason(command.reason());
        escalatedCase.setKeywordsTriggered(command.keywords() == null ? List.of() : List.copyOf(command.keywords()));
        escalatedCase.setValidationId(command.validationId());

        Optional<Expert> expert = experts.findFirstByActiveTrueAndAvailableTrueOrderByIdAsc();
        expert.ifPresent(e -> escalatedCase.setAssignedExpertId(e.getId()));

        EscalatedCase saved = cases.save(escalatedCase);
        if (expert.isPresent()) {
            log.info("Opened case {} ({}) for user {}, assigned to expert {}",
                    saved.getId(), saved.getSeverity().value(), saved.getUserId(), expert.get().getId());
            afterCommit(() -> notifyExpert(expert.get(), saved));
        } else {
            log.warn("Opened case {} ({}) for user {} with no available expert",
                    saved.getId(), saved.getSeverity().value(), saved.getUserId());
        }
        return saved;
    }

    @Transactional
    public EscalatedCase startReview(Long caseId) {
        return transition(caseId, CaseStatus.IN_PROGRESS, null);
    }

    @Transactional
    public EscalatedCase resolveCase(Long caseId, String notes) {
        return transition(caseId, CaseStatus.RESOLVED, notes);
    }

    @Transactional
    public EscalatedCase closeCase(Long caseId, String notes) {
        return transition(caseId, CaseStatus.CLOSED, notes);
    }

    @Transactional(readOnly = true)
    public EscalatedCase getCase(Long caseId) {
        return cases.findById(caseId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown case: " + caseId));
    }

    @Transactional(readOnly = true)
    public List<EscalatedCase> listPending(Long expertId) {
        return cases.findByAssignedExpertIdAndStatusInOrderByCreatedAtAsc(expertId, CaseStatus.PENDING);
    }

    @Transactional(readOnly = true)
    public List<EscalatedCase> listForUser(String userId) {
        return cases.findByUserIdOrderByCreatedAtDesc(userId);
    }

    @Transactional
    public Expert registerExpert(String name, String phoneNumber, String specialization) {
        if (name == null || name.isBlank() || phoneNumber == null || phoneNumber.isBlank()) {
            throw new IllegalArgumentException("Expert name and phone number are required");
        }
        Expert expert = new Expert();
        expert.setName(name.trim());
        expert.setPhoneNumber(phoneNumber.trim());
        expert.setSpecialization(specialization);
        expert.setActive(true);
        expert.setAvailable(true);
        Expert saved = experts.save(expert);
        log.info("Registered expert {} ({})", saved.getId(), saved.getName());
        return saved;
    }

    @Transactional
    public Expert setAvailability(Long expertId, boolean available) {
        Expert expert = experts.findById(expertId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown expert: " + expertId));
        expert.setAvailable(available);
        log.info("Expert {} is now {}", expertId, available ? "available" : "unavailable");
        return experts.save(expert);
    }

    @Transactional(readOnly = true)
    public List<Expert> listExperts() {
        return experts.findAllByOrderByIdAsc();
    }

    private EscalatedCase transition(Long caseId, CaseStatus target, String notes) {
        EscalatedCase escalatedCase = getCase(caseId);
        CaseStatus from = escalatedCase.getStatus();
        escalatedCase.transitionTo(target, Instant.now(clock));
        if (notes != null && !notes.isBlank()) {
            escalatedCase.setExpertNotes(notes.trim());
        }
        EscalatedCase saved = cases.save(escalatedCase);
        log.info("Case {} moved {} -> {}", caseId, from.value(), target.value());
        return saved;
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }

    private void notifyExpert(Expert expert, EscalatedCase escalatedCase) {
        String text = """
                New case #%d (%s)
                Reason: %s
                Patient ref: %s
                Question: %s""".formatted(
                escalatedCase.getId(),
                escalatedCase.getSeverity().value().toUpperCase(),
                escalatedCase.getReason() == null ? "-" : preview(escalatedCase.getReason()),
                escalatedCase.getUserId(),
                preview(escalatedCase.getUserQuery()));
        try {
            messaging.sendText(expert.getPhoneNumber(), text);
        } catch (RuntimeException e) {
            log.error("Could not notify expert {} about case {}: {}", expert.getId(), escalatedCase.getId(), e.getMessage());
        }
    }

    private static String preview(String text) {
        if (text == null) return "";
        return text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH) + "...";
    }
}
