package com.jeevo.validation.orchestrator;

import com.jeevo.validation.domain.EscalationTrigger;
import com.jeevo.validation.domain.RiskLevel;

/**
 * Outcome of one ladder rule.
 *
 * @param definitive     the semantic stage may not revise this verdict
 * @param answerApproved the generated answer may be delivered (with a disclaimer); otherwise it is held for review
 */
public record Verdict(
        RiskLevel risk,
        boolean escalate,
        EscalationTrigger trigger,
        String message,
        boolean definitive,
        boolean answerApproved
) {

    static Verdict deliver(RiskLevel risk, String message) {
        return new Verdict(risk, false, null, message, false, true);
    }

    static Verdict escalate(RiskLevel risk, EscalationTrigger trigger, String message,
                            boolean definitive, boolean answerApproved) {
        return new Verdict(risk, true, trigger, message, definitive, answerApproved);
    }
}
