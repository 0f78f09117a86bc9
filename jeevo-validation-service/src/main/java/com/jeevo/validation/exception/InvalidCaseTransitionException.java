package com.jeevo.validation.exception;

import com.jeevo.validation.domain.CaseStatus;

public class InvalidCaseTransitionException extends RuntimeException {

    private final Long caseId;
    private final CaseStatus from;
    private final CaseStatus to;

    public InvalidCaseTransitionException(Long caseId, CaseStatus from, CaseStatus to) {
        super("Case " + caseId + " cannot move from " + from.value() + " to " + to.value());
        this.caseId = caseId;
        this.from = from;
        this.to = to;
    }

    public Long getCaseId() {
        return caseId;
    }

    public CaseStatus getFrom() {
        return from;
    }

    public CaseStatus getTo() {
        return to;
    }
}
