package com.ryuqq.lifecycle.core.exception;

import com.ryuqq.lifecycle.core.statemachine.Phase;

/**
 * Phase 전이 테이블에 없는 전이 시도.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InvalidPhaseTransitionException extends LifecycleException {

    private final Phase from;
    private final Phase to;

    public InvalidPhaseTransitionException(Phase from, Phase to) {
        super(ErrorCategory.VALIDATION, "INVALID_PHASE_TRANSITION",
            String.format("Invalid phase transition: %s → %s", from, to));
        this.from = from;
        this.to = to;
    }

    public InvalidPhaseTransitionException(Phase from, Phase to, String message) {
        super(ErrorCategory.VALIDATION, "INVALID_PHASE_TRANSITION", message);
        this.from = from;
        this.to = to;
    }

    public Phase getFrom() {
        return from;
    }

    public Phase getTo() {
        return to;
    }
}
