package com.flow.x.exceptions;

import lombok.Getter;

/**
 * Raised by the per-step checks when a push or relabel leaves the preflow in a state that a
 * correct push-relabel run can never reach.
 */
@Getter
public class FlowInvariantViolationException extends IllegalStateException {

    private final String rule;

    public FlowInvariantViolationException(String rule, String detail) {
        super(rule + " violated: " + detail);
        this.rule = rule;
    }
}
