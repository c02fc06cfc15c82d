package com.example.workflowhub.service;

import com.example.workflowhub.workflow.TransitionRule;

/**
 * Outcome of {@link TransitionValidator#validate}: allowed with the matched rule (null for creation),
 * or denied with a code and a machine-readable detail.
 */
public record TransitionDecision(boolean allowed, TransitionRule rule, TransitionErrorCode code, String detail) {

    public static TransitionDecision allow(TransitionRule rule) {
        return new TransitionDecision(true, rule, null, null);
    }

    public static TransitionDecision deny(TransitionErrorCode code, String detail) {
        return new TransitionDecision(false, null, code, detail);
    }
}
