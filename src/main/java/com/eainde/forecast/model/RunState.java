package com.eainde.forecast.model;

import java.util.Locale;

/**
 * States of the forecast run state machine.
 *
 * <pre>
 * IDLE → GATHERING → EXTRACTING → ANALYZING → SYNTHESIZING → VALIDATING → DONE
 *                                                   ↑              │
 *                                                   └── once ──────┘
 * FAILED is reachable from every non-terminal state.
 * </pre>
 *
 * <p>Degraded mode is not a state of its own: it is a flag on the run context that
 * EXTRACTING and ANALYZING (and GATHERING, for a missing document kind) may raise. Raising
 * it appends one {@code DEGRADED} trace entry next to the state transitions.</p>
 */
public enum RunState {
    IDLE,
    GATHERING,
    EXTRACTING,
    ANALYZING,
    SYNTHESIZING,
    VALIDATING,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }

    /** Graph node id for this state. */
    public String nodeId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
