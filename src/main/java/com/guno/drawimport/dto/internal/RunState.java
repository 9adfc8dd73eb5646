package com.guno.drawimport.dto.internal;

/**
 * Acquisition state machine: TRY_API -> TRY_HTML -> DONE | EXHAUSTED.
 */
public enum RunState {
    TRY_API,
    TRY_HTML,
    DONE,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == DONE || this == EXHAUSTED;
    }
}
