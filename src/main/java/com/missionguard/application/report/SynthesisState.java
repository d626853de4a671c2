package com.missionguard.application.report;

/**
 * Report synthesis lifecycle. DONE, BLOCKED and CANCELLED are terminal.
 */
public enum SynthesisState {
    SELECT_TEMPLATE,
    BUILD_CONTEXT,
    RENDER_SECTIONS,
    ASSEMBLE,
    DONE,
    BLOCKED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == BLOCKED || this == CANCELLED;
    }
}
