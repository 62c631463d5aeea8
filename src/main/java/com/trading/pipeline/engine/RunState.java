package com.trading.pipeline.engine;

/**
 * Lifecycle of one evaluation run.
 *
 * <p>
 * A run starts INITIALIZED, moves between LOADING, COMPUTING and CACHING as
 * nodes are evaluated in plan order (an empty date range skips straight to
 * ASSEMBLING), then ASSEMBLING and finally DONE. Any
 * failure moves it to FAILED. DONE and FAILED are terminal.
 */
public enum RunState {
    INITIALIZED,
    LOADING,
    COMPUTING,
    CACHING,
    ASSEMBLING,
    DONE,
    FAILED;

    public boolean canAdvanceTo(RunState next) {
        return switch (this) {
            case INITIALIZED -> next == LOADING || next == COMPUTING || next == ASSEMBLING || next == FAILED;
            case LOADING, COMPUTING, CACHING -> next == LOADING || next == COMPUTING || next == CACHING
                    || next == ASSEMBLING || next == FAILED;
            case ASSEMBLING -> next == DONE || next == FAILED;
            case DONE, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
