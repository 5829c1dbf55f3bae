package com.adlanda.projectorchestrator.model;

/**
 * Training state of a project's adapter, as reported by the external training pipeline.
 *
 * Transitions only move forward: PENDING → TRAINING → COMPLETED | FAILED.
 * COMPLETED and FAILED are terminal. Steps may be skipped (PENDING → FAILED).
 */
public enum TrainingStatus {
    PENDING(0),
    TRAINING(1),
    COMPLETED(2),
    FAILED(2);

    private final int rank;

    TrainingStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Returns true if a project in this status may move to {@code next}.
     * Re-applying the current status is always allowed (no-op).
     */
    public boolean canTransitionTo(TrainingStatus next) {
        if (next == this) {
            return true;
        }
        if (isTerminal()) {
            return false;
        }
        return next.rank > rank;
    }
}
