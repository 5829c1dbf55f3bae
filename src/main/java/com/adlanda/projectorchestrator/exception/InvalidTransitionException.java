package com.adlanda.projectorchestrator.exception;

import com.adlanda.projectorchestrator.model.TrainingStatus;

/**
 * A training status change that would move a project backwards or out of a terminal state.
 */
public class InvalidTransitionException extends OrchestratorException {

    private final TrainingStatus from;
    private final TrainingStatus to;

    public InvalidTransitionException(String projectId, TrainingStatus from, TrainingStatus to) {
        super("Project " + projectId + " cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public TrainingStatus getFrom() {
        return from;
    }

    public TrainingStatus getTo() {
        return to;
    }
}
