package com.example.migration.model;

public enum CheckpointStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean canTransitionTo(CheckpointStatus next) {
        if (next == this) {
            return true;
        }
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case COMPLETED, FAILED -> next == RUNNING;
        };
    }
}
