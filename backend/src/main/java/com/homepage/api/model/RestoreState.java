package com.homepage.api.model;

public enum RestoreState {
    PENDING,
    VERIFYING,
    DRAINING,
    SANITIZING,
    RESTORING,
    COMPLETE,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED;
    }
}
