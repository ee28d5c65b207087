package com.edlsim.phase;

public enum MissionStatus {
    ACTIVE,
    SUCCESS,
    FAILURE;

    public boolean isTerminal() { return this != ACTIVE; }
}
