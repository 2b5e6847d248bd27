package io.chrono4j.core;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    FAILED
}
