package com.videostab.core.exception;

public class StabilizationException extends RuntimeException {
    private final FailureKind kind;
    private final String stage;

    public StabilizationException(FailureKind kind, String stage, String message) {
        super("[" + stage + "] " + message);
        this.kind = kind;
        this.stage = stage;
    }

    public StabilizationException(FailureKind kind, String stage, String message, Throwable cause) {
        super("[" + stage + "] " + message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getStage() {
        return stage;
    }
}
