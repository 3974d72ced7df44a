package net.jobclaim.core.model;

import java.time.Instant;

public record ExecutionResult(boolean success, String message, Instant completedAt) {

    public static ExecutionResult success(Instant completedAt) {
        return new ExecutionResult(true, null, completedAt);
    }

    public static ExecutionResult failure(String message, Instant completedAt) {
        return new ExecutionResult(false, message, completedAt);
    }
}
