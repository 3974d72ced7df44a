package net.jobclaim.core.model;

import java.time.Instant;

public record NewJob(
        String name,
        String executor,
        String expression,
        String config,
        Instant nextDueAt
) {}
