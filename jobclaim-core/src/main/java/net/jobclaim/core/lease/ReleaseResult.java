package net.jobclaim.core.lease;

public enum ReleaseResult { RELEASED, LOST }
