package net.jobclaim.core.lease;

public enum HeartbeatResult { OK, NOT_OWNER }
