package net.jobclaim.core.model;

public enum JobStatus {
    WAITING, RUNNING, PAUSED, UNKNOWN;

    public static JobStatus from(String s) {
        if (s == null) return UNKNOWN;
        try { return JobStatus.valueOf(s.toUpperCase()); } catch (IllegalArgumentException e) { return UNKNOWN; }
    }

    public String code() { return name(); }
}
