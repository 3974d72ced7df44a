package net.jobclaim.core.driver;

public enum DriverState { IDLE, CLAIMING, EXECUTING, RESCHEDULING, STOPPED }
