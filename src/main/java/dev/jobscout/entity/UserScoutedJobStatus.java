package dev.jobscout.entity;

public enum UserScoutedJobStatus {
    NEW,
    VIEWED,
    SAVED,
    DISMISSED
}
