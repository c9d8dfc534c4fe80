package dev.jobscout.entity;

public enum ScoutResultStatus {
    NEW,
    REVIEWED,
    PROMOTED,
    DISMISSED
}
