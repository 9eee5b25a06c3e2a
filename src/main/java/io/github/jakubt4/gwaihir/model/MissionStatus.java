package io.github.jakubt4.gwaihir.model;

public enum MissionStatus {
    SUCCESS,
    ABORTED,
    PREFLIGHT_FAILED,
    CONFIG_INVALID
}
