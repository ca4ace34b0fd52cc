package com.nomadtap.tap.model;

public enum StreamStatus {
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED
}
