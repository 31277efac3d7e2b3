package com.example.airtime_backend.util;

public enum RunStatus {
    SUCCESS,
    SKIPPED,
    FAILED
}
