package com.example.airtime_backend.util;

public enum TriggerType {
    MANUAL,
    AUTOMATIC
}
