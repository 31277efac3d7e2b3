package com.example.airtime_backend.util;

public enum EditAction {
    MERGE
}
