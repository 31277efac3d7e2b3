package com.example.airtime_backend.util;

public enum SegmentSource {
    RECOGNITION,
    MERGED,
    USER
}
