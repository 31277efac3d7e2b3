package com.example.airtime_backend.eligibility;

import java.util.UUID;

public record TitleRename(UUID segmentId, String title, UUID ruleId) {
}
