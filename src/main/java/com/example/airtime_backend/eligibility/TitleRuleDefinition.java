package com.example.airtime_backend.eligibility;

import com.example.airtime_backend.model.TitleMappingRule;

import java.util.UUID;

/**
 * Read-only snapshot of an active {@link TitleMappingRule}.
 */
public record TitleRuleDefinition(UUID id,
                                  String beforeTitle,
                                  String afterTitle,
                                  String categoryName) {

    public static TitleRuleDefinition from(TitleMappingRule rule) {
        return new TitleRuleDefinition(rule.getId(), rule.getBeforeTitle(), rule.getAfterTitle(),
                rule.getCategory().getName());
    }

    public boolean hasAfterTitle() {
        return afterTitle != null && !afterTitle.isBlank();
    }
}
