package me.golemcore.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Approval lifecycle: {@code PENDING -> APPROVED | DENIED}.
 */
public enum ApprovalStatus {

    PENDING, APPROVED, DENIED;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
