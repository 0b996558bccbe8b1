package uk.gegc.interviewledger.features.credit.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CreditHistoryType {
    USED,
    RESTORED,
    ALLOCATED,
    DEALLOCATED;

    /**
     * Whether the entry lowers the student's remaining balance.
     */
    public boolean isDebit() {
        return this == USED || this == DEALLOCATED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CreditHistoryType fromWireName(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
