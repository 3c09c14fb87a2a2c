package com.spendings.backend.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EntryType {
    INCOME("income"),
    EXPENSE("expense");

    private final String value;

    EntryType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Zero counts as income.
     */
    public static EntryType fromSign(double amount) {
        return amount >= 0 ? INCOME : EXPENSE;
    }

    @JsonCreator
    public static EntryType fromValue(String value) {
        for (EntryType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("type must be one of: income, expense");
    }
}
