package com.spendings.backend.entities;

import java.time.Instant;

import com.spendings.backend.enums.EntryType;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * A posted income or expense. The sign of {@code amount} is authoritative and {@code type} always
 * agrees with it.
 */
@Getter
@AllArgsConstructor
@Builder
public class Transaction {

    private final String clientId;

    private final double amount;

    private final String category;

    private final String note;

    private final Instant date;

    private final EntryType type;
}
