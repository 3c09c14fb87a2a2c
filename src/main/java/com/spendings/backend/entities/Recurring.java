package com.spendings.backend.entities;

import java.time.Instant;

import com.spendings.backend.enums.EntryType;
import com.spendings.backend.enums.Frequency;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * A planned payment or contribution, not yet posted.
 *
 * Unlike {@link Transaction}, {@code type} is stored as given and is independent of the sign of
 * {@code amount} (a savings transfer can be planned income with a negative amount).
 */
@Getter
@AllArgsConstructor
@Builder
public class Recurring {

    private final String clientId;

    private final String label;

    private final double amount;

    private final String category;

    @Builder.Default
    private final Frequency frequency = Frequency.MONTHLY;

    @Builder.Default
    private final EntryType type = EntryType.INCOME;

    private final Instant nextDueDate;
}
