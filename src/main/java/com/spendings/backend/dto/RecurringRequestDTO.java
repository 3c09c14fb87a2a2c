package com.spendings.backend.dto;

import java.time.Instant;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.spendings.backend.enums.EntryType;
import com.spendings.backend.enums.Frequency;
import com.spendings.backend.mappers.TimestampDeserializer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record RecurringRequestDTO(

        @NotBlank(message = "client_id is required")
        String clientId,

        @NotNull(message = "label is required")
        String label,

        @NotNull(message = "amount is required")
        Double amount,

        @NotNull(message = "category is required")
        String category,

        // monthly quando ausente
        Frequency frequency,

        // income quando ausente
        EntryType type,

        // sem offset = UTC, só data = meia-noite UTC
        @JsonDeserialize(using = TimestampDeserializer.class)
        Instant nextDueDate
) {}
