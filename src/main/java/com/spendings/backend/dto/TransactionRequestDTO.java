package com.spendings.backend.dto;

import java.time.Instant;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.spendings.backend.enums.EntryType;
import com.spendings.backend.mappers.TimestampDeserializer;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record TransactionRequestDTO(

        @NotBlank(message = "client_id is required")
        String clientId,

        @NotNull(message = "amount is required")
        Double amount,

        @NotNull(message = "category is required")
        String category,

        String note,

        @NotNull(message = "type is required (income or expense)")
        EntryType type,

        // sem offset = UTC, só data = meia-noite UTC
        @JsonDeserialize(using = TimestampDeserializer.class)
        Instant date
) {}
