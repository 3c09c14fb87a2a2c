package com.spendings.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecurringResponseDTO(
        @JsonProperty("_id") String id,
        String clientId,
        String label,
        Double amount,
        String category,
        String frequency,
        String type,
        String nextDueDate
) {}
