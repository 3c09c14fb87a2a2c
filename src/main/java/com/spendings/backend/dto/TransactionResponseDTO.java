package com.spendings.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransactionResponseDTO(
        @JsonProperty("_id") String id,
        String clientId,
        Double amount,
        String category,
        String note,
        String date,
        String type,
        String createdAt,
        String updatedAt
) {}
