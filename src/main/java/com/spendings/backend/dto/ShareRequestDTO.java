package com.spendings.backend.dto;

import jakarta.validation.constraints.NotBlank;

public record ShareRequestDTO(
        @NotBlank(message = "client_id is required")
        String clientId
) {}
