package com.spendings.backend.dto;

public record ShareTokenResponseDTO(String token) {}
