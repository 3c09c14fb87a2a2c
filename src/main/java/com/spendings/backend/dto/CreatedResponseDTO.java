package com.spendings.backend.dto;

public record CreatedResponseDTO(String id) {}
