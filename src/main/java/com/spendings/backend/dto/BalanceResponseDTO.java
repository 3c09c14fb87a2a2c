package com.spendings.backend.dto;

public record BalanceResponseDTO(double balance) {}
