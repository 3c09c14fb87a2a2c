package com.spendings.backend.dto;

public record ReminderDTO(
        String label,
        String category,
        Double amount
) {}
