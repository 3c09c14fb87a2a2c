package com.spendings.backend.dto;

public record MessageDTO(String message) {}
