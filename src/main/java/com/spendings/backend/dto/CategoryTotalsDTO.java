package com.spendings.backend.dto;

import java.util.Map;

public record CategoryTotalsDTO(Map<String, Double> categories) {}
