package com.spendings.backend.dto;

import java.util.List;
import java.util.Map;

public record SharedDashboardDTO(
        String clientId,
        double balance,
        List<TransactionResponseDTO> items,
        Map<String, Double> categories
) {}
