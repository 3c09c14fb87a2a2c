package com.spendings.backend.services;

import java.util.Map;

import org.springframework.stereotype.Service;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class CategoryService {

    private final TransactionService transactionService;

    public Map<String, Double> totals(String clientId) {
        return TransactionAggregator.byCategory(transactionService.findAllByClient(clientId));
    }
}
