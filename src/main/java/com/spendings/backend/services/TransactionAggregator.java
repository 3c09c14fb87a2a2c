package com.spendings.backend.services;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;

import com.spendings.backend.mappers.DocumentValues;
import com.spendings.backend.mappers.TransactionMapper;

/**
 * Balance and per-category sums over raw transaction documents. Shared by the categories endpoint
 * and the shared dashboard so both report the same numbers for the same data.
 */
public final class TransactionAggregator {

    public static final String UNCATEGORIZED = "Uncategorized";

    private TransactionAggregator() {}

    public static double balance(List<Document> transactions) {
        double total = 0.0;
        for (Document tx : transactions) {
            total += DocumentValues.amountOrZero(tx, TransactionMapper.AMOUNT);
        }
        return total;
    }

    /**
     * Category to summed amount, in first-seen order.
     */
    public static Map<String, Double> byCategory(List<Document> transactions) {
        Map<String, Double> totals = new LinkedHashMap<>();
        for (Document tx : transactions) {
            String category = DocumentValues.text(tx, TransactionMapper.CATEGORY);
            if (category == null) {
                category = UNCATEGORIZED;
            }
            totals.merge(category, DocumentValues.amountOrZero(tx, TransactionMapper.AMOUNT), Double::sum);
        }
        return totals;
    }
}
