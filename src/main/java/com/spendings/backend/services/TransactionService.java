package com.spendings.backend.services;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.bson.Document;
import org.springframework.stereotype.Service;

import com.spendings.backend.dto.CreatedResponseDTO;
import com.spendings.backend.dto.TransactionRequestDTO;
import com.spendings.backend.dto.TransactionResponseDTO;
import com.spendings.backend.entities.Transaction;
import com.spendings.backend.enums.EntryType;
import com.spendings.backend.exceptions.BadRequestException;
import com.spendings.backend.mappers.DocumentValues;
import com.spendings.backend.mappers.TransactionMapper;
import com.spendings.backend.repositories.DocumentStore;
import com.spendings.backend.repositories.StoreCollection;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    public static final int DEFAULT_LIST_LIMIT = 200;

    // sem data vai para o fim
    private static final Comparator<Document> NEWEST_FIRST = Comparator.comparing(
            (Document doc) -> DocumentValues.instant(doc.get(TransactionMapper.DATE)).orElse(Instant.MIN)
    ).reversed();

    private final DocumentStore documentStore;
    private final Clock clock;

    public CreatedResponseDTO create(TransactionRequestDTO dto) {
        if (!Double.isFinite(dto.amount())) {
            throw new BadRequestException("amount must be a finite number");
        }

        double amount = normalizeAmount(dto.amount(), dto.type());

        Transaction entity = Transaction.builder()
                .clientId(dto.clientId())
                .amount(amount)
                .category(dto.category())
                .note(dto.note())
                .date(dto.date() != null ? dto.date() : clock.instant())
                .type(EntryType.fromSign(amount))
                .build();

        String id = documentStore.insert(StoreCollection.TRANSACTION, TransactionMapper.toDocument(entity));
        log.info("[Transactions] created id={} clientId={} type={} amount={}",
                id, entity.getClientId(), entity.getType().getValue(), amount);

        return new CreatedResponseDTO(id);
    }

    public List<TransactionResponseDTO> list(String clientId, String category, int limit) {
        if (limit < 1) {
            throw new BadRequestException("limit must be a positive integer");
        }

        Map<String, Object> filter = new LinkedHashMap<>();
        filter.put(TransactionMapper.CLIENT_ID, clientId);
        if (category != null && !category.isBlank()) {
            filter.put(TransactionMapper.CATEGORY, category);
        }

        return documentStore.find(StoreCollection.TRANSACTION, filter)
                .stream()
                .sorted(NEWEST_FIRST)
                .limit(limit)
                .map(TransactionMapper::toResponseDTO)
                .toList();
    }

    public double balance(String clientId) {
        return TransactionAggregator.balance(findAllByClient(clientId));
    }

    /**
     * Every transaction document of the client, in store order.
     */
    public List<Document> findAllByClient(String clientId) {
        return documentStore.find(StoreCollection.TRANSACTION, Map.of(TransactionMapper.CLIENT_ID, clientId));
    }

    /**
     * Income keeps |amount|, expense becomes -|amount|. The client only picks the sign.
     */
    static double normalizeAmount(double amount, EntryType type) {
        double magnitude = Math.abs(amount);
        // + 0.0 turns -0.0 into 0.0
        return (type == EntryType.INCOME ? magnitude : -magnitude) + 0.0;
    }
}
