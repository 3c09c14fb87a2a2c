package com.spendings.backend.services;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.bson.Document;
import org.springframework.stereotype.Service;

import com.spendings.backend.config.ShareProperties;
import com.spendings.backend.dto.ShareRequestDTO;
import com.spendings.backend.dto.ShareTokenResponseDTO;
import com.spendings.backend.dto.SharedDashboardDTO;
import com.spendings.backend.entities.Share;
import com.spendings.backend.exceptions.ResourceNotFoundException;
import com.spendings.backend.mappers.DocumentValues;
import com.spendings.backend.mappers.ShareMapper;
import com.spendings.backend.mappers.TransactionMapper;
import com.spendings.backend.repositories.DocumentStore;
import com.spendings.backend.repositories.StoreCollection;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class ShareService {

    private final DocumentStore documentStore;
    private final TransactionService transactionService;
    private final ShareProperties shareProperties;
    private final Clock clock;

    /**
     * Issues a new token for the client. Tokens are not checked for uniqueness; on a collision the
     * older share wins at lookup.
     */
    public ShareTokenResponseDTO create(ShareRequestDTO dto) {
        Share entity = Share.builder()
                .clientId(dto.clientId())
                .token(newToken())
                .createdAt(clock.instant())
                .build();

        documentStore.insert(StoreCollection.SHARE, ShareMapper.toDocument(entity));
        log.info("[Share] token issued for clientId={}", entity.getClientId());

        return new ShareTokenResponseDTO(entity.getToken());
    }

    public SharedDashboardDTO resolve(String token) {
        List<Document> shares = documentStore.find(StoreCollection.SHARE, Map.of(ShareMapper.TOKEN, token), 1);
        if (shares.isEmpty()) {
            throw new ResourceNotFoundException("Share not found");
        }

        String clientId = DocumentValues.text(shares.get(0), ShareMapper.CLIENT_ID);
        if (clientId == null) {
            log.warn("[Share] share {} has no client_id", DocumentValues.idOf(shares.get(0)));
            throw new ResourceNotFoundException("Share not found");
        }
        List<Document> transactions = transactionService.findAllByClient(clientId);

        return new SharedDashboardDTO(
                clientId,
                TransactionAggregator.balance(transactions),
                transactions.stream().map(TransactionMapper::toResponseDTO).toList(),
                TransactionAggregator.byCategory(transactions)
        );
    }

    private String newToken() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, shareProperties.tokenLength());
    }
}
