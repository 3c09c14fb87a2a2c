package com.spendings.backend.controllers;

import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.spendings.backend.dto.BalanceResponseDTO;
import com.spendings.backend.dto.CreatedResponseDTO;
import com.spendings.backend.dto.ItemsResponseDTO;
import com.spendings.backend.dto.TransactionRequestDTO;
import com.spendings.backend.dto.TransactionResponseDTO;
import com.spendings.backend.services.TransactionService;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
@Slf4j
public class TransactionController {

    private final TransactionService transactionService;

    @PostMapping("/transactions")
    public ResponseEntity<CreatedResponseDTO> create(@Valid @RequestBody TransactionRequestDTO dto) {
        log.info("[Transactions] create clientId={} type={} category={}", dto.clientId(), dto.type(), dto.category());
        return ResponseEntity.ok(transactionService.create(dto));
    }

    @GetMapping("/transactions")
    public ResponseEntity<ItemsResponseDTO<TransactionResponseDTO>> list(
            @RequestParam(name = "client_id") @NotBlank String clientId,
            @RequestParam(name = "category", required = false) String category,
            @RequestParam(name = "limit", defaultValue = "200") @Positive int limit
    ) {
        log.info("[Transactions] list clientId={} category={} limit={}", clientId, category, limit);
        List<TransactionResponseDTO> items = transactionService.list(clientId, category, limit);
        return ResponseEntity.ok(new ItemsResponseDTO<>(items));
    }

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponseDTO> balance(@RequestParam(name = "client_id") @NotBlank String clientId) {
        log.info("[Transactions] balance clientId={}", clientId);
        return ResponseEntity.ok(new BalanceResponseDTO(transactionService.balance(clientId)));
    }
}
