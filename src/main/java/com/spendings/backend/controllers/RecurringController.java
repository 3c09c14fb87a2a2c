package com.spendings.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.spendings.backend.dto.CreatedResponseDTO;
import com.spendings.backend.dto.DueRemindersDTO;
import com.spendings.backend.dto.ItemsResponseDTO;
import com.spendings.backend.dto.RecurringRequestDTO;
import com.spendings.backend.dto.RecurringResponseDTO;
import com.spendings.backend.services.RecurringService;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Validated
@Slf4j
public class RecurringController {

    private final RecurringService recurringService;

    @PostMapping("/recurring")
    public ResponseEntity<CreatedResponseDTO> create(@Valid @RequestBody RecurringRequestDTO dto) {
        log.info("[Recurring] create clientId={} label={}", dto.clientId(), dto.label());
        return ResponseEntity.ok(recurringService.create(dto));
    }

    @GetMapping("/recurring")
    public ResponseEntity<ItemsResponseDTO<RecurringResponseDTO>> list(
            @RequestParam(name = "client_id") @NotBlank String clientId
    ) {
        log.info("[Recurring] list clientId={}", clientId);
        return ResponseEntity.ok(new ItemsResponseDTO<>(recurringService.list(clientId)));
    }

    @GetMapping("/reminders")
    public ResponseEntity<DueRemindersDTO> reminders(@RequestParam(name = "client_id") @NotBlank String clientId) {
        log.info("[Reminders] clientId={}", clientId);
        return ResponseEntity.ok(new DueRemindersDTO(recurringService.reminders(clientId)));
    }
}
