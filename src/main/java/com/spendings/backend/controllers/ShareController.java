package com.spendings.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.spendings.backend.dto.ShareRequestDTO;
import com.spendings.backend.dto.ShareTokenResponseDTO;
import com.spendings.backend.dto.SharedDashboardDTO;
import com.spendings.backend.services.ShareService;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Read-only dashboard links. The token in the path is the only credential.
 */
@RestController
@RequestMapping("/api/share")
@RequiredArgsConstructor
@Slf4j
public class ShareController {

    private final ShareService shareService;

    @PostMapping
    public ResponseEntity<ShareTokenResponseDTO> create(@Valid @RequestBody ShareRequestDTO dto) {
        log.info("[Share] create clientId={}", dto.clientId());
        return ResponseEntity.ok(shareService.create(dto));
    }

    @GetMapping("/{token}")
    public ResponseEntity<SharedDashboardDTO> dashboard(@PathVariable String token) {
        // token não vai para o log
        log.info("[Share] dashboard requested");
        return ResponseEntity.ok(shareService.resolve(token));
    }
}
