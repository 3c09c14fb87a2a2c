package com.spendings.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import com.spendings.backend.dto.MessageDTO;
import com.spendings.backend.dto.StatusReportDTO;
import com.spendings.backend.services.StatusService;

import lombok.RequiredArgsConstructor;

@RestController
@RequiredArgsConstructor
public class StatusController {

    static final String RUNNING_MESSAGE = "508 Spendings API Running";

    private final StatusService statusService;

    @GetMapping("/")
    public ResponseEntity<MessageDTO> root() {
        return ResponseEntity.ok(new MessageDTO(RUNNING_MESSAGE));
    }

    @GetMapping("/test")
    public ResponseEntity<StatusReportDTO> diagnostics() {
        return ResponseEntity.ok(statusService.diagnose());
    }
}
