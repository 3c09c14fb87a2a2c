package com.spendings.backend.controllers;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.spendings.backend.dto.CategoryTotalsDTO;
import com.spendings.backend.services.CategoryService;

import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/categories")
@RequiredArgsConstructor
@Validated
@Slf4j
public class CategoryController {

    private final CategoryService categoryService;

    @GetMapping
    public ResponseEntity<CategoryTotalsDTO> totals(@RequestParam(name = "client_id") @NotBlank String clientId) {
        log.info("[Categories] totals clientId={}", clientId);
        return ResponseEntity.ok(new CategoryTotalsDTO(categoryService.totals(clientId)));
    }
}
