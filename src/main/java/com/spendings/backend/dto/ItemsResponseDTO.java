package com.spendings.backend.dto;

import java.util.List;

public record ItemsResponseDTO<T>(List<T> items) {}
