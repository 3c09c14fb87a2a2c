package com.spendings.backend.entities;

import java.time.Instant;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Public read capability over one client's transactions. Whoever holds the token can read the
 * dashboard; tokens are never expired or revoked.
 */
@Getter
@AllArgsConstructor
@Builder
public class Share {

    private final String clientId;

    private final String token;

    private final Instant createdAt;
}
