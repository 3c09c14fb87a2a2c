package com.spendings.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "spendings.share")
public record ShareProperties(
        Integer tokenLength
) {
    public ShareProperties {
        // 10 hex chars, ~40 bits
        if (tokenLength == null) {
            tokenLength = 10;
        }
        if (tokenLength < 1 || tokenLength > 32) {
            throw new IllegalArgumentException("spendings.share.token-length must be between 1 and 32");
        }
    }
}
