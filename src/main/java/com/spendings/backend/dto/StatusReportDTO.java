package com.spendings.backend.dto;

import java.util.List;

/**
 * Diagnostic view of the backend and its database connection.
 */
public record StatusReportDTO(
        String backend,
        String database,
        String databaseUrl,
        String databaseName,
        String connectionStatus,
        List<String> collections
) {}
