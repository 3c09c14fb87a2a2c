package com.spendings.backend.services;

import java.util.List;

import org.springframework.core.env.Environment;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import com.spendings.backend.dto.StatusReportDTO;
import com.spendings.backend.exceptions.StoreUnavailableException;
import com.spendings.backend.repositories.DocumentStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Service
@RequiredArgsConstructor
@Slf4j
public class StatusService {

    static final String BACKEND_RUNNING = "Running";
    static final int MAX_LISTED_COLLECTIONS = 10;

    private final DocumentStore documentStore;
    private final Environment environment;

    /**
     * Probes the document store. Throws {@link StoreUnavailableException}, carrying the partial
     * report, when the store cannot be reached.
     */
    public StatusReportDTO diagnose() {
        String databaseUrl = environment.containsProperty("DATABASE_URL") ? "Set" : "Not Set";
        try {
            String databaseName = documentStore.databaseName();
            List<String> collections = documentStore.collectionNames()
                    .stream()
                    .sorted()
                    .limit(MAX_LISTED_COLLECTIONS)
                    .toList();

            return new StatusReportDTO(BACKEND_RUNNING, "Connected & Working", databaseUrl, databaseName,
                    "Connected", collections);
        } catch (DataAccessException e) {
            log.warn("[Status] document store unavailable: {}", e.getMessage());
            StatusReportDTO report = new StatusReportDTO(BACKEND_RUNNING, "Not Available", databaseUrl, null,
                    "Not Connected", List.of());
            throw new StoreUnavailableException("Database not available", report, e);
        }
    }
}
