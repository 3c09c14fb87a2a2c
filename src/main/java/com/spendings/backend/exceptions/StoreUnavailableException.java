package com.spendings.backend.exceptions;

import com.spendings.backend.dto.StatusReportDTO;

/**
 * The document store is unreachable or misconfigured. Raised by the diagnostics endpoint only;
 * business endpoints let store failures surface as server errors.
 */
public class StoreUnavailableException extends RuntimeException {

    private final transient StatusReportDTO report;

    public StoreUnavailableException(String message, StatusReportDTO report, Throwable cause) {
        super(message, cause);
        this.report = report;
    }

    public StatusReportDTO getReport() {
        return report;
    }
}
