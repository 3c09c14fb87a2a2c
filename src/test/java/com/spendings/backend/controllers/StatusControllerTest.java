package com.spendings.backend.controllers;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.web.servlet.MockMvc;

import com.spendings.backend.dto.StatusReportDTO;
import com.spendings.backend.exceptions.StoreUnavailableException;
import com.spendings.backend.services.StatusService;

@WebMvcTest(StatusController.class)
class StatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private StatusService statusService;

    @Test
    void root_reportsRunning() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("508 Spendings API Running"));
    }

    @Test
    void diagnostics_connected() throws Exception {
        when(statusService.diagnose()).thenReturn(new StatusReportDTO("Running", "Connected & Working", "Set",
                "spendings", "Connected", List.of("share", "transaction")));

        mockMvc.perform(get("/test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connection_status").value("Connected"))
                .andExpect(jsonPath("$.database_name").value("spendings"))
                .andExpect(jsonPath("$.collections[1]").value("transaction"));
    }

    @Test
    void diagnostics_storeDown_returns503WithReport() throws Exception {
        StatusReportDTO report = new StatusReportDTO("Running", "Not Available", "Not Set", null,
                "Not Connected", List.of());
        when(statusService.diagnose()).thenThrow(new StoreUnavailableException("Database not available", report,
                new DataAccessResourceFailureException("timeout")));

        mockMvc.perform(get("/test"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.message").value("Database not available"))
                .andExpect(jsonPath("$.data.connection_status").value("Not Connected"));
    }
}
