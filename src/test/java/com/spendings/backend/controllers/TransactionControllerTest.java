package com.spendings.backend.controllers;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.spendings.backend.dto.CreatedResponseDTO;
import com.spendings.backend.dto.TransactionRequestDTO;
import com.spendings.backend.dto.TransactionResponseDTO;
import com.spendings.backend.enums.EntryType;
import com.spendings.backend.services.TransactionService;

@WebMvcTest(TransactionController.class)
class TransactionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TransactionService transactionService;

    @Test
    void create_readsSnakeCaseBodyAndReturnsId() throws Exception {
        when(transactionService.create(any())).thenReturn(new CreatedResponseDTO("65f0aa"));

        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"client_id":"c1","amount":20,"type":"expense","category":"Food",
                                 "note":"lunch","date":"2026-02-01T12:00:00Z"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("65f0aa"));

        ArgumentCaptor<TransactionRequestDTO> captor = ArgumentCaptor.forClass(TransactionRequestDTO.class);
        verify(transactionService).create(captor.capture());
        TransactionRequestDTO dto = captor.getValue();
        assertEquals("c1", dto.clientId());
        assertEquals(EntryType.EXPENSE, dto.type());
        assertEquals("lunch", dto.note());
    }

    @Test
    void create_emptyBody_listsEveryMissingField() throws Exception {
        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.message").value("Validation error"))
                .andExpect(jsonPath("$.errors", containsInAnyOrder(
                        "amount: amount is required",
                        "category: category is required",
                        "client_id: client_id is required",
                        "type: type is required (income or expense)"
                )));

        verify(transactionService, never()).create(any());
    }

    @Test
    void create_unknownType_isRejected() throws Exception {
        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"client_id\":\"c1\",\"amount\":5,\"type\":\"gift\",\"category\":\"Misc\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]", startsWith("type:")));
    }

    @Test
    void create_nonNumericAmount_isRejected() throws Exception {
        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"client_id\":\"c1\",\"amount\":\"lots\",\"type\":\"income\",\"category\":\"Misc\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]", startsWith("amount:")));
    }

    @Test
    void create_dateWithoutOffset_isReadAsUtc() throws Exception {
        when(transactionService.create(any())).thenReturn(new CreatedResponseDTO("t1"));

        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"client_id":"c1","amount":10,"type":"income","category":"Salary",
                                 "date":"2026-01-01T10:00:00"}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<TransactionRequestDTO> captor = ArgumentCaptor.forClass(TransactionRequestDTO.class);
        verify(transactionService).create(captor.capture());
        assertEquals(Instant.parse("2026-01-01T10:00:00Z"), captor.getValue().date());
    }

    @Test
    void create_dateOnly_isReadAsUtcMidnight() throws Exception {
        when(transactionService.create(any())).thenReturn(new CreatedResponseDTO("t2"));

        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"client_id":"c1","amount":10,"type":"income","category":"Salary",
                                 "date":"2026-01-01"}
                                """))
                .andExpect(status().isOk());

        ArgumentCaptor<TransactionRequestDTO> captor = ArgumentCaptor.forClass(TransactionRequestDTO.class);
        verify(transactionService).create(captor.capture());
        assertEquals(Instant.parse("2026-01-01T00:00:00Z"), captor.getValue().date());
    }

    @Test
    void create_unreadableDate_isRejected() throws Exception {
        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"client_id\":\"c1\",\"amount\":5,\"type\":\"income\",\"category\":\"Misc\",\"date\":\"yesterday\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("date: invalid value 'yesterday'"));

        verify(transactionService, never()).create(any());
    }

    @Test
    void create_emptyCategory_isAccepted() throws Exception {
        when(transactionService.create(any())).thenReturn(new CreatedResponseDTO("t3"));

        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"client_id\":\"c1\",\"amount\":5,\"type\":\"expense\",\"category\":\"\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("t3"));

        ArgumentCaptor<TransactionRequestDTO> captor = ArgumentCaptor.forClass(TransactionRequestDTO.class);
        verify(transactionService).create(captor.capture());
        assertEquals("", captor.getValue().category());
    }

    @Test
    void create_uppercaseType_isRejected() throws Exception {
        mockMvc.perform(post("/api/transactions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"client_id\":\"c1\",\"amount\":5,\"type\":\"EXPENSE\",\"category\":\"Misc\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]", startsWith("type:")));

        verify(transactionService, never()).create(any());
    }

    @Test
    void list_usesDefaultLimitAndWrapsItems() throws Exception {
        TransactionResponseDTO item = new TransactionResponseDTO("65f0aa", "c1", -20.0, "Food", null,
                "2026-02-01T12:00:00Z", "expense", null, null);
        when(transactionService.list("c1", "Food", 200)).thenReturn(List.of(item));

        mockMvc.perform(get("/api/transactions").param("client_id", "c1").param("category", "Food"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items[0]._id").value("65f0aa"))
                .andExpect(jsonPath("$.items[0].client_id").value("c1"))
                .andExpect(jsonPath("$.items[0].amount").value(-20.0))
                .andExpect(jsonPath("$.items[0].date").value("2026-02-01T12:00:00Z"))
                .andExpect(jsonPath("$.items[0].type").value("expense"));
    }

    @Test
    void list_emptyResult_isNotAnError() throws Exception {
        when(transactionService.list("nobody", null, 200)).thenReturn(List.of());

        mockMvc.perform(get("/api/transactions").param("client_id", "nobody"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.items").isEmpty());
    }

    @Test
    void list_zeroLimit_isRejected() throws Exception {
        mockMvc.perform(get("/api/transactions").param("client_id", "c1").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]", startsWith("limit:")));
    }

    @Test
    void list_nonNumericLimit_isRejected() throws Exception {
        mockMvc.perform(get("/api/transactions").param("client_id", "c1").param("limit", "many"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("limit: invalid value 'many'"));
    }

    @Test
    void balance_requiresClientId() throws Exception {
        mockMvc.perform(get("/api/balance"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errors[0]").value("client_id: is required"));
    }

    @Test
    void balance_returnsSum() throws Exception {
        when(transactionService.balance("c1")).thenReturn(30.0);

        mockMvc.perform(get("/api/balance").param("client_id", "c1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.balance").value(30.0));
    }

    @Test
    void storeFailure_surfacesAsServerError() throws Exception {
        when(transactionService.balance("c1"))
                .thenThrow(new DataAccessResourceFailureException("down"));

        mockMvc.perform(get("/api/balance").param("client_id", "c1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Internal server error"));
    }
}
