package ru.perminov.ledger.controller;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import ru.perminov.ledger.dto.MovementDto;
import ru.perminov.ledger.dto.MovementRequest;
import ru.perminov.ledger.dto.MovementResult;
import ru.perminov.ledger.exception.ConflictException;
import ru.perminov.ledger.exception.ErrorKind;
import ru.perminov.ledger.exception.InsufficientFundsException;
import ru.perminov.ledger.exception.IntegrityException;
import ru.perminov.ledger.exception.NotFoundException;
import ru.perminov.ledger.exception.ValidationException;
import ru.perminov.ledger.model.MovementType;
import ru.perminov.ledger.service.AccountService;
import ru.perminov.ledger.service.CashLedgerService;
import ru.perminov.ledger.service.CurrencyService;
import ru.perminov.ledger.service.HoldingMovementService;
import ru.perminov.ledger.service.HoldingService;
import ru.perminov.ledger.service.ReferenceDataService;
import ru.perminov.ledger.service.ValuationService;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = {HoldingController.class, AccountController.class, CurrencyController.class})
class LedgerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean private HoldingService holdingService;
    @MockBean private HoldingMovementService movementService;
    @MockBean private AccountService accountService;
    @MockBean private CashLedgerService cashLedgerService;
    @MockBean private ValuationService valuationService;
    @MockBean private CurrencyService currencyService;
    @MockBean private ReferenceDataService referenceDataService;

    @Test
    void testMovementIsCreated() throws Exception {
        MovementDto movement = new MovementDto();
        movement.setId(7L);
        movement.setHoldingId(3L);
        movement.setMovementType(MovementType.BUY);
        movement.setMovementDate(LocalDate.of(2024, 2, 1));
        movement.setBookCost(new BigDecimal("290.0000"));
        when(movementService.process(eq(3L), any(MovementRequest.class))).thenReturn(new MovementResult(movement, null, null));

        mockMvc.perform(post("/api/holdings/3/movements")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"movementType\":\"buy\",\"movementDate\":\"2024-02-01\",\"quantity\":50,"
                                + "\"totalConsideration\":300,\"deductibleCosts\":10}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.movement.id").value(7))
                .andExpect(jsonPath("$.movement.movementType").value("buy"))
                .andExpect(jsonPath("$.movement.movementDate").value("2024-02-01"));

        verify(movementService).process(3L, new MovementRequest("buy", "2024-02-01", new BigDecimal("50"),
                new BigDecimal("300"), new BigDecimal("10"), null));
    }

    @Test
    void testErrorKindsMapToStatuses() throws Exception {
        when(movementService.process(eq(1L), any())).thenThrow(new InsufficientFundsException("Insufficient cash"));
        when(movementService.process(eq(2L), any())).thenThrow(NotFoundException.of("Holding", 2L));
        when(movementService.process(eq(3L), any())).thenThrow(new ValidationException("Movement type is required"));

        mockMvc.perform(post("/api/holdings/1/movements").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.kind").value("INSUFFICIENT_FUNDS"))
                .andExpect(jsonPath("$.message").value("Insufficient cash"));
        mockMvc.perform(post("/api/holdings/2/movements").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Holding not found: 2"));
        mockMvc.perform(post("/api/holdings/3/movements").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"));
    }

    @Test
    void testMalformedBodyIsValidationError() throws Exception {
        mockMvc.perform(post("/api/holdings/1/movements").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.kind").value("VALIDATION"));
        mockMvc.perform(get("/api/holdings/abc"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testConflictOnDelete() throws Exception {
        doThrow(new ConflictException("The base currency GBP cannot be deleted"))
                .when(currencyService).delete(1L);

        mockMvc.perform(delete("/api/currencies/1"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.kind").value("CONFLICT"));
        mockMvc.perform(delete("/api/currencies/2"))
                .andExpect(status().isNoContent());
    }

    @Test
    void testMissingRateIsNoContent() throws Exception {
        when(referenceDataService.latestRate(5L)).thenReturn(Optional.empty());
        when(referenceDataService.latestRate(6L)).thenReturn(Optional.of(new ReferenceDataService.DatedValue(LocalDate.of(2024, 2, 1), 12_500L)));

        mockMvc.perform(get("/api/currencies/5/rates/latest"))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/currencies/6/rates/latest"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.value").value(1.25))
                .andExpect(jsonPath("$.scaled").value(12500));
    }

    @Test
    void testCashHistoryPassesPaging() throws Exception {
        when(cashLedgerService.history(4L, 5, 10)).thenReturn(List.of());

        mockMvc.perform(get("/api/accounts/4/cash-transactions").param("limit", "5").param("offset", "10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));

        verify(cashLedgerService).history(4L, 5, 10);
    }

    @Test
    void testStatusMapping() {
        assertEquals(422, ApiExceptionHandler.statusOf(ErrorKind.INSUFFICIENT_QUANTITY).value());
        assertEquals(500, ApiExceptionHandler.statusOf(new IntegrityException("x", null).getKind()).value());
    }
}
