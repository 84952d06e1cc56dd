package ru.perminov.ledger.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.perminov.ledger.dto.AccountDto;
import ru.perminov.ledger.dto.AccountValuation;
import ru.perminov.ledger.dto.CashTransactionDto;
import ru.perminov.ledger.dto.CashTransactionRequest;
import ru.perminov.ledger.dto.CreateHoldingRequest;
import ru.perminov.ledger.dto.HoldingDto;
import ru.perminov.ledger.dto.UpdateAccountRequest;
import ru.perminov.ledger.service.AccountService;
import ru.perminov.ledger.service.CashLedgerService;
import ru.perminov.ledger.service.HoldingService;
import ru.perminov.ledger.service.ValuationService;

import java.util.List;

@RestController
@RequestMapping("/api/accounts")
@RequiredArgsConstructor
public class AccountController {

    private final AccountService accountService;
    private final HoldingService holdingService;
    private final CashLedgerService cashLedgerService;
    private final ValuationService valuationService;

    @GetMapping("/{id}")
    public AccountDto get(@PathVariable Long id) {
        return accountService.get(id);
    }

    @PutMapping("/{id}")
    public AccountDto update(@PathVariable Long id, @RequestBody UpdateAccountRequest request) {
        return accountService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        accountService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/holdings")
    public List<HoldingDto> holdings(@PathVariable Long id) {
        return holdingService.listByAccount(id);
    }

    @PostMapping("/{id}/holdings")
    public ResponseEntity<HoldingDto> createHolding(@PathVariable Long id, @RequestBody CreateHoldingRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(holdingService.create(id, request));
    }

    @PostMapping("/{id}/cash-transactions")
    public ResponseEntity<CashTransactionDto> recordCash(@PathVariable Long id, @RequestBody CashTransactionRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(cashLedgerService.record(id, request));
    }

    @GetMapping("/{id}/cash-transactions")
    public List<CashTransactionDto> cashHistory(@PathVariable Long id,
                                                @RequestParam(required = false) Integer limit,
                                                @RequestParam(required = false) Integer offset) {
        return cashLedgerService.history(id, limit, offset);
    }

    @GetMapping("/{id}/valuation")
    public AccountValuation valuation(@PathVariable Long id) {
        return valuationService.valueAccount(id);
    }
}
