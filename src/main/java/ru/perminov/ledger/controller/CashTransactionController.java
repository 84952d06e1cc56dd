package ru.perminov.ledger.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.perminov.ledger.dto.CashTransactionDto;
import ru.perminov.ledger.dto.ReversalRequest;
import ru.perminov.ledger.service.CashLedgerService;

@RestController
@RequestMapping("/api/cash-transactions")
@RequiredArgsConstructor
public class CashTransactionController {

    private final CashLedgerService cashLedgerService;

    @GetMapping("/{id}")
    public CashTransactionDto get(@PathVariable Long id) {
        return cashLedgerService.get(id);
    }

    @PostMapping("/{id}/reversal")
    public ResponseEntity<CashTransactionDto> reverse(@PathVariable Long id, @RequestBody ReversalRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(cashLedgerService.reverse(id, request));
    }
}
