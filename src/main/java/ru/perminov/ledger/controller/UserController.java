package ru.perminov.ledger.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.perminov.ledger.dto.AccountDto;
import ru.perminov.ledger.dto.CreateAccountRequest;
import ru.perminov.ledger.dto.UserDto;
import ru.perminov.ledger.dto.UserPortfolio;
import ru.perminov.ledger.dto.UserRequest;
import ru.perminov.ledger.service.AccountService;
import ru.perminov.ledger.service.UserService;
import ru.perminov.ledger.service.ValuationService;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final AccountService accountService;
    private final ValuationService valuationService;

    @GetMapping
    public List<UserDto> list() {
        return userService.list();
    }

    @GetMapping("/{id}")
    public UserDto get(@PathVariable Long id) {
        return userService.get(id);
    }

    @PostMapping
    public ResponseEntity<UserDto> create(@RequestBody UserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.create(request));
    }

    @PutMapping("/{id}")
    public UserDto update(@PathVariable Long id, @RequestBody UserRequest request) {
        return userService.update(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        userService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/accounts")
    public List<AccountDto> accounts(@PathVariable Long id) {
        return accountService.listByUser(id);
    }

    @PostMapping("/{id}/accounts")
    public ResponseEntity<AccountDto> createAccount(@PathVariable Long id, @RequestBody CreateAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(accountService.create(id, request));
    }

    @GetMapping("/{id}/portfolio")
    public UserPortfolio portfolio(@PathVariable Long id) {
        return valuationService.valueUser(id);
    }
}
