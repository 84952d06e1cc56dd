package ru.perminov.ledger.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.perminov.ledger.dto.AdjustmentRequest;
import ru.perminov.ledger.dto.HoldingDto;
import ru.perminov.ledger.dto.MovementDto;
import ru.perminov.ledger.dto.MovementRequest;
import ru.perminov.ledger.dto.MovementResult;
import ru.perminov.ledger.dto.UpdateHoldingRequest;
import ru.perminov.ledger.service.HoldingMovementService;
import ru.perminov.ledger.service.HoldingService;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HoldingController {

    private final HoldingService holdingService;
    private final HoldingMovementService movementService;

    @GetMapping("/holdings/{id}")
    public HoldingDto get(@PathVariable Long id) {
        return holdingService.get(id);
    }

    @PutMapping("/holdings/{id}")
    public HoldingDto update(@PathVariable Long id, @RequestBody UpdateHoldingRequest request) {
        return holdingService.update(id, request);
    }

    @DeleteMapping("/holdings/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        holdingService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/holdings/{id}/movements")
    public ResponseEntity<MovementResult> move(@PathVariable Long id, @RequestBody MovementRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(movementService.process(id, request));
    }

    @PostMapping("/holdings/{id}/adjustments")
    public ResponseEntity<MovementResult> adjust(@PathVariable Long id, @RequestBody AdjustmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(movementService.adjust(id, request));
    }

    @GetMapping("/holdings/{id}/movements")
    public List<MovementDto> movements(@PathVariable Long id, @RequestParam(required = false) Integer limit) {
        return movementService.history(id, limit);
    }

    @GetMapping("/movements/{id}")
    public MovementDto movement(@PathVariable Long id) {
        return movementService.get(id);
    }
}
