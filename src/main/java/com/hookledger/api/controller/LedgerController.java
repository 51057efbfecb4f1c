package com.hookledger.api.controller;

import com.hookledger.api.dto.BalanceResponse;
import com.hookledger.api.dto.BurnRequest;
import com.hookledger.api.dto.MintRequest;
import com.hookledger.api.dto.TransferRequest;
import com.hookledger.ledger.LedgerEvent;
import com.hookledger.ledger.LedgerService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for mint, burn and transfer.
 */
@RestController
@RequestMapping("/api/v1/ledger")
@RequiredArgsConstructor
@Tag(name = "Ledger", description = "Balance operations API")
public class LedgerController {

    private final LedgerService ledgerService;

    @PostMapping("/mint")
    @Operation(summary = "Mint new units to an account")
    public ResponseEntity<BalanceResponse> mint(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @Valid @RequestBody MintRequest request) {

        ledgerService.mint(caller, request.getTo(), request.getAmount());
        return ResponseEntity.ok(balanceOf(request.getTo()));
    }

    @PostMapping("/burn")
    @Operation(summary = "Burn units held by an account")
    public ResponseEntity<BalanceResponse> burn(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @Valid @RequestBody BurnRequest request) {

        ledgerService.burn(caller, request.getFrom(), request.getAmount());
        return ResponseEntity.ok(balanceOf(request.getFrom()));
    }

    @PostMapping("/transfer")
    @Operation(summary = "Transfer units from the caller to another account")
    public ResponseEntity<BalanceResponse> transfer(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @Valid @RequestBody TransferRequest request) {

        ledgerService.transfer(caller, request.getTo(), request.getAmount());
        return ResponseEntity.ok(balanceOf(caller));
    }

    @GetMapping("/balances/{account}")
    @Operation(summary = "Get the balance of an account")
    public ResponseEntity<BalanceResponse> getBalance(@PathVariable String account) {
        return ResponseEntity.ok(balanceOf(account));
    }

    @GetMapping("/events")
    @Operation(summary = "Get mint and burn events in emission order")
    public ResponseEntity<List<LedgerEvent>> getEvents(@RequestParam(required = false) String account) {
        List<LedgerEvent> events = account == null
            ? ledgerService.events()
            : ledgerService.eventsFor(account);
        return ResponseEntity.ok(events);
    }

    private BalanceResponse balanceOf(String account) {
        return new BalanceResponse(account,
            ledgerService.assetDescriptor().getSymbol(),
            ledgerService.balanceOf(account));
    }
}
