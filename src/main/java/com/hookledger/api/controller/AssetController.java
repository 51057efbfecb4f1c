package com.hookledger.api.controller;

import com.hookledger.api.dto.InitializeAssetRequest;
import com.hookledger.asset.AssetDescriptor;
import com.hookledger.ledger.LedgerService;
import com.hookledger.ledger.SupplyReconciliation;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for the asset descriptor and supply.
 */
@RestController
@RequestMapping("/api/v1/asset")
@RequiredArgsConstructor
@Tag(name = "Asset", description = "Asset registration and supply API")
public class AssetController {

    private final LedgerService ledgerService;

    @PostMapping
    @Operation(summary = "Register the asset; the caller becomes its admin")
    public ResponseEntity<AssetDescriptor> initialize(
            @RequestHeader(CallerHeaders.CALLER) String caller,
            @Valid @RequestBody InitializeAssetRequest request) {

        AssetDescriptor descriptor = ledgerService.initialize(
            caller, request.getName(), request.getSymbol(), request.getDecimals());
        return ResponseEntity.status(HttpStatus.CREATED).body(descriptor);
    }

    @GetMapping
    @Operation(summary = "Get the asset descriptor")
    public ResponseEntity<AssetDescriptor> getDescriptor() {
        return ResponseEntity.ok(ledgerService.assetDescriptor());
    }

    @GetMapping("/supply")
    @Operation(summary = "Get the total supply")
    public ResponseEntity<Map<String, Long>> getTotalSupply() {
        return ResponseEntity.ok(Map.of("totalSupply", ledgerService.totalSupply()));
    }

    @GetMapping("/reconciliation")
    @Operation(summary = "Compare the total supply with the sum of balances")
    public ResponseEntity<SupplyReconciliation> reconcile() {
        return ResponseEntity.ok(ledgerService.reconcile());
    }
}
