package com.hookledger.api.controller;

import com.hookledger.api.dto.SeedValueRequest;
import com.hookledger.providers.MockAccountActivityOracle;
import com.hookledger.providers.MockReferenceBalanceOracle;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for seeding the in-process host oracles.
 *
 * In production, activity counters and reference balances come from the host
 * and these endpoints do not exist.
 */
@RestController
@RequestMapping("/api/v1/host/accounts")
@RequiredArgsConstructor
@Tag(name = "Host", description = "Mock host oracle API")
public class HostController {

    private final MockAccountActivityOracle activityOracle;
    private final MockReferenceBalanceOracle referenceBalanceOracle;

    @PutMapping("/{account}/activity")
    @Operation(summary = "Set the activity counter of an account")
    public ResponseEntity<Map<String, Long>> seedActivity(
            @PathVariable String account,
            @Valid @RequestBody SeedValueRequest request) {

        activityOracle.seed(account, request.getValue());
        return ResponseEntity.ok(Map.of("activityCounter", activityOracle.activityCounter(account)));
    }

    @PutMapping("/{account}/reference-balance")
    @Operation(summary = "Set the reference-currency balance of an account")
    public ResponseEntity<Map<String, Long>> seedReferenceBalance(
            @PathVariable String account,
            @Valid @RequestBody SeedValueRequest request) {

        referenceBalanceOracle.seed(account, request.getValue());
        return ResponseEntity.ok(Map.of("referenceBalance", referenceBalanceOracle.referenceBalance(account)));
    }
}
