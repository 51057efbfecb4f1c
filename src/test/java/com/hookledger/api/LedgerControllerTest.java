package com.hookledger.api;

import com.hookledger.api.controller.CallerHeaders;
import com.hookledger.providers.MockAccountActivityOracle;
import com.hookledger.providers.MockReferenceBalanceOracle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.transaction.annotation.Transactional;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests for the REST surface and the mapping of ledger errors to responses.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class LedgerControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MockAccountActivityOracle activityOracle;

    @Autowired
    private MockReferenceBalanceOracle referenceBalanceOracle;

    @BeforeEach
    void setUp() throws Exception {
        activityOracle.reset();
        referenceBalanceOracle.reset();

        mockMvc.perform(post("/api/v1/asset")
                .header(CallerHeaders.CALLER, "issuer")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Hooked Coin\",\"symbol\":\"HKC\",\"decimals\":8}"))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.symbol").value("HKC"))
            .andExpect(jsonPath("$.admin").value("issuer"));
    }

    private void mint(String to, long amount) throws Exception {
        mockMvc.perform(post("/api/v1/ledger/mint")
                .header(CallerHeaders.CALLER, "issuer")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"" + to + "\",\"amount\":" + amount + "}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.account").value(to));
    }

    @Test
    void testMintAndTransfer() throws Exception {
        mockMvc.perform(put("/api/v1/host/accounts/alice/activity")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\":1}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.activityCounter").value(1));
        activityOracle.seed("bob", 1);
        referenceBalanceOracle.seed("bob", 1001);
        mint("alice", 100);

        mockMvc.perform(post("/api/v1/ledger/transfer")
                .header(CallerHeaders.CALLER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"bob\",\"amount\":10}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(90));

        mockMvc.perform(get("/api/v1/ledger/balances/bob"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.balance").value(10))
            .andExpect(jsonPath("$.symbol").value("HKC"));

        mockMvc.perform(get("/api/v1/asset/supply"))
            .andExpect(jsonPath("$.totalSupply").value(100));

        mockMvc.perform(get("/api/v1/asset/reconciliation"))
            .andExpect(jsonPath("$.balanced").value(true));
    }

    @Test
    void testGateRejectionNamesKindAndGate() throws Exception {
        activityOracle.seed("alice", 1);
        activityOracle.seed("bob", 1);
        referenceBalanceOracle.seed("bob", 1000);
        mint("alice", 100);

        mockMvc.perform(post("/api/v1/ledger/transfer")
                .header(CallerHeaders.CALLER, "alice")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"bob\",\"amount\":10}"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorKind").value("MINIMUM_BALANCE_NOT_MET"))
            .andExpect(jsonPath("$.gate").value("ReferenceBalance"));
    }

    @Test
    void testMintByNonAdminIsForbidden() throws Exception {
        mockMvc.perform(post("/api/v1/ledger/mint")
                .header(CallerHeaders.CALLER, "mallory")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"mallory\",\"amount\":5}"))
            .andExpect(status().isForbidden())
            .andExpect(jsonPath("$.errorKind").value("UNAUTHORIZED"));
    }

    @Test
    void testSecondInitializeConflicts() throws Exception {
        mockMvc.perform(post("/api/v1/asset")
                .header(CallerHeaders.CALLER, "issuer")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\":\"Again\",\"symbol\":\"AGN\",\"decimals\":2}"))
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.errorKind").value("ALREADY_INITIALIZED"));
    }

    @Test
    void testInvalidRequests() throws Exception {
        mockMvc.perform(post("/api/v1/ledger/transfer")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"bob\",\"amount\":10}"))
            .andExpect(status().isUnauthorized());

        mockMvc.perform(post("/api/v1/ledger/mint")
                .header(CallerHeaders.CALLER, "issuer")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"to\":\"bob\",\"amount\":-1}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.amount").exists());
    }

    @Test
    void testEventsEndpoint() throws Exception {
        mint("alice", 7);

        mockMvc.perform(get("/api/v1/ledger/events").param("account", "alice"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].kind").value("MINT"))
            .andExpect(jsonPath("$[0].amount").value(7));
    }
}
