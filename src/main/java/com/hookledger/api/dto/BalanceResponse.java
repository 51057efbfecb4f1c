package com.hookledger.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Balance of one account.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BalanceResponse {

    private String account;
    private String symbol;
    private long balance;
}
