package com.hookledger.hooks;

import lombok.Value;

/**
 * The withdraw and deposit hooks of the asset.
 */
@Value
public class HookPredicates {
    HookPredicate withdraw;
    HookPredicate deposit;
}
