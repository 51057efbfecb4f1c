package com.hookledger.hooks.gates;

import com.hookledger.common.exception.LedgerErrorKind;
import com.hookledger.hooks.Gate;
import com.hookledger.hooks.GateResult;
import com.hookledger.hooks.HookRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

/**
 * Gate that throttles withdrawals which are large relative to the balance.
 *
 * The cap is {@code amount * capRate / scaleFactor} (integer division) and the
 * balance must strictly exceed it. With the default 200/100 a withdrawal is
 * allowed only while the balance is more than twice the amount.
 */
@Component
public class ProportionalCapGate implements Gate {

    private final BigInteger capRate;
    private final BigInteger scaleFactor;

    public ProportionalCapGate(@Value("${hook-ledger.hooks.cap-rate:200}") long capRate,
                               @Value("${hook-ledger.hooks.scale-factor:100}") long scaleFactor) {
        if (capRate < 0 || scaleFactor <= 0) {
            throw new IllegalArgumentException(
                String.format("Invalid cap configuration: rate=%d scale=%d", capRate, scaleFactor));
        }
        this.capRate = BigInteger.valueOf(capRate);
        this.scaleFactor = BigInteger.valueOf(scaleFactor);
    }

    @Override
    public GateResult evaluate(HookRequest request) {
        // BigInteger so amount * capRate cannot wrap
        BigInteger maxCap = BigInteger.valueOf(request.getAmount()).multiply(capRate).divide(scaleFactor);

        if (BigInteger.valueOf(request.getBalance()).compareTo(maxCap) <= 0) {
            return GateResult.decline(LedgerErrorKind.CAP_EXCEEDED,
                String.format("Balance %d does not exceed cap %s for amount %d",
                    request.getBalance(), maxCap, request.getAmount()));
        }

        return GateResult.approve();
    }

    @Override
    public String getGateName() {
        return "ProportionalCap";
    }
}
