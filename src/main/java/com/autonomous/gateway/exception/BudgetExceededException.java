package com.autonomous.gateway.exception;

import com.autonomous.gateway.model.CallRecord;
import lombok.Getter;

import java.util.List;

/**
 * A spending scope's cap was reached. {@link #isSpendOccurred()} tells whether the call was
 * blocked before spending or the charge was already recorded when the cap was crossed.
 */
@Getter
public class BudgetExceededException extends GatewayException {

    private final long scopeId;
    private final double cap;
    private final double total;
    private final boolean spendOccurred;
    private final List<Long> scopeChain;
    private CallRecord callRecord;

    public BudgetExceededException(long scopeId, double cap, double total, boolean spendOccurred, List<Long> scopeChain) {
        super(String.format("Scope %d %s its cap of $%.4f (usage $%.4f, scopes %s)",
            scopeId, spendOccurred ? "exceeded" : "has no room left under", cap, total, scopeChain));
        this.scopeId = scopeId;
        this.cap = cap;
        this.total = total;
        this.spendOccurred = spendOccurred;
        this.scopeChain = List.copyOf(scopeChain);
    }

    public BudgetExceededException withCallRecord(CallRecord record) {
        this.callRecord = record;
        return this;
    }
}
