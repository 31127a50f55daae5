package com.autonomous.gateway.service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handle for a budgeted region opened through {@link BudgetLedgerService}. Closing it is
 * idempotent and never changes recorded totals; use it in try-with-resources so it is closed
 * on every exit path.
 * <p>
 * Mutable state is guarded by the owning ledger's lock.
 */
public class SpendingScope implements AutoCloseable {

    private final long id;
    private final Double cap;
    private final SpendingScope parent;
    private final BudgetLedgerService ledger;

    final Map<Long, SpendingScope> openChildren = new LinkedHashMap<>();
    double total;
    volatile boolean closed;

    SpendingScope(long id, Double cap, SpendingScope parent, BudgetLedgerService ledger) {
        if (cap != null && (cap < 0 || cap.isNaN())) {
            throw new IllegalArgumentException("Scope cap must be zero or positive, was " + cap);
        }
        this.id = id;
        this.cap = cap;
        this.parent = parent;
        this.ledger = ledger;
    }

    public long getId() {
        return id;
    }

    public Double getCap() {
        return cap;
    }

    public boolean hasCap() {
        return cap != null;
    }

    public SpendingScope getParent() {
        return parent;
    }

    public boolean isClosed() {
        return closed;
    }

    public double currentUsage() {
        return ledger.currentUsage(this);
    }

    public SpendingScope openChild(Double childCap) {
        return ledger.openScope(this, childCap);
    }

    @Override
    public void close() {
        ledger.closeScope(this);
    }

    @Override
    public String toString() {
        return "SpendingScope{id=" + id + ", cap=" + cap + ", closed=" + closed + "}";
    }
}
