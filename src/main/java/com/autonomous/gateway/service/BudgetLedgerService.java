package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.BudgetExceededException;
import com.autonomous.gateway.exception.ScopeClosedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide ledger of nested spending scopes.
 * <p>
 * Every charge is attributed to a scope and all of its ancestors at once. Scope creation,
 * closure and total updates all happen under one lock, so concurrent call trees see a
 * consistent view. The ledger owns an always-open root scope; scopes opened with no parent
 * nest under the calling thread's current scope, or under the root.
 */
@Slf4j
@Service
public class BudgetLedgerService {

    private final Object lock = new Object();
    private final AtomicLong scopeIds = new AtomicLong();
    private final ThreadLocal<SpendingScope> currentScope = new ThreadLocal<>();
    private final SpendingScope root;

    public BudgetLedgerService() {
        this(0);
    }

    @Autowired
    public BudgetLedgerService(@Value("${gateway.budget.global-cap:0}") double globalCap) {
        this.root = new SpendingScope(scopeIds.incrementAndGet(), globalCap > 0 ? globalCap : null, null, this);
    }

    public SpendingScope rootScope() {
        return root;
    }

    /**
     * Innermost open scope opened by the calling thread, or the root scope.
     */
    public SpendingScope currentScope() {
        SpendingScope scope = currentScope.get();
        while (scope != null && scope.isClosed()) {
            scope = scope.getParent();
        }
        return scope != null ? scope : root;
    }

    public SpendingScope openScope() {
        return openScope(currentScope(), null);
    }

    public SpendingScope openScope(Double cap) {
        return openScope(currentScope(), cap);
    }

    /**
     * Opens a scope nested under {@code parent} and makes it the calling thread's current scope.
     */
    public SpendingScope openScope(SpendingScope parent, Double cap) {
        SpendingScope effectiveParent = parent != null ? parent : root;
        SpendingScope scope;
        synchronized (lock) {
            if (effectiveParent.closed) {
                throw new ScopeClosedException(effectiveParent.getId());
            }
            scope = new SpendingScope(scopeIds.incrementAndGet(), cap, effectiveParent, this);
            effectiveParent.openChildren.put(scope.getId(), scope);
        }
        currentScope.set(scope);
        log.info("Opened spending scope {} under {} with cap {}", scope.getId(), effectiveParent.getId(),
            cap != null ? String.format("$%.4f", cap) : "none");
        return scope;
    }

    /**
     * Attributes {@code amount} to {@code scope} and every ancestor. The charge is always
     * recorded; if any capped scope ends up above its cap, {@link BudgetExceededException} is
     * thrown afterwards with {@code spendOccurred = true}.
     */
    public void charge(SpendingScope scope, double amount) {
        if (amount < 0 || Double.isNaN(amount)) {
            throw new IllegalArgumentException("Charge must be zero or positive, was " + amount);
        }
        if (amount == 0) {
            log.info("Zero-cost charge against scope {}", scope.getId());
        }

        BudgetExceededException breach = null;
        synchronized (lock) {
            if (scope.closed) {
                throw new ScopeClosedException(scope.getId());
            }
            for (SpendingScope s = scope; s != null; s = s.getParent()) {
                s.total += amount;
                if (breach == null && s.hasCap() && s.total > s.getCap()) {
                    breach = new BudgetExceededException(s.getId(), s.getCap(), s.total, true, chainOf(scope));
                }
            }
        }

        if (breach != null) {
            log.warn("Charge of ${} pushed scope {} over its cap of ${} (usage now ${})",
                amount, breach.getScopeId(), breach.getCap(), breach.getTotal());
            throw breach;
        }
        log.debug("Charged ${} to scope {}", amount, scope.getId());
    }

    /**
     * Fails with {@link BudgetExceededException} ({@code spendOccurred = false}) when any capped
     * scope in the chain is already at its cap or has less than {@code amount} left.
     */
    public void ensureWithinBudget(SpendingScope scope, double amount) {
        if (amount < 0) {
            throw new IllegalArgumentException("Amount to check room for must be zero or positive");
        }
        synchronized (lock) {
            if (scope.closed) {
                throw new ScopeClosedException(scope.getId());
            }
            for (SpendingScope s = scope; s != null; s = s.getParent()) {
                if (s.hasCap() && (s.total >= s.getCap() || s.total + amount > s.getCap())) {
                    throw new BudgetExceededException(s.getId(), s.getCap(), s.total, false, chainOf(scope));
                }
            }
        }
    }

    public double currentUsage(SpendingScope scope) {
        synchronized (lock) {
            return scope.total;
        }
    }

    public double amountLeft(SpendingScope scope) {
        synchronized (lock) {
            return scope.hasCap() ? scope.getCap() - scope.total : Double.POSITIVE_INFINITY;
        }
    }

    /**
     * Usage of each currently open child of {@code scope}, keyed by scope id.
     */
    public Map<Long, Double> childUsage(SpendingScope scope) {
        synchronized (lock) {
            Map<Long, Double> usage = new LinkedHashMap<>();
            scope.openChildren.forEach((id, child) -> usage.put(id, child.total));
            return usage;
        }
    }

    /**
     * Scope ids from {@code scope} up to the root.
     */
    public List<Long> scopeChain(SpendingScope scope) {
        synchronized (lock) {
            return chainOf(scope);
        }
    }

    void closeScope(SpendingScope scope) {
        if (scope == root) {
            throw new UnsupportedOperationException("The root spending scope cannot be closed");
        }
        double usage;
        synchronized (lock) {
            if (scope.closed) {
                return;
            }
            closeDescendants(scope);
            scope.closed = true;
            scope.getParent().openChildren.remove(scope.getId());
            usage = scope.total;
        }
        if (currentScope.get() == scope) {
            SpendingScope parent = scope.getParent();
            if (parent == root) {
                currentScope.remove();
            } else {
                currentScope.set(parent);
            }
        }
        log.info("Closed spending scope {} with usage ${}", scope.getId(), usage);
    }

    private void closeDescendants(SpendingScope scope) {
        for (SpendingScope child : new ArrayList<>(scope.openChildren.values())) {
            closeDescendants(child);
            child.closed = true;
            log.warn("Spending scope {} closed because its parent {} closed first", child.getId(), scope.getId());
        }
        scope.openChildren.clear();
    }

    private List<Long> chainOf(SpendingScope scope) {
        List<Long> chain = new ArrayList<>();
        for (SpendingScope s = scope; s != null; s = s.getParent()) {
            chain.add(s.getId());
        }
        return chain;
    }
}
