package com.autonomous.gateway.service;

import com.autonomous.gateway.exception.AdmissionTimeoutException;
import com.autonomous.gateway.model.EndpointConfig;
import com.autonomous.gateway.model.LimiterSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding-window admission gate for one endpoint.
 * <p>
 * Each admission is logged with its time and estimated tokens. An admission counts against the
 * window while its call is in flight or until one period has passed since it was admitted, so
 * no sliding window of one period ever holds more than the request ceiling. Waiters are served
 * strictly in arrival order: only the head of the queue may be admitted.
 */
@Slf4j
public class AdmissionLimiter {

    private final String endpointId;
    private final int requestCeiling;
    private final long tokenCeiling;
    private final long periodNanos;
    private final int maxConcurrent;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<Object> waiters = new ArrayDeque<>();
    private final Deque<Admission> window = new ArrayDeque<>();
    private int inFlight;

    public AdmissionLimiter(EndpointConfig config) {
        config.validate();
        this.endpointId = config.getEndpointId();
        this.requestCeiling = config.getRequestsPerPeriod();
        this.tokenCeiling = config.getTokensPerPeriod();
        this.periodNanos = TimeUnit.MILLISECONDS.toNanos(config.getPeriodMs());
        this.maxConcurrent = config.getMaxConcurrent();
    }

    public String getEndpointId() {
        return endpointId;
    }

    /**
     * Blocks until a request with {@code estimatedTokens} fits under every ceiling.
     *
     * @param deadline how long to wait at most, or {@code null} to wait indefinitely
     * @throws AdmissionTimeoutException if the deadline elapses first
     * @throws InterruptedException if the waiting thread is interrupted; nothing stays reserved
     */
    public AdmissionLease admit(long estimatedTokens, Duration deadline) throws InterruptedException {
        if (estimatedTokens < 0) {
            throw new IllegalArgumentException("Estimated tokens must not be negative");
        }
        if (tokenCeiling > 0 && estimatedTokens > tokenCeiling) {
            throw new IllegalArgumentException(String.format(
                "Request of %d tokens can never fit the %d token ceiling of %s", estimatedTokens, tokenCeiling, endpointId));
        }

        long startedAt = System.nanoTime();
        Object ticket = new Object();
        boolean admitted = false;
        lock.lockInterruptibly();
        try {
            waiters.addLast(ticket);
            while (true) {
                long now = System.nanoTime();
                long waitNanos = Long.MAX_VALUE;
                if (waiters.peekFirst() == ticket) {
                    expire(now);
                    waitNanos = nanosUntilAdmissible(estimatedTokens, now);
                    if (waitNanos == 0) {
                        Admission admission = new Admission(now, estimatedTokens);
                        window.addLast(admission);
                        inFlight++;
                        waiters.removeFirst();
                        admitted = true;
                        changed.signalAll();
                        log.debug("Admitted request to {} after {} ms ({} in window, {} in flight)",
                            endpointId, TimeUnit.NANOSECONDS.toMillis(now - startedAt), window.size(), inFlight);
                        return new AdmissionLease(this, admission);
                    }
                }

                if (deadline != null) {
                    long remaining = deadline.toNanos() - (now - startedAt);
                    if (remaining <= 0) {
                        log.warn("Admission to {} timed out after {} ms", endpointId, deadline.toMillis());
                        throw new AdmissionTimeoutException(endpointId, deadline);
                    }
                    waitNanos = Math.min(waitNanos, remaining);
                }

                if (waitNanos == Long.MAX_VALUE) {
                    changed.await();
                } else {
                    changed.awaitNanos(waitNanos);
                }
            }
        } finally {
            if (!admitted) {
                waiters.remove(ticket);
                changed.signalAll();
            }
            lock.unlock();
        }
    }

    public LimiterSnapshot snapshot() {
        lock.lock();
        try {
            expire(System.nanoTime());
            return LimiterSnapshot.builder()
                .endpointId(endpointId)
                .requestsInWindow(window.size())
                .tokensInWindow(window.stream().mapToLong(a -> a.tokens).sum())
                .inFlight(inFlight)
                .waiting(waiters.size())
                .requestCeiling(requestCeiling)
                .tokenCeiling(tokenCeiling)
                .periodMs(TimeUnit.NANOSECONDS.toMillis(periodNanos))
                .build();
        } finally {
            lock.unlock();
        }
    }

    void reconcile(Admission admission, long actualTokens) {
        lock.lock();
        try {
            long previous = admission.tokens;
            admission.tokens = Math.max(0, actualTokens);
            if (admission.tokens != previous) {
                log.debug("Reconciled tokens on {}: estimated {}, actual {}", endpointId, previous, actualTokens);
            }
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    void release(Admission admission) {
        lock.lock();
        try {
            if (admission.inFlight) {
                admission.inFlight = false;
                inFlight--;
                changed.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    void revoke(Admission admission) {
        lock.lock();
        try {
            if (admission.inFlight) {
                admission.inFlight = false;
                inFlight--;
            }
            window.remove(admission);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private void expire(long now) {
        Iterator<Admission> it = window.iterator();
        while (it.hasNext()) {
            Admission admission = it.next();
            if (!admission.inFlight && now - admission.admittedAt >= periodNanos) {
                it.remove();
            }
        }
    }

    /**
     * Zero when the request fits now, the nanos until enough settled admissions age out, or
     * {@code Long.MAX_VALUE} when only a release can make room.
     */
    private long nanosUntilAdmissible(long tokens, long now) {
        if (maxConcurrent > 0 && inFlight >= maxConcurrent) {
            return Long.MAX_VALUE;
        }

        long wait = 0;
        int excessRequests = window.size() + 1 - requestCeiling;
        long usedTokens = window.stream().mapToLong(a -> a.tokens).sum();
        long excessTokens = tokenCeiling > 0 ? usedTokens + tokens - tokenCeiling : 0;
        if (excessRequests <= 0 && excessTokens <= 0) {
            return 0;
        }

        int freedRequests = 0;
        long freedTokens = 0;
        for (Admission admission : window) {
            if (admission.inFlight) {
                continue;
            }
            freedRequests++;
            freedTokens += admission.tokens;
            wait = Math.max(1, admission.admittedAt + periodNanos - now);
            if (freedRequests >= excessRequests && freedTokens >= excessTokens) {
                return wait;
            }
        }
        return Long.MAX_VALUE;
    }

    static final class Admission {
        final long admittedAt;
        long tokens;
        boolean inFlight = true;

        Admission(long admittedAt, long tokens) {
            this.admittedAt = admittedAt;
            this.tokens = tokens;
        }
    }
}
