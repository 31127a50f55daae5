package com.autonomous.gateway.service;

/**
 * A granted admission. {@link #release()} once the call has settled; {@link #revoke()} if it
 * never reached the provider. Both are idempotent.
 */
public class AdmissionLease {

    private final AdmissionLimiter limiter;
    private final AdmissionLimiter.Admission admission;

    AdmissionLease(AdmissionLimiter limiter, AdmissionLimiter.Admission admission) {
        this.limiter = limiter;
        this.admission = admission;
    }

    public long getAdmittedAtNanos() {
        return admission.admittedAt;
    }

    /**
     * Replaces the estimated token count with the actual one. Adjusts the window only; the call
     * that already ran is never re-blocked.
     */
    public void reconcile(long actualTokens) {
        limiter.reconcile(admission, actualTokens);
    }

    public void release() {
        limiter.release(admission);
    }

    public void revoke() {
        limiter.revoke(admission);
    }
}
