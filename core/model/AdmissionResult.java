package qg.core.model;

public record AdmissionResult(
    Decision decision,
    long retryAfterMillis
) {
    public static AdmissionResult allow() {
        return new AdmissionResult(Decision.ALLOW, 0L);
    }

    public static AdmissionResult reject(long retryAfterMillis) {
        return new AdmissionResult(Decision.REJECT, Math.max(0L, retryAfterMillis));
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }
}
