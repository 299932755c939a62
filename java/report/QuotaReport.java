package qg.java.report;

import qg.core.model.QuotaStatus;

import java.util.List;

/**
 * Human-oriented view of a {@link QuotaStatus}: coarse time units, a health level and advice.
 *
 * @param status the snapshot this report renders
 * @param level health bucket for {@code status.percentUsed()}
 * @param waitTimeSeconds wait until the next token, rounded up to whole seconds
 * @param fullResetMinutes time until the bucket is full, rounded up to whole minutes
 * @param recommendations hints for callers once more than half the quota is used
 */
public record QuotaReport(
    QuotaStatus status,
    StatusLevel level,
    long waitTimeSeconds,
    long fullResetMinutes,
    List<String> recommendations
) {
    static final List<String> HIGH_USAGE_RECOMMENDATIONS = List.of(
        "Use filtered queries instead of fetching all data",
        "Rely on cached data when possible",
        "Batch operations when available"
    );

    public QuotaReport {
        if (status == null) throw new IllegalArgumentException("status cannot be null");
        recommendations = List.copyOf(recommendations);
    }

    public static QuotaReport from(QuotaStatus status) {
        if (status == null) throw new IllegalArgumentException("status cannot be null");

        return new QuotaReport(
            status,
            StatusLevel.forPercentUsed(status.percentUsed()),
            ceilDiv(status.waitTimeMs(), 1_000L),
            ceilDiv(status.resetTimeMs(), 60_000L),
            status.percentUsed() > 50 ? HIGH_USAGE_RECOMMENDATIONS : List.of()
        );
    }

    /**
     * One-line summary for logs and health output, e.g. {@code "135/180 requests available"}.
     */
    public String summary() {
        if (!status.canAdmit()) {
            return "Rate limit exhausted";
        }
        return status.available() + "/" + formatLimit(status.limit()) + " requests available";
    }

    private static String formatLimit(double limit) {
        if (limit == Math.rint(limit)) {
            return Long.toString((long) limit);
        }
        return Double.toString(limit);
    }

    private static long ceilDiv(long value, long divisor) {
        return -Math.floorDiv(-value, divisor);
    }
}
