package qg.core.model;

/**
 * Point-in-time quota snapshot. Every field is derived from the same refill, so they agree with
 * each other even though the bucket may change right after the snapshot is taken.
 *
 * @param available whole tokens available now (floored)
 * @param limit bucket capacity, i.e. requests per hour
 * @param used {@code limit - available}
 * @param percentUsed {@code round(used / limit * 100)}
 * @param canAdmit whether an admission would proceed without waiting
 * @param waitTimeMs time until one whole token is available, 0 if one already is
 * @param resetTimeMs time until the bucket is full again, 0 if it already is
 */
public record QuotaStatus(
    long available,
    double limit,
    double used,
    long percentUsed,
    boolean canAdmit,
    long waitTimeMs,
    long resetTimeMs
) {
}
