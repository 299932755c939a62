package qg.java.grpc;

import io.grpc.Status;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import qg.core.model.QuotaStatus;
import qg.java.engine.AdmissionGate;
import qg.java.report.QuotaReport;
import qg.java.report.StatusLevel;
import qg.proto.HealthCheckRequest;
import qg.proto.HealthCheckResponse;
import qg.proto.QuotaStatusRequest;
import qg.proto.QuotaStatusResponse;
import qg.proto.QuotaStatusServiceGrpc;

/**
 * gRPC diagnostics over an {@link AdmissionGate}.
 *
 * <p>This is a thin, read-only wrapper:
 * <ul>
 *   <li>Status snapshot rendered through {@link QuotaReport}</li>
 *   <li>Health check including whether a request could be made right now</li>
 *   <li>Error handling (INTERNAL for unexpected errors)</li>
 * </ul>
 *
 * <p>It never admits: reads do not queue behind pending admissions and do not consume quota.
 */
public final class QuotaStatusServiceImpl extends QuotaStatusServiceGrpc.QuotaStatusServiceImplBase {

    private static final Logger log = LoggerFactory.getLogger(QuotaStatusServiceImpl.class);

    static final String RATE_LIMITER_CHECK = "rate_limiter";

    private final AdmissionGate gate;

    /**
     * @param gate gate to report on
     * @throws IllegalArgumentException if gate is null
     */
    public QuotaStatusServiceImpl(AdmissionGate gate) {
        if (gate == null) {
            throw new IllegalArgumentException("gate cannot be null");
        }
        this.gate = gate;
    }

    @Override
    public void getQuotaStatus(
        QuotaStatusRequest request,
        StreamObserver<QuotaStatusResponse> responseObserver
    ) {
        try {
            QuotaReport report = QuotaReport.from(gate.status());
            QuotaStatus status = report.status();

            QuotaStatusResponse response = QuotaStatusResponse.newBuilder()
                .setLevel(toProto(report.level()))
                .setMessage(report.level().message())
                .setAvailableRequests(status.available())
                .setTotalLimit(status.limit())
                .setUsedRequests(status.used())
                .setPercentUsed(status.percentUsed())
                .setCanMakeRequestNow(status.canAdmit())
                .setWaitTimeSeconds(report.waitTimeSeconds())
                .setFullResetMinutes(report.fullResetMinutes())
                .addAllRecommendations(report.recommendations())
                .setPendingAdmissions(gate.pendingAdmissions())
                .setAdmittedTotal(gate.admittedCount())
                .build();

            responseObserver.onNext(response);
            responseObserver.onCompleted();

        } catch (Exception e) {
            log.error("Failed to build quota status", e);
            responseObserver.onError(
                Status.INTERNAL
                    .withDescription("Internal error: " + e.getMessage())
                    .withCause(e)
                    .asRuntimeException()
            );
        }
    }

    @Override
    public void healthCheck(
        HealthCheckRequest request,
        StreamObserver<HealthCheckResponse> responseObserver
    ) {
        // If we can respond, we're serving; an exhausted quota is reported as a failed check only
        QuotaReport report = QuotaReport.from(gate.status());

        HealthCheckResponse.Check rateLimiter = HealthCheckResponse.Check.newBuilder()
            .setName(RATE_LIMITER_CHECK)
            .setResult(report.status().canAdmit()
                ? HealthCheckResponse.Check.Result.PASS
                : HealthCheckResponse.Check.Result.FAIL)
            .setMessage(report.summary())
            .build();

        HealthCheckResponse response = HealthCheckResponse.newBuilder()
            .setStatus(HealthCheckResponse.Status.SERVING)
            .addChecks(rateLimiter)
            .build();

        responseObserver.onNext(response);
        responseObserver.onCompleted();
    }

    private static QuotaStatusResponse.Level toProto(StatusLevel level) {
        return switch (level) {
            case HEALTHY -> QuotaStatusResponse.Level.HEALTHY;
            case WARNING -> QuotaStatusResponse.Level.WARNING;
            case CRITICAL -> QuotaStatusResponse.Level.CRITICAL;
        };
    }
}
