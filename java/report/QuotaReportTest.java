package qg.java.report;

import org.junit.jupiter.api.Test;
import qg.core.clock.ManualClock;
import qg.core.model.QuotaStatus;
import qg.java.engine.AdmissionGate;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QuotaReportTest {

    @Test
    void levelThresholds() {
        assertEquals(StatusLevel.HEALTHY, StatusLevel.forPercentUsed(0));
        assertEquals(StatusLevel.HEALTHY, StatusLevel.forPercentUsed(49));
        assertEquals(StatusLevel.WARNING, StatusLevel.forPercentUsed(50));
        assertEquals(StatusLevel.WARNING, StatusLevel.forPercentUsed(79));
        assertEquals(StatusLevel.CRITICAL, StatusLevel.forPercentUsed(80));
        assertEquals(StatusLevel.CRITICAL, StatusLevel.forPercentUsed(100));
    }

    @Test
    void freshGate_isHealthyWithoutRecommendations() {
        AdmissionGate gate = new AdmissionGate(new ManualClock(0L), 180);

        QuotaReport report = QuotaReport.from(gate.status());

        assertEquals(StatusLevel.HEALTHY, report.level());
        assertEquals(0L, report.waitTimeSeconds());
        assertEquals(0L, report.fullResetMinutes());
        assertTrue(report.recommendations().isEmpty());
        assertEquals("180/180 requests available", report.summary());
    }

    @Test
    void exhaustedGate_roundsTimesUp() {
        ManualClock clock = new ManualClock(0L);
        AdmissionGate gate = new AdmissionGate(clock, 180);
        for (int i = 0; i < 180; i++) gate.admit();
        clock.advanceMillis(500); // 0.025 tokens back

        QuotaReport report = QuotaReport.from(gate.status());

        assertEquals(StatusLevel.CRITICAL, report.level());
        // 19 500 ms to the next token
        assertEquals(20L, report.waitTimeSeconds());
        // 3 599 500 ms to full
        assertEquals(60L, report.fullResetMinutes());
        assertEquals(3, report.recommendations().size());
        assertEquals("Rate limit exhausted", report.summary());
    }

    @Test
    void recommendationsStartAboveHalf() {
        QuotaStatus exactlyHalf = new QuotaStatus(50, 100, 50, 50, true, 0, 1_800_000);
        QuotaStatus aboveHalf = new QuotaStatus(49, 100, 51, 51, true, 0, 1_836_000);

        assertEquals(List.of(), QuotaReport.from(exactlyHalf).recommendations());
        assertEquals(StatusLevel.WARNING, QuotaReport.from(exactlyHalf).level());
        assertEquals(3, QuotaReport.from(aboveHalf).recommendations().size());
        assertEquals(30L, QuotaReport.from(exactlyHalf).fullResetMinutes());
        assertEquals(31L, QuotaReport.from(aboveHalf).fullResetMinutes());
    }

    @Test
    void fractionalLimit_isRenderedAsIs() {
        QuotaStatus status = new QuotaStatus(10, 10.5, 0.5, 5, true, 0, 0);

        assertEquals("10/10.5 requests available", QuotaReport.from(status).summary());
    }

    @Test
    void nullStatus_rejected() {
        assertThrows(IllegalArgumentException.class, () -> QuotaReport.from(null));
    }
}
