package mediaflow.stage;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProcessingCheckPolicyTest {

    private final ProcessingCheckPolicy policy = ProcessingCheckPolicy.defaults();

    @Test
    void delaysGrowToThirtySeconds() {
        assertEquals(Duration.ofSeconds(2), policy.delayFor(0));
        assertEquals(Duration.ofSeconds(4), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(4));
        assertEquals(Duration.ofSeconds(30), policy.delayFor(11));
    }

    @Test
    void expiresOnCheckCount() {
        assertTrue(policy.expiryReason(11, Duration.ZERO).isEmpty());
        assertTrue(policy.expiryReason(12, Duration.ZERO).isPresent());
    }

    @Test
    void expiresOnElapsedTimeAfterMinimumChecks() {
        assertTrue(policy.expiryReason(2, Duration.ofSeconds(500)).isEmpty());
        assertTrue(policy.expiryReason(3, Duration.ofSeconds(120)).isEmpty());
        assertTrue(policy.expiryReason(3, Duration.ofSeconds(121)).isPresent());
    }

    @Test
    void scheduledElapsedSumsDelays() {
        assertEquals(Duration.ZERO, policy.scheduledElapsedAt(1));
        assertEquals(Duration.ofSeconds(30), policy.scheduledElapsedAt(5));
        assertEquals(Duration.ofSeconds(120), policy.scheduledElapsedAt(8));
        assertEquals(Duration.ofSeconds(150), policy.scheduledElapsedAt(9));
    }

    @Test
    void rejectsUnreachableSlowNotice() {
        assertThrows(IllegalArgumentException.class,
                () -> ProcessingCheckPolicy.builder().slowNoticeAt(10).build());
        assertThrows(IllegalArgumentException.class,
                () -> ProcessingCheckPolicy.builder().slowNoticeAt(12).maxElapsed(Duration.ofHours(1)).build());
        ProcessingCheckPolicy late = ProcessingCheckPolicy.builder()
                .slowNoticeAt(10)
                .maxElapsed(Duration.ofSeconds(240))
                .build();
        assertTrue(late.slowNoticeDue(10));
    }

    @Test
    void noticesFollowThresholds() {
        assertFalse(policy.slowNoticeDue(4));
        assertTrue(policy.slowNoticeDue(5));
        assertFalse(policy.progressDue(Duration.ofSeconds(19)));
        assertTrue(policy.progressDue(Duration.ofSeconds(20)));
    }

    @Test
    void rejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> ProcessingCheckPolicy.builder().maxChecks(0).build());
        assertThrows(IllegalArgumentException.class, () -> ProcessingCheckPolicy.builder().slowNoticeAt(0).build());
        assertThrows(NullPointerException.class,
                () -> ProcessingCheckPolicy.builder().progressInterval(null).build());
    }
}
