package villagecompute.schedules.scheduling;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link FailurePolicy}.
 */
class FailurePolicyTest {

    @Test
    void testOnFailure_belowThreshold_keepsActive() {
        FailurePolicy.Outcome outcome = FailurePolicy.standard().onFailure(3);
        assertEquals(4, outcome.failureCount());
        assertFalse(outcome.deactivate());
    }

    @Test
    void testOnFailure_reachingThreshold_deactivates() {
        FailurePolicy.Outcome outcome = FailurePolicy.standard().onFailure(FailurePolicy.MAX_FAILURE_COUNT - 1);
        assertEquals(FailurePolicy.MAX_FAILURE_COUNT, outcome.failureCount());
        assertTrue(outcome.deactivate());
    }

    @Test
    void testIsEligible() {
        FailurePolicy policy = FailurePolicy.standard();
        assertTrue(policy.isEligible(0));
        assertTrue(policy.isEligible(4));
        assertFalse(policy.isEligible(5));
    }

    @Test
    void testConstructor_rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new FailurePolicy(0));
    }
}
