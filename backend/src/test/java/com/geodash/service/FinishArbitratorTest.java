package com.geodash.service;

import com.geodash.model.FinishStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FinishArbitratorTest {

    private static final Duration WINDOW = Duration.ofSeconds(90);
    private static final OffsetDateTime T0 = OffsetDateTime.of(2026, 5, 3, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final UUID ALICE = UUID.fromString("00000000-0000-0000-0000-00000000000a");
    private static final UUID BOB = UUID.fromString("00000000-0000-0000-0000-00000000000b");

    @Test
    void noFinishersKeepsEmptyStateUnchanged() {
        ArbitrationResult result = FinishArbitrator.reconcile(List.of(), FinishResolutionState.EMPTY, T0, WINDOW);

        assertSame(FinishResolutionState.EMPTY, result.state());
        assertEquals(FinishStatus.NONE, result.state().status());
        assertFalse(result.changed());
    }

    @Test
    void provisionalThenFinalAfterNinetySeconds() {
        List<FinishCandidate> finishers = List.of(new FinishCandidate(ALICE, T0));

        ArbitrationResult first = FinishArbitrator.reconcile(finishers, FinishResolutionState.EMPTY, T0, WINDOW);
        assertTrue(first.changed());
        assertEquals(FinishStatus.PROVISIONAL, first.state().status());
        assertEquals(ALICE, first.state().provisionalWinnerUserId());
        assertEquals(T0, first.state().provisionalAt());
        assertEquals(T0.plusSeconds(90), first.state().confirmationWindowEndsAt());
        assertNull(first.state().finalWinnerUserId());

        ArbitrationResult beforeWindow = FinishArbitrator.reconcile(
                finishers, first.state(), T0.plusSeconds(89), WINDOW);
        assertFalse(beforeWindow.changed());
        assertEquals(FinishStatus.PROVISIONAL, beforeWindow.state().status());

        OffsetDateTime windowEnd = T0.plusSeconds(90);
        ArbitrationResult atWindowEnd = FinishArbitrator.reconcile(finishers, beforeWindow.state(), windowEnd, WINDOW);
        assertTrue(atWindowEnd.changed());
        assertEquals(FinishStatus.FINAL, atWindowEnd.state().status());
        assertEquals(ALICE, atWindowEnd.state().finalWinnerUserId());
        assertEquals(windowEnd, atWindowEnd.state().finalizedAt());

        ArbitrationResult later = FinishArbitrator.reconcile(
                finishers, atWindowEnd.state(), windowEnd.plusMinutes(5), WINDOW);
        assertFalse(later.changed());
        assertEquals(windowEnd, later.state().finalizedAt());
    }

    @Test
    void earlierFinisherReopensAFinalDecision() {
        FinishResolutionState decided = new FinishResolutionState(
                ALICE, T0, T0.plusSeconds(90), ALICE, T0.plusSeconds(90));
        OffsetDateTime now = T0.plusMinutes(10);

        ArbitrationResult result = FinishArbitrator.reconcile(
                List.of(new FinishCandidate(ALICE, T0), new FinishCandidate(BOB, T0.minusMinutes(1))),
                decided,
                now,
                WINDOW
        );

        assertTrue(result.changed());
        assertEquals(FinishStatus.PROVISIONAL, result.state().status());
        assertEquals(BOB, result.state().provisionalWinnerUserId());
        assertEquals(T0.minusMinutes(1), result.state().provisionalAt());
        assertEquals(now.plusSeconds(90), result.state().confirmationWindowEndsAt());
        assertNull(result.state().finalWinnerUserId());
        assertNull(result.state().finalizedAt());
    }

    @Test
    void equalCompletionTimesBreakTiesByUserId() {
        ArbitrationResult result = FinishArbitrator.reconcile(
                List.of(new FinishCandidate(BOB, T0), new FinishCandidate(ALICE, T0)),
                FinishResolutionState.EMPTY,
                T0,
                WINDOW
        );

        assertEquals(ALICE, result.state().provisionalWinnerUserId());
    }

    @Test
    void losingAllFinishersClearsTheDecision() {
        FinishResolutionState decided = new FinishResolutionState(
                ALICE, T0, T0.plusSeconds(90), ALICE, T0.plusSeconds(90));

        ArbitrationResult result = FinishArbitrator.reconcile(List.of(), decided, T0.plusMinutes(3), WINDOW);

        assertTrue(result.changed());
        assertEquals(FinishStatus.NONE, result.state().status());
    }

    @Test
    void sameWinnerWithNewCompletionTimeKeepsTheWindow() {
        FinishResolutionState provisional = new FinishResolutionState(ALICE, T0, T0.plusSeconds(90), null, null);
        OffsetDateTime corrected = T0.plusSeconds(20);

        ArbitrationResult result = FinishArbitrator.reconcile(
                List.of(new FinishCandidate(ALICE, corrected)), provisional, T0.plusSeconds(30), WINDOW);

        assertTrue(result.changed());
        assertEquals(ALICE, result.state().provisionalWinnerUserId());
        assertEquals(corrected, result.state().provisionalAt());
        assertEquals(T0.plusSeconds(90), result.state().confirmationWindowEndsAt());
    }

    @Test
    void offsetOnlyDifferencesAreNotChanges() {
        FinishResolutionState stored = new FinishResolutionState(
                ALICE,
                T0.withOffsetSameInstant(ZoneOffset.ofHours(2)),
                T0.plusSeconds(90).withOffsetSameInstant(ZoneOffset.ofHours(2)),
                null,
                null
        );

        ArbitrationResult result = FinishArbitrator.reconcile(
                List.of(new FinishCandidate(ALICE, T0)), stored, T0.plusSeconds(10), WINDOW);

        assertFalse(result.changed());
    }

    @Test
    void zeroWindowFinalizesOnFirstObservation() {
        ArbitrationResult result = FinishArbitrator.reconcile(
                List.of(new FinishCandidate(ALICE, T0)), FinishResolutionState.EMPTY, T0, Duration.ZERO);

        assertEquals(FinishStatus.FINAL, result.state().status());
        assertEquals(ALICE, result.state().finalWinnerUserId());
        assertEquals(T0, result.state().finalizedAt());
    }
}
