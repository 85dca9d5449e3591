package com.telcobright.coherence.batch;

import com.telcobright.coherence.remote.ErrorKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class BatchRecoveryPlanTest {

    private static BatchResult.FailedItem failure(String id, ErrorKind kind) {
        return new BatchResult.FailedItem(id, kind, kind.name().toLowerCase(), 1);
    }

    @Test
    void testFailuresAreSplitByKind() {
        BatchResult result = new BatchResult(
            List.of("m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9", "m10"),
            List.of(failure("m11", ErrorKind.TIMEOUT), failure("m12", ErrorKind.NOT_FOUND),
                failure("m13", ErrorKind.NETWORK_ERROR)),
            false);

        BatchRecoveryPlan plan = BatchRecoveryPlan.analyze(result);

        assertTrue(plan.canRetry());
        assertEquals(List.of("m11", "m13"), plan.getRetryableIds());
        assertEquals(List.of("m12"), plan.getPermanentIds());
        assertEquals(List.of("m12"), plan.getInvestigateIds());
        assertTrue(plan.getSkipIds().isEmpty());
        assertEquals(List.of("Retry 2 failed operations", "Review 1 permanent failures",
            "High failure rate - check system health"), plan.getSuggestedActions());
    }

    @Test
    void testLowFailureRateNeedsNoHealthCheck() {
        List<String> successful = new ArrayList<>();
        for (int i = 0; i < 19; i++) {
            successful.add("m" + i);
        }
        BatchResult result = new BatchResult(successful, List.of(failure("x", ErrorKind.VALIDATION_ERROR)), false);

        BatchRecoveryPlan plan = BatchRecoveryPlan.analyze(result);

        assertFalse(plan.canRetry());
        assertEquals(List.of("Review 1 permanent failures"), plan.getSuggestedActions());
    }

    @Test
    void testOnlyTheFirstPermanentFailuresAreInvestigated() {
        List<BatchResult.FailedItem> failed = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            failed.add(failure("bad-" + i, ErrorKind.CONFLICT));
        }

        BatchRecoveryPlan plan = BatchRecoveryPlan.analyze(new BatchResult(List.of(), failed, false));

        assertEquals(BatchRecoveryPlan.INVESTIGATE_LIMIT, plan.getInvestigateIds().size());
        assertEquals(List.of("bad-10", "bad-11"), plan.getSkipIds());
    }

    @Test
    void testRetryBatchKeepsOriginalOrder() {
        List<MutationRequest> items = List.of(
            MutationRequest.update("member", "m1", Map.of("status", "active")),
            MutationRequest.update("member", "m2", Map.of("status", "active")),
            MutationRequest.update("member", "m3", Map.of("status", "active")));
        BatchResult result = new BatchResult(List.of("m2"),
            List.of(failure("m3", ErrorKind.TIMEOUT), failure("m1", ErrorKind.NETWORK_ERROR)), false);

        List<MutationRequest> retry = BatchRecoveryPlan.analyze(result).retryBatch(items);

        assertEquals(2, retry.size());
        assertEquals("m1", retry.get(0).getId());
        assertEquals("m3", retry.get(1).getId());
    }

    @Test
    void testEmptyResultHasNoActions() {
        BatchRecoveryPlan plan = BatchRecoveryPlan.analyze(BatchResult.empty());

        assertFalse(plan.canRetry());
        assertTrue(plan.getSuggestedActions().isEmpty());
    }
}
