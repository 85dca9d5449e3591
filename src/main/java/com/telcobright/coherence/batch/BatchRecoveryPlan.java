package com.telcobright.coherence.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Splits the failures of a finished batch job into ones worth retrying and ones
 * that need a person to look at them.
 */
public class BatchRecoveryPlan {

    static final int INVESTIGATE_LIMIT = 10;
    static final double HIGH_FAILURE_RATE = 0.1;

    private final List<String> retryableIds;
    private final List<String> permanentIds;
    private final List<String> investigateIds;
    private final List<String> skipIds;
    private final List<String> suggestedActions;

    private BatchRecoveryPlan(List<String> retryableIds, List<String> permanentIds, List<String> suggestedActions) {
        this.retryableIds = Collections.unmodifiableList(retryableIds);
        this.permanentIds = Collections.unmodifiableList(permanentIds);
        int limit = Math.min(INVESTIGATE_LIMIT, permanentIds.size());
        this.investigateIds = Collections.unmodifiableList(new ArrayList<>(permanentIds.subList(0, limit)));
        this.skipIds = Collections.unmodifiableList(new ArrayList<>(permanentIds.subList(limit, permanentIds.size())));
        this.suggestedActions = Collections.unmodifiableList(suggestedActions);
    }

    public static BatchRecoveryPlan analyze(BatchResult result) {
        List<String> retryable = new ArrayList<>();
        List<String> permanent = new ArrayList<>();
        for (BatchResult.FailedItem item : result.getFailed()) {
            if (item.isRetryable()) {
                retryable.add(item.getId());
            } else {
                permanent.add(item.getId());
            }
        }

        List<String> actions = new ArrayList<>();
        if (!retryable.isEmpty()) {
            actions.add("Retry " + retryable.size() + " failed operations");
        }
        if (!permanent.isEmpty()) {
            actions.add("Review " + permanent.size() + " permanent failures");
        }
        if (result.getTotalProcessed() > 0
                && (double) result.getTotalFailed() / result.getTotalProcessed() > HIGH_FAILURE_RATE) {
            actions.add("High failure rate - check system health");
        }
        return new BatchRecoveryPlan(retryable, permanent, actions);
    }

    /**
     * The requests of {@code original} whose failure was retryable, in their original order.
     */
    public List<MutationRequest> retryBatch(List<MutationRequest> original) {
        Set<String> ids = new HashSet<>(retryableIds);
        return original.stream()
            .filter(request -> ids.contains(request.getId()))
            .collect(Collectors.toList());
    }

    public boolean canRetry() {
        return !retryableIds.isEmpty();
    }

    // Getters
    public List<String> getRetryableIds() { return retryableIds; }
    public List<String> getPermanentIds() { return permanentIds; }
    public List<String> getInvestigateIds() { return investigateIds; }
    public List<String> getSkipIds() { return skipIds; }
    public List<String> getSuggestedActions() { return suggestedActions; }

    @Override
    public String toString() {
        return String.format("BatchRecoveryPlan{retryable=%d, permanent=%d, actions=%s}",
            retryableIds.size(), permanentIds.size(), suggestedActions);
    }
}
