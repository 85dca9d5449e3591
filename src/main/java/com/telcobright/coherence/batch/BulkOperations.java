package com.telcobright.coherence.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Record-level bulk actions built on the batch executor.
 */
public class BulkOperations {
    private static final Logger logger = LoggerFactory.getLogger(BulkOperations.class);

    public static final String STATUS_FIELD = "status";
    public static final String INACTIVE_STATUS = "inactive";

    private final BatchMutationExecutor executor;
    private final int batchSize;

    public BulkOperations(BatchMutationExecutor executor, int batchSize) {
        this.executor = executor;
        this.batchSize = batchSize;
    }

    /**
     * Applies a separate patch to each id.
     */
    public BatchResult bulkUpdate(String entityType, Map<String, Map<String, Object>> patchesById,
                                  Consumer<BatchProgress> onProgress) {
        List<MutationRequest> items = new ArrayList<>(patchesById.size());
        patchesById.forEach((id, patch) -> items.add(MutationRequest.update(entityType, id, patch)));
        logger.info("Bulk update of {} {} record(s)", items.size(), entityType);
        return executor.run(items, batchSize, onProgress);
    }

    public BatchResult bulkUpdateStatus(String entityType, Collection<String> ids, String status,
                                        Consumer<BatchProgress> onProgress) {
        List<MutationRequest> items = new ArrayList<>(ids.size());
        for (String id : ids) {
            items.add(MutationRequest.update(entityType, id, Map.of(STATUS_FIELD, status)));
        }
        logger.info("Bulk status change of {} {} record(s) to '{}'", items.size(), entityType, status);
        return executor.run(items, batchSize, onProgress);
    }

    /**
     * Deletes the given records. A soft delete marks them inactive instead of
     * removing them.
     */
    public BatchResult bulkDelete(String entityType, Collection<String> ids, boolean softDelete,
                                  Consumer<BatchProgress> onProgress) {
        if (softDelete) {
            return bulkUpdateStatus(entityType, ids, INACTIVE_STATUS, onProgress);
        }
        List<MutationRequest> items = new ArrayList<>(ids.size());
        for (String id : ids) {
            items.add(MutationRequest.delete(entityType, id));
        }
        logger.info("Bulk delete of {} {} record(s)", items.size(), entityType);
        return executor.run(items, batchSize, onProgress);
    }

    public BatchResult bulkCreate(String entityType, Map<String, Map<String, Object>> payloadsByLabel,
                                  Consumer<BatchProgress> onProgress) {
        List<MutationRequest> items = new ArrayList<>(payloadsByLabel.size());
        payloadsByLabel.forEach((label, payload) -> items.add(MutationRequest.create(entityType, label, payload)));
        logger.info("Bulk create of {} {} record(s)", items.size(), entityType);
        return executor.run(items, batchSize, onProgress);
    }
}
