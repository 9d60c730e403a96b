package ru.kfl.leasingsync.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import ru.kfl.leasingsync.shared.error.SyncErrorKind;
import ru.kfl.leasingsync.shared.error.SyncException;
import ru.kfl.leasingsync.shared.error.ValidationFailedException;
import ru.kfl.leasingsync.shared.store.UpsertOutcome;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/** Each element runs in its own transaction; failures are reported in place. */
@Service
@RequiredArgsConstructor
public class BulkUpsertOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(BulkUpsertOrchestrator.class);

    private final ObjectMapper mapper;

    public <P, E> BulkUpsertReport<E> upsertAll(JsonNode items,
                                                Class<P> payloadType,
                                                Function<P, UpsertOutcome<E>> upsert) {
        if (items == null || !items.isArray()) {
            throw new ValidationFailedException("items must be a list");
        }

        List<BulkItemOutcome<E>> outcomes = new ArrayList<>(items.size());
        for (int index = 0; index < items.size(); index++) {
            outcomes.add(upsertOne(index, items.get(index), payloadType, upsert));
        }

        BulkUpsertReport<E> report = new BulkUpsertReport<>(outcomes);
        log.info("Bulk upsert of {} {} items: {} created, {} updated, {} failed",
                items.size(), payloadType.getSimpleName(),
                report.createdCount(), report.updatedCount(), report.failures().size());
        return report;
    }

    private <P, E> BulkItemOutcome<E> upsertOne(int index,
                                                JsonNode item,
                                                Class<P> payloadType,
                                                Function<P, UpsertOutcome<E>> upsert) {
        if (item == null || !item.isObject()) {
            return BulkItemOutcome.failed(index, SyncErrorKind.VALIDATION_FAILED, "item must be object");
        }

        P payload;
        try {
            payload = mapper.treeToValue(item, payloadType);
        } catch (JsonProcessingException e) {
            return BulkItemOutcome.failed(index, SyncErrorKind.VALIDATION_FAILED,
                    "malformed item: " + e.getOriginalMessage());
        } catch (IllegalArgumentException e) {
            return BulkItemOutcome.failed(index, SyncErrorKind.VALIDATION_FAILED,
                    "malformed item: " + e.getMessage());
        }

        try {
            return BulkItemOutcome.ok(index, upsert.apply(payload));
        } catch (SyncException e) {
            log.warn("Bulk item {} rejected ({}): {}", index, e.getKind(), e.getMessage());
            return BulkItemOutcome.failed(index, e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Bulk item {} failed unexpectedly", index, e);
            return BulkItemOutcome.failed(index, null, "internal error");
        }
    }
}
