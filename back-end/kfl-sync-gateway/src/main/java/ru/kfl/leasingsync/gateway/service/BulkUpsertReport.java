package ru.kfl.leasingsync.gateway.service;

import java.util.List;

/** Per-item outcomes in input order. */
public record BulkUpsertReport<E>(List<BulkItemOutcome<E>> outcomes) {

    public long createdCount() {
        return outcomes.stream().filter(o -> o.succeeded() && o.created()).count();
    }

    public long updatedCount() {
        return outcomes.stream().filter(o -> o.succeeded() && !o.created()).count();
    }

    public List<BulkItemOutcome<E>> failures() {
        return outcomes.stream().filter(o -> !o.succeeded()).toList();
    }
}
