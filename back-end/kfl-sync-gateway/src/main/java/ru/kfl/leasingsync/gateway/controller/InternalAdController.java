package ru.kfl.leasingsync.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.kfl.leasingsync.gateway.domain.AdItem;
import ru.kfl.leasingsync.gateway.service.AdManagementService;
import ru.kfl.leasingsync.gateway.service.BulkItemOutcome;
import ru.kfl.leasingsync.gateway.service.BulkUpsertOrchestrator;
import ru.kfl.leasingsync.gateway.service.BulkUpsertReport;
import ru.kfl.leasingsync.gateway.service.UpsertEngine;
import ru.kfl.leasingsync.shared.dto.ad.AdDeleteRequest;
import ru.kfl.leasingsync.shared.dto.ad.AdMutationResponse;
import ru.kfl.leasingsync.shared.dto.ad.AdPayload;
import ru.kfl.leasingsync.shared.dto.ad.AdUpdateRequest;
import ru.kfl.leasingsync.shared.dto.ad.AdUpsertResponse;
import ru.kfl.leasingsync.shared.dto.ad.BulkItemResult;
import ru.kfl.leasingsync.shared.dto.ad.BulkUpsertResponse;
import ru.kfl.leasingsync.shared.store.UpsertOutcome;

import java.util.List;

@RestController
@RequestMapping("/api/ads")
@RequiredArgsConstructor
public class InternalAdController {

    private final UpsertEngine engine;
    private final BulkUpsertOrchestrator bulk;
    private final AdManagementService management;

    @PostMapping("/upsert/")
    public ResponseEntity<AdUpsertResponse> upsertAd(@RequestBody AdPayload req) {
        UpsertOutcome<AdItem> outcome = engine.upsertAd(req);

        return ResponseEntity.status(outcome.created() ? HttpStatus.CREATED : HttpStatus.OK)
                .body(new AdUpsertResponse(true, outcome.created(), outcome.entity().getAdId()));
    }

    @PostMapping("/bulk-upsert/")
    public ResponseEntity<BulkUpsertResponse> bulkUpsertAds(@RequestBody JsonNode req) {
        BulkUpsertReport<AdItem> report = bulk.upsertAll(req.get("items"), AdPayload.class, engine::upsertAd);

        List<BulkItemResult> results = report.outcomes().stream()
                .map(InternalAdController::toResult)
                .toList();
        List<BulkUpsertResponse.BulkItemError> errors = report.failures().stream()
                .map(f -> new BulkUpsertResponse.BulkItemError(f.index(), f.error()))
                .toList();

        return ResponseEntity.ok(new BulkUpsertResponse(
                true,
                (int) report.createdCount(),
                (int) report.updatedCount(),
                results,
                errors
        ));
    }

    @PostMapping("/update/")
    public ResponseEntity<AdMutationResponse> updateAd(@RequestBody AdUpdateRequest req) {
        AdItem updated = management.update(req);
        return ResponseEntity.ok(new AdMutationResponse(true, updated.getAdId()));
    }

    @PostMapping("/delete/")
    public ResponseEntity<AdMutationResponse> deleteAd(@RequestBody AdDeleteRequest req) {
        management.delete(req);
        return ResponseEntity.ok(new AdMutationResponse(true, req.adId().strip()));
    }

    private static BulkItemResult toResult(BulkItemOutcome<AdItem> outcome) {
        if (outcome.succeeded()) {
            return new BulkItemResult(outcome.index(), true, outcome.entity().getAdId(),
                    outcome.created(), null, null);
        }
        return new BulkItemResult(outcome.index(), false, null, null, outcome.errorKind(), outcome.error());
    }
}
