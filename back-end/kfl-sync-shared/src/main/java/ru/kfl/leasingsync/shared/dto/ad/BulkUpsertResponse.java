package ru.kfl.leasingsync.shared.dto.ad;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkUpsertResponse(
        boolean ok,
        int created,
        int updated,
        List<BulkItemResult> results,
        List<BulkItemError> errors
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BulkItemError(int index, String error) {}
}
