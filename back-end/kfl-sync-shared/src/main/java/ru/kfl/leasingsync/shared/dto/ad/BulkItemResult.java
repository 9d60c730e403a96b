package ru.kfl.leasingsync.shared.dto.ad;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import ru.kfl.leasingsync.shared.error.SyncErrorKind;

/**
 * Outcome of one element of a bulk upsert, at the same position as the input element.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record BulkItemResult(
        int index,
        boolean ok,
        String key,
        Boolean created,
        SyncErrorKind kind,
        String error
) {}
