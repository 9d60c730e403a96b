package ru.kfl.leasingsync.shared.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import ru.kfl.leasingsync.shared.error.SyncErrorKind;

import java.time.Instant;

/**
 * Body of every non-2xx gateway response. {@code kind} is {@code null} for
 * failures outside the sync taxonomy (unexpected server errors).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ErrorResponse(
        boolean ok,
        SyncErrorKind kind,
        String detail,
        int status,
        String path,
        Instant timestamp
) {
    public static ErrorResponse of(SyncErrorKind kind, String detail, int status, String path) {
        return new ErrorResponse(false, kind, detail, status, path, Instant.now());
    }
}
