package ru.kfl.leasingsync.shared.dto.action;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One recorded bot event. {@code timestamp} is ISO-8601, with or without offset.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UserActionPayload(
        @JsonProperty("telegram_id") Long telegramId,
        String username,
        @JsonProperty("first_name") String firstName,
        @JsonProperty("last_name") String lastName,
        String action,
        String details,
        String timestamp
) {}
