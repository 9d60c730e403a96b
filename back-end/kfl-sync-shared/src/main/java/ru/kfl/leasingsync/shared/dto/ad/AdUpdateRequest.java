package ru.kfl.leasingsync.shared.dto.ad;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * {@code updates} stays a raw JSON object so the gateway can tell a field
 * that was sent as {@code null} from one that was not sent.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AdUpdateRequest(
        @JsonProperty("ad_id") @JsonAlias("id") String adId,
        @JsonProperty("actor_telegram_id") Long actorTelegramId,
        @JsonProperty("actor_role") String actorRole,
        JsonNode updates
) {}
