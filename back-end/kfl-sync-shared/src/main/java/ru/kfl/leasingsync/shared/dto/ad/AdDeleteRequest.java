package ru.kfl.leasingsync.shared.dto.ad;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AdDeleteRequest(
        @JsonProperty("ad_id") @JsonAlias("id") String adId,
        @JsonProperty("actor_telegram_id") Long actorTelegramId,
        @JsonProperty("actor_role") String actorRole
) {}
