package ru.kfl.leasingsync.shared.dto.user;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UserRoleResponse(
        boolean ok,
        @JsonProperty("telegram_id") Long telegramId,
        String role
) {}
