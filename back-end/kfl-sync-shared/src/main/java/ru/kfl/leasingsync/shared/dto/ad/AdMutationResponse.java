package ru.kfl.leasingsync.shared.dto.ad;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record AdMutationResponse(
        boolean ok,
        @JsonProperty("ad_id") String adId
) {}
