package ru.kfl.leasingsync.shared.dto.action;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ActionCreatedResponse(boolean ok, Long id) {}
