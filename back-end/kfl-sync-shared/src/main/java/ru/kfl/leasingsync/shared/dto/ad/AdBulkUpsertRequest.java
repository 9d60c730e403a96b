package ru.kfl.leasingsync.shared.dto.ad;

import java.util.List;

public record AdBulkUpsertRequest(List<AdPayload> items) {}
