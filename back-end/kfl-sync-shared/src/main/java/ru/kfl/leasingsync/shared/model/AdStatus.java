package ru.kfl.leasingsync.shared.model;

import java.util.Locale;
import java.util.Optional;

public enum AdStatus {
    ACTIVE, INACTIVE, ARCHIVED;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AdStatus> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.strip().toUpperCase(Locale.ROOT);
        for (AdStatus status : values()) {
            if (status.name().equals(normalized)) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
