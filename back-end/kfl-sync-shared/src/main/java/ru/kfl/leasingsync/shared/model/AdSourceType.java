package ru.kfl.leasingsync.shared.model;

import java.util.Locale;
import java.util.Optional;

/** Where a listing came from: an imported spreadsheet row or a user-submitted ad. */
public enum AdSourceType {
    EXCEL, MANUAL;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<AdSourceType> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.strip().toUpperCase(Locale.ROOT);
        for (AdSourceType type : values()) {
            if (type.name().equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
