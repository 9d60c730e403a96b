package ru.kfl.leasingsync.shared.model;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of roles a Telegram user can hold. There is no default member:
 * values that do not map to one of these are rejected by callers.
 */
public enum UserRole {

    USER("user", Set.of("user", "пользователь")),
    LEASING_COMPANY("leasing_company", Set.of(
            "leasing_company", "leasing", "лизинговая", "лизинговая компания", "лизинговая_компания")),
    ADMIN("admin", Set.of("admin", "админ", "администратор"));

    private final String wireValue;
    private final Set<String> aliases;

    UserRole(String wireValue, Set<String> aliases) {
        this.wireValue = wireValue;
        this.aliases = aliases;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean canManageAds() {
        return this == ADMIN || this == LEASING_COMPANY;
    }

    public static Optional<UserRole> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.strip().toLowerCase(Locale.ROOT);
        for (UserRole role : values()) {
            if (role.aliases.contains(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
