package ru.kfl.leasingsync.shared.model;

/** {@code role} is null when the declared value was not recognized. */
public record Actor(long telegramId, UserRole role) {

    public static Actor of(long telegramId, String declaredRole) {
        return new Actor(telegramId, UserRole.parse(declaredRole).orElse(null));
    }
}
