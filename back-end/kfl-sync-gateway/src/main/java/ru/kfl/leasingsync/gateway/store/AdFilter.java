package ru.kfl.leasingsync.gateway.store;

import ru.kfl.leasingsync.shared.model.AdSourceType;
import ru.kfl.leasingsync.shared.model.AdStatus;

/** Null components do not constrain the result. */
public record AdFilter(Long authorTelegramId, AdStatus status, AdSourceType sourceType) {

    public static AdFilter all() {
        return new AdFilter(null, null, null);
    }

    public static AdFilter byAuthor(long authorTelegramId) {
        return new AdFilter(authorTelegramId, null, null);
    }
}
