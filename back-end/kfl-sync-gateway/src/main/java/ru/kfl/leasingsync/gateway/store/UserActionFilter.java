package ru.kfl.leasingsync.gateway.store;

public record UserActionFilter(Long telegramId, String action) {

    public static UserActionFilter all() {
        return new UserActionFilter(null, null);
    }

    public static UserActionFilter byUser(long telegramId) {
        return new UserActionFilter(telegramId, null);
    }
}
