package ru.kfl.leasingsync.gateway.store;

import ru.kfl.leasingsync.shared.model.UserRole;

public record UserFilter(UserRole role) {

    public static UserFilter all() {
        return new UserFilter(null);
    }
}
