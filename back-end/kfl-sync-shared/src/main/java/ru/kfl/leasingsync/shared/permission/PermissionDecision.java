package ru.kfl.leasingsync.shared.permission;

public record PermissionDecision(boolean allowed, String reason) {

    private static final PermissionDecision ALLOW = new PermissionDecision(true, "");

    public static PermissionDecision allow() {
        return ALLOW;
    }

    public static PermissionDecision deny(String reason) {
        return new PermissionDecision(false, reason);
    }
}
