package ru.kfl.leasingsync.shared.permission;

public enum AdOperation {
    CREATE, UPDATE, DELETE
}
