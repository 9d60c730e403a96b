package ru.kfl.leasingsync.bot.local;

import java.util.Map;

/**
 * Summary of the retained action log: entry count, distinct users and entries per action tag.
 */
public record ActionLogStats(int totalActions, int uniqueUsers, Map<String, Long> actionsByType) {
}
