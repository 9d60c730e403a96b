package ru.kfl.leasingsync.bot.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import ru.kfl.leasingsync.shared.dto.ad.AdPayload;
import ru.kfl.leasingsync.shared.dto.user.UserPayload;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * The bot's durable local copy of everything it forwards.
 */
public record LocalSyncLog(
        JsonFileStore<Long, UserPayload> users,
        JsonFileStore<String, AdPayload> ads,
        JsonFileActionLog actions
) {

    public static final String USERS_FILE = "auth_users.json";
    public static final String ADS_FILE = "ads_feed.json";
    public static final String ACTIONS_FILE = "users_log.json";

    public static LocalSyncLog open(Path dataDir, ObjectMapper mapper, int maxActionEntries) {
        try {
            Files.createDirectories(dataDir);
        } catch (IOException e) {
            throw new LocalLogException("Cannot create data directory " + dataDir, e);
        }
        return new LocalSyncLog(
                new JsonFileStore<>(dataDir.resolve(USERS_FILE), mapper, UserPayload.class, UserPayload::telegramId),
                new JsonFileStore<>(dataDir.resolve(ADS_FILE), mapper, AdPayload.class, AdPayload::id),
                new JsonFileActionLog(dataDir.resolve(ACTIONS_FILE), mapper, maxActionEntries)
        );
    }
}
