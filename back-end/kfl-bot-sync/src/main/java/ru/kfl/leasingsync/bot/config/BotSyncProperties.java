package ru.kfl.leasingsync.bot.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Validated
@ConfigurationProperties(prefix = "kfl.bot.sync")
public class BotSyncProperties {

    /** Gateway base URL, e.g. {@code http://localhost:8000}. Blank disables forwarding. */
    private String backendUrl;

    /** Pre-shared key sent as {@code X-API-Key}. Blank disables forwarding. */
    private String apiKey;

    /** Connect and read timeout of every forward. */
    @NotNull
    private Duration timeout = Duration.ofSeconds(5);

    @NotNull
    private Path dataDir = Path.of("data");

    @Min(1)
    private int maxActionLogEntries = 1000;

    /** Telegram ids that are always treated as administrators. */
    private Set<Long> adminIds = new LinkedHashSet<>();

    public boolean syncEnabled() {
        return StringUtils.hasText(backendUrl) && StringUtils.hasText(apiKey);
    }
}
