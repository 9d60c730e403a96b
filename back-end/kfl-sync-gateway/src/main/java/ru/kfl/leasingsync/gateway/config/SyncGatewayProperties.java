package ru.kfl.leasingsync.gateway.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "kfl.sync")
public class SyncGatewayProperties {

    /** Pre-shared key the bot sends with every request. Blank rejects everything. */
    private String apiKey;

    @NotBlank
    private String apiKeyHeader = "X-API-Key";

    /** Zone applied to timestamps that arrive without an offset. */
    @NotBlank
    private String timeZone = "Europe/Moscow";
}
