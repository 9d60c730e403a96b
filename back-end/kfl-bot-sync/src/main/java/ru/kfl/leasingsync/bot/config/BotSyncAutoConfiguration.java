package ru.kfl.leasingsync.bot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import ru.kfl.leasingsync.bot.gateway.SyncGatewayClient;
import ru.kfl.leasingsync.bot.local.LocalSyncLog;
import ru.kfl.leasingsync.bot.sync.DualWriteCoordinator;
import ru.kfl.leasingsync.bot.sync.ForwardFailureListener;
import ru.kfl.leasingsync.shared.permission.AdPermissionEvaluator;

import java.time.Clock;

@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(BotSyncProperties.class)
public class BotSyncAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(BotSyncAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public AdPermissionEvaluator adPermissionEvaluator() {
        return new AdPermissionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public LocalSyncLog localSyncLog(BotSyncProperties properties, ObjectProvider<ObjectMapper> mapper) {
        return LocalSyncLog.open(
                properties.getDataDir(),
                mapper.getIfAvailable(ObjectMapper::new),
                properties.getMaxActionLogEntries());
    }

    @Bean
    @ConditionalOnMissingBean
    public DualWriteCoordinator dualWriteCoordinator(
            BotSyncProperties properties,
            LocalSyncLog localSyncLog,
            AdPermissionEvaluator permissions,
            ObjectProvider<ObjectMapper> mapper,
            ObjectProvider<ForwardFailureListener> failureListener) {

        SyncGatewayClient gateway = null;
        if (properties.syncEnabled()) {
            gateway = new SyncGatewayClient(
                    SyncGatewayClient.builder(properties).build(),
                    mapper.getIfAvailable(ObjectMapper::new));
            log.info("Backend sync: ENABLED ({})", properties.getBackendUrl());
        } else {
            log.info("Backend sync: disabled (set kfl.bot.sync.backend-url and kfl.bot.sync.api-key)");
        }

        return new DualWriteCoordinator(
                localSyncLog,
                gateway,
                permissions,
                properties.syncEnabled(),
                properties.getAdminIds(),
                failureListener.getIfAvailable(() -> ForwardFailureListener.NONE),
                Clock.systemDefaultZone());
    }
}
