package ru.kfl.leasingsync.gateway.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.kfl.leasingsync.shared.permission.AdPermissionEvaluator;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SyncGatewayProperties.class)
public class GatewayConfig {

    @Bean
    public AdPermissionEvaluator adPermissionEvaluator() {
        return new AdPermissionEvaluator();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
