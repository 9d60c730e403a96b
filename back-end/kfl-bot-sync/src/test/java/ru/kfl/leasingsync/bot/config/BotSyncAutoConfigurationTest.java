package ru.kfl.leasingsync.bot.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import ru.kfl.leasingsync.bot.local.LocalSyncLog;
import ru.kfl.leasingsync.bot.sync.DualWriteCoordinator;
import ru.kfl.leasingsync.shared.model.UserRole;
import ru.kfl.leasingsync.shared.permission.AdPermissionEvaluator;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BotSyncAutoConfigurationTest {

    @TempDir
    Path dir;

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    JacksonAutoConfiguration.class,
                    BotSyncAutoConfiguration.class));

    @Test
    void forwarding_is_off_without_backend_settings() {
        contextRunner
                .withPropertyValues("kfl.bot.sync.data-dir=" + dir)
                .run(context -> {
                    assertThat(context).hasSingleBean(DualWriteCoordinator.class);
                    assertThat(context).hasSingleBean(AdPermissionEvaluator.class);
                    assertThat(context.getBean(DualWriteCoordinator.class).isForwardingEnabled()).isFalse();
                    assertThat(context.getBean(LocalSyncLog.class).ads().file())
                            .isEqualTo(dir.resolve(LocalSyncLog.ADS_FILE));
                });
    }

    @Test
    void forwarding_is_on_when_url_and_key_are_set() {
        contextRunner
                .withPropertyValues(
                        "kfl.bot.sync.data-dir=" + dir,
                        "kfl.bot.sync.backend-url=http://localhost:8000/",
                        "kfl.bot.sync.api-key=secret",
                        "kfl.bot.sync.timeout=2s",
                        "kfl.bot.sync.admin-ids=1729659964,42")
                .run(context -> {
                    BotSyncProperties properties = context.getBean(BotSyncProperties.class);
                    assertThat(properties.getTimeout()).isEqualTo(Duration.ofSeconds(2));
                    assertThat(properties.getAdminIds()).containsExactly(1729659964L, 42L);

                    DualWriteCoordinator coordinator = context.getBean(DualWriteCoordinator.class);
                    assertThat(coordinator.isForwardingEnabled()).isTrue();
                    assertThat(coordinator.resolveRole(42L)).isEqualTo(UserRole.ADMIN);
                });
    }

    @Test
    void blank_key_keeps_forwarding_off() {
        contextRunner
                .withPropertyValues(
                        "kfl.bot.sync.data-dir=" + dir,
                        "kfl.bot.sync.backend-url=http://localhost:8000",
                        "kfl.bot.sync.api-key=")
                .run(context -> assertThat(context.getBean(DualWriteCoordinator.class).isForwardingEnabled())
                        .isFalse());
    }

    @Test
    void rejects_invalid_action_log_capacity() {
        contextRunner
                .withPropertyValues(
                        "kfl.bot.sync.data-dir=" + dir,
                        "kfl.bot.sync.max-action-log-entries=0")
                .run(context -> assertThat(context).hasFailed());
    }
}
