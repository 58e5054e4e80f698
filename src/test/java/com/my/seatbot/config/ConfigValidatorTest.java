package com.my.seatbot.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ConfigValidatorTest {

    @Test
    void complete_configuration_has_no_problems() {
        assertThat(new ConfigValidator(new StubAppConfig()).problems()).isEmpty();
    }

    @Test
    void multi_user_mode_requires_token_and_admin() {
        StubAppConfig config = new StubAppConfig();
        config.botToken = " ";
        config.adminChatId = null;

        assertThat(new ConfigValidator(config).problems())
                .anyMatch(problem -> problem.contains("TELEGRAM_BOT_TOKEN"))
                .anyMatch(problem -> problem.contains("TELEGRAM_ADMIN_CHAT_ID"));
    }

    @Test
    void admin_is_optional_in_single_user_mode() {
        StubAppConfig config = new StubAppConfig();
        config.multiUser = false;
        config.adminChatId = null;

        assertThat(new ConfigValidator(config).problems()).isEmpty();
    }

    @Test
    void rejects_unknown_backend_topic_zone_and_bad_numbers() {
        StubAppConfig config = new StubAppConfig();
        config.storageBackend = "sqlite";
        config.groups = Map.of("TOLC-Z", "-1");
        config.zone = "Mars/Olympus";
        config.sessionTtlMinutes = 0;
        config.pageSize = 500;
        config.messageDelayMillis = -1;

        assertThat(new ConfigValidator(config).problems()).hasSize(6);
    }
}
