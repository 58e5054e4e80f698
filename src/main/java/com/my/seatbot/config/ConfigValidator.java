package com.my.seatbot.config;

import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.Startup;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Why: a bad setting should stop the bot at startup, not at the first message that needs it.
 * In dev and test launches problems are only logged.
 */
@Startup
@ApplicationScoped
public class ConfigValidator {

    private static final Logger log = Logger.getLogger(ConfigValidator.class);

    private static final Set<String> BACKENDS = Set.of("file", DomainConfig.MEMORY_BACKEND);

    private final AppConfig appConfig;

    public ConfigValidator(AppConfig appConfig) {
        this.appConfig = appConfig;
    }

    @PostConstruct
    void validate() {
        boolean strict = LaunchMode.current() == LaunchMode.NORMAL;
        List<String> problems = problems();
        if (strict && !problems.isEmpty()) {
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
        problems.forEach(log::warn);
        if (problems.isEmpty()) {
            log.infof("Configuration OK: %d topics, multi-user %s, language %s",
                    appConfig.topics().keys().size(), appConfig.telegram().multiUser(), appConfig.telegram().language());
        }
    }

    List<String> problems() {
        List<String> problems = new ArrayList<>();
        AppConfig.TelegramConfig telegram = appConfig.telegram();
        if (isBlank(telegram.botToken().orElse(null))) {
            problems.add("Missing required setting: TELEGRAM_BOT_TOKEN");
        }
        if (telegram.multiUser() && isBlank(telegram.adminChatId().orElse(null))) {
            problems.add("Missing required setting in multi-user mode: TELEGRAM_ADMIN_CHAT_ID");
        }
        if (telegram.pollTimeoutSeconds() < 0) {
            problems.add("app.telegram.poll-timeout-seconds must not be negative");
        }
        if (telegram.messageDelayMillis() < 0) {
            problems.add("app.telegram.message-delay-millis must not be negative");
        }
        if (!BACKENDS.contains(appConfig.storage().backend().toLowerCase(Locale.ROOT))) {
            problems.add("Unknown storage backend: " + appConfig.storage().backend());
        }
        for (String topic : appConfig.topics().groups().keySet()) {
            if (!appConfig.topics().keys().contains(topic)) {
                problems.add("Group configured for unknown topic: " + topic);
            }
        }
        if (appConfig.review().sessionTtlMinutes() <= 0) {
            problems.add("app.review.session-ttl-minutes must be positive");
        }
        if (appConfig.github().pageSize() < 1 || appConfig.github().pageSize() > 100) {
            problems.add("app.github.page-size must be between 1 and 100");
        }
        try {
            ZoneId.of(appConfig.clock().zone());
        } catch (DateTimeException e) {
            problems.add("Invalid time zone: " + appConfig.clock().zone());
        }
        return problems;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
