package com.my.seatbot.adapter.out.health;

import com.my.seatbot.adapter.out.telegram.ResilientTelegramApi;
import com.my.seatbot.config.AppConfig;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Why: a bot without a token or a writable store cannot serve anyone, so it should not report ready.
 */
@Readiness
@ApplicationScoped
public class NotifierReadinessCheck implements HealthCheck {

    private final AppConfig appConfig;
    private final ResilientTelegramApi telegramApi;

    public NotifierReadinessCheck(AppConfig appConfig, ResilientTelegramApi telegramApi) {
        this.appConfig = appConfig;
        this.telegramApi = telegramApi;
    }

    @Override
    public HealthCheckResponse call() {
        boolean fileBackend = "file".equalsIgnoreCase(appConfig.storage().backend());
        Path subscribers = Path.of(appConfig.storage().subscribersPath());
        boolean storageOk = !fileBackend || isWritableDirectory(subscribers.toAbsolutePath().getParent());
        boolean tokenOk = telegramApi.isConfigured();
        return HealthCheckResponse.named("notifier-readiness")
                .withData("storageBackend", appConfig.storage().backend())
                .withData("subscribersPath", subscribers.toString())
                .withData("storageWritable", storageOk)
                .withData("botTokenConfigured", tokenOk)
                .withData("multiUser", appConfig.telegram().multiUser())
                .status(storageOk && tokenOk)
                .build();
    }

    // a directory that does not exist yet is created on the first save
    private static boolean isWritableDirectory(Path directory) {
        if (directory == null) {
            return true;
        }
        return Files.notExists(directory) || Files.isWritable(directory);
    }
}
