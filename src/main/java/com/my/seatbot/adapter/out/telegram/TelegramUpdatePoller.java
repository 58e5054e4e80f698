package com.my.seatbot.adapter.out.telegram;

import com.my.seatbot.config.AppConfig;
import com.my.seatbot.domain.port.out.DelayPort;
import com.my.seatbot.domain.service.TelegramUpdateService;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Why: long polling blocks, so it gets its own thread and never holds up startup or alert sends.
 * Runs only while multi-user mode is enabled.
 */
@ApplicationScoped
public class TelegramUpdatePoller {

    private static final Logger log = Logger.getLogger(TelegramUpdatePoller.class);

    static final Duration ERROR_BACKOFF = Duration.ofSeconds(5);

    private final TelegramUpdateService telegramUpdateService;
    private final DelayPort delayPort;
    private final boolean enabled;
    private final int pollTimeoutSeconds;
    private final ExecutorService executor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private volatile boolean running = true;

    @Inject
    public TelegramUpdatePoller(TelegramUpdateService telegramUpdateService, DelayPort delayPort, AppConfig appConfig) {
        this(telegramUpdateService,
                delayPort,
                appConfig.telegram().multiUser(),
                appConfig.telegram().pollTimeoutSeconds(),
                Executors.newSingleThreadExecutor(runnable -> {
                    Thread thread = new Thread(runnable, "telegram-poller");
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    TelegramUpdatePoller(TelegramUpdateService telegramUpdateService,
                         DelayPort delayPort,
                         boolean enabled,
                         int pollTimeoutSeconds,
                         ExecutorService executor) {
        this.telegramUpdateService = telegramUpdateService;
        this.delayPort = delayPort;
        this.enabled = enabled;
        this.pollTimeoutSeconds = pollTimeoutSeconds;
        this.executor = executor;
    }

    void onStart(@Observes StartupEvent event) {
        startPolling();
    }

    /**
     * Starts the loop once. Later calls and calls with multi-user mode off do nothing.
     *
     * @return {@code true} when this call started the loop
     */
    public boolean startPolling() {
        if (!enabled) {
            log.info("Multi-user mode is off, update polling not started");
            return false;
        }
        if (!started.compareAndSet(false, true)) {
            return false;
        }
        log.infof("Starting update polling (timeout %ds)", pollTimeoutSeconds);
        executor.submit(this::loop);
        return true;
    }

    private void loop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            pollSafely();
        }
    }

    void pollSafely() {
        try {
            telegramUpdateService.pollOnce(pollTimeoutSeconds);
        } catch (Exception e) {
            log.warnf("Update polling failed at offset %d: %s", telegramUpdateService.cursor(), e.getMessage());
            delayPort.pause(ERROR_BACKOFF);
        }
    }

    @PreDestroy
    void stop() {
        running = false;
        executor.shutdownNow();
    }
}
