package com.my.seatbot.config;

import io.quarkus.runtime.annotations.StaticInitSafe;
import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Why: every setting is read once through this typed mapping; nothing else reads environment variables.
 */
@StaticInitSafe
@ConfigMapping(prefix = "app")
public interface AppConfig {

    TelegramConfig telegram();

    GithubConfig github();

    TopicsConfig topics();

    StorageConfig storage();

    DonationConfig donation();

    ReviewConfig review();

    ClockConfig clock();

    interface TelegramConfig {
        @WithName("bot-token")
        Optional<String> botToken();

        @WithName("admin-chat-id")
        Optional<String> adminChatId();

        @WithName("multi-user")
        @WithDefault("false")
        boolean multiUser();

        @WithName("poll-timeout-seconds")
        @WithDefault("30")
        int pollTimeoutSeconds();

        @WithName("request-timeout-seconds")
        @WithDefault("20")
        int requestTimeoutSeconds();

        @WithName("message-delay-millis")
        @WithDefault("500")
        long messageDelayMillis();

        @WithName("direct-alerts")
        @WithDefault("false")
        boolean directAlerts();

        @WithDefault("en")
        String language();
    }

    interface GithubConfig {
        Optional<String> token();

        @WithName("api-url")
        @WithDefault("https://api.github.com")
        String apiUrl();

        @WithName("repo-owner")
        String repoOwner();

        @WithName("repo-name")
        String repoName();

        @WithName("cache-ttl-seconds")
        @WithDefault("300")
        int cacheTtlSeconds();

        @WithName("page-size")
        @WithDefault("100")
        int pageSize();
    }

    interface TopicsConfig {
        @WithDefault("CEnT-S,TOLC-AV,TOLC-B,TOLC-E,TOLC-F,TOLC-I,TOLC-LP,TOLC-PSI,TOLC-S,TOLC-SPS,TOLC-SU")
        List<String> keys();

        /**
         * Destination chat id per topic code.
         */
        Map<String, String> groups();

        @WithName("premium-group")
        Optional<String> premiumGroup();

        @WithName("booking-url")
        @WithDefault("https://testcisia.it/studenti_tolc/login_sso.php")
        String bookingUrl();
    }

    interface StorageConfig {
        @WithDefault("file")
        String backend();

        @WithName("subscribers-path")
        @WithDefault("./data/subscribers.json")
        String subscribersPath();

        @WithName("donations-path")
        @WithDefault("./data/donations.json")
        String donationsPath();
    }

    interface DonationConfig {
        Optional<String> address();
    }

    interface ReviewConfig {
        @WithName("session-ttl-minutes")
        @WithDefault("15")
        int sessionTtlMinutes();
    }

    interface ClockConfig {
        @WithDefault("Europe/Rome")
        String zone();
    }
}
