package com.my.seatbot.adapter.out.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.seatbot.config.AppConfig;
import com.my.seatbot.domain.exception.StargazerFetchException;
import com.my.seatbot.domain.port.out.StargazerPort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Reads the stargazer listing of the configured repository through the GitHub REST API.
 */
@ApplicationScoped
public class GitHubStargazerClient implements StargazerPort {

    private static final Logger log = Logger.getLogger(GitHubStargazerClient.class);

    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);
    private static final TypeReference<List<Stargazer>> STARGAZER_LIST = new TypeReference<>() {
    };

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String stargazersUrl;
    private final String token;

    @Inject
    public GitHubStargazerClient(AppConfig appConfig, ObjectMapper objectMapper) {
        this(HttpClient.newBuilder()
                        .connectTimeout(REQUEST_TIMEOUT)
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .build(),
                objectMapper,
                appConfig.github().apiUrl(),
                appConfig.github().repoOwner(),
                appConfig.github().repoName(),
                appConfig.github().token().orElse(null));
    }

    GitHubStargazerClient(HttpClient httpClient,
                          ObjectMapper objectMapper,
                          String apiUrl,
                          String owner,
                          String repo,
                          String token) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.stargazersUrl = stripTrailingSlash(apiUrl) + "/repos/" + owner + "/" + repo + "/stargazers";
        this.token = token == null || token.isBlank() ? null : token.trim();
    }

    @Override
    public List<String> fetchPage(int page, int perPage) {
        URI uri = URI.create(stargazersUrl + "?per_page=" + perPage + "&page=" + page);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(REQUEST_TIMEOUT)
                .header("Accept", "application/vnd.github+json")
                .header("X-GitHub-Api-Version", "2022-11-28")
                .header("User-Agent", "seat-bot")
                .GET();
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        try {
            HttpResponse<String> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new StargazerFetchException("GitHub answered HTTP " + response.statusCode() + " for page " + page);
            }
            List<Stargazer> stargazers = objectMapper.readValue(response.body(), STARGAZER_LIST);
            log.debugf("Stargazer page %d returned %d entries", page, stargazers.size());
            return stargazers.stream()
                    .map(Stargazer::login)
                    .filter(Objects::nonNull)
                    .toList();
        } catch (IOException e) {
            throw new StargazerFetchException("Stargazer page " + page + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StargazerFetchException("Stargazer page " + page + " interrupted", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record Stargazer(@JsonProperty("login") String login) {
    }
}
