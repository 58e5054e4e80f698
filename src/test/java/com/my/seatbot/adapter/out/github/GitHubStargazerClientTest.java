package com.my.seatbot.adapter.out.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.my.seatbot.domain.exception.StargazerFetchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GitHubStargazerClientTest {

    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        httpClient = mock(HttpClient.class);
    }

    @Test
    void readsLoginsFromPageWithVersionedHeaders() throws Exception {
        doReturn(response(200, "[{\"login\":\"alice\",\"id\":1},{\"login\":\"bob\",\"id\":2}]"))
                .when(httpClient).send(any(HttpRequest.class), any());
        GitHubStargazerClient client = new GitHubStargazerClient(httpClient, new ObjectMapper(),
                "https://api.github.com/", "acme", "seats", "secret");

        assertThat(client.fetchPage(3, 100)).containsExactly("alice", "bob");

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString())
                .isEqualTo("https://api.github.com/repos/acme/seats/stargazers?per_page=100&page=3");
        assertThat(request.getValue().headers().firstValue("Accept")).contains("application/vnd.github+json");
        assertThat(request.getValue().headers().firstValue("X-GitHub-Api-Version")).contains("2022-11-28");
        assertThat(request.getValue().headers().firstValue("Authorization")).contains("Bearer secret");
    }

    @Test
    void omitsAuthorizationWithoutToken() throws Exception {
        doReturn(response(200, "[]")).when(httpClient).send(any(HttpRequest.class), any());
        GitHubStargazerClient client = new GitHubStargazerClient(httpClient, new ObjectMapper(),
                "https://api.github.com", "acme", "seats", " ");

        assertThat(client.fetchPage(1, 100)).isEmpty();

        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().headers().firstValue("Authorization")).isEmpty();
    }

    @Test
    void nonOkStatusFails() throws Exception {
        doReturn(response(403, "{\"message\":\"rate limited\"}")).when(httpClient).send(any(HttpRequest.class), any());
        GitHubStargazerClient client = new GitHubStargazerClient(httpClient, new ObjectMapper(),
                "https://api.github.com", "acme", "seats", null);

        assertThatThrownBy(() -> client.fetchPage(1, 100))
                .isInstanceOf(StargazerFetchException.class)
                .hasMessageContaining("403");
    }

    @Test
    void transportFailureFails() throws Exception {
        doThrow(new IOException("timeout")).when(httpClient).send(any(HttpRequest.class), any());
        GitHubStargazerClient client = new GitHubStargazerClient(httpClient, new ObjectMapper(),
                "https://api.github.com", "acme", "seats", null);

        assertThatThrownBy(() -> client.fetchPage(1, 100))
                .isInstanceOf(StargazerFetchException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }
}
