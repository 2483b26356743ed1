package dev.issuehook.infrastructure.github;

import dev.issuehook.config.GitHubProperties;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.Map;

/**
 * GitHub REST API client behind a circuit breaker.
 * Uses WebClient (non-blocking) with a bounded .block().
 */
@Component
public class GitHubApiClient {
    private static final Logger log = LoggerFactory.getLogger(GitHubApiClient.class);
    private static final Duration RESPONSE_TIMEOUT = Duration.ofSeconds(30);

    private final WebClient webClient;
    private final GitHubTokenProvider tokenProvider;

    public GitHubApiClient(WebClient.Builder builder, GitHubTokenProvider tokenProvider, GitHubProperties properties) {
        this.tokenProvider = tokenProvider;
        HttpClient httpClient = HttpClient.create()
                .responseTimeout(RESPONSE_TIMEOUT)
                .option(io.netty.channel.ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000);
        this.webClient = builder.baseUrl(properties.apiBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json").build();
    }

    @CircuitBreaker(name = "github-api")
    public void createIssueComment(String repo, int issueNumber, String body) {
        String token = tokenProvider.getRepositoryToken(repo);
        webClient.post().uri("/repos/" + repo + "/issues/" + issueNumber + "/comments")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .bodyValue(Map.of("body", body))
                .retrieve().toBodilessEntity().block(RESPONSE_TIMEOUT);
        log.info("Comment posted on {}#{}", repo, issueNumber);
    }
}
