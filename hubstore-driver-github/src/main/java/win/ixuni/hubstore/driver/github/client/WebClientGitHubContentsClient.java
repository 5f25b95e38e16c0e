package win.ixuni.hubstore.driver.github.client;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.util.JsonUtils;
import win.ixuni.hubstore.driver.github.client.model.Committer;
import win.ixuni.hubstore.driver.github.client.model.ContentEntry;
import win.ixuni.hubstore.driver.github.client.model.CreateFileRequest;
import win.ixuni.hubstore.driver.github.client.model.CreateFileResponse;
import win.ixuni.hubstore.driver.github.client.model.FileCommit;
import win.ixuni.hubstore.driver.github.config.GitHubDriverConfig;

import java.net.URI;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * GitHub contents API client on Spring WebClient
 * <p>
 * Writes replace the whole file: the current blob SHA of the path is looked up on the branch first,
 * because GitHub only accepts an update that names the blob it replaces. The PUT is the only mutation.
 */
@Slf4j
public class WebClientGitHubContentsClient implements GitHubContentsClient {

    public static final String GITHUB_V3_JSON = "application/vnd.github.v3+json";

    private final WebClient webClient;
    private final String baseUrl;

    public WebClientGitHubContentsClient(WebClient webClient, String baseUrl) {
        this.webClient = webClient;
        this.baseUrl = baseUrl;
    }

    /**
     * Build an authenticated client from validated configuration
     */
    public static WebClientGitHubContentsClient create(GitHubDriverConfig config) {
        return create(config, WebClient.builder());
    }

    public static WebClientGitHubContentsClient create(GitHubDriverConfig config, WebClient.Builder builder) {
        // Fail now on a malformed base URL rather than on the first request
        URI.create(config.getBaseUrl());
        // File lookups return the base64 content inline
        int maxInMemorySize = (int) Math.min(Integer.MAX_VALUE, config.getMaxContentLength() * 2 + 1024 * 1024);
        WebClient webClient = builder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize))
                .defaultHeader(HttpHeaders.ACCEPT, GITHUB_V3_JSON)
                .defaultHeader(HttpHeaders.USER_AGENT, config.getUserAgent())
                .defaultHeader(HttpHeaders.AUTHORIZATION, config.getAuthType().authorizationHeader(config.getToken()))
                .build();
        return new WebClientGitHubContentsClient(webClient, config.getBaseUrl());
    }

    @Override
    public Mono<FileCommit> createOrUpdateFile(String owner, String repo, String path, String branch,
                                               String message, Committer committer, byte[] content) {
        URI uri = contentsUri(owner, repo, path, null);
        String encoded = Base64.getEncoder().encodeToString(content);

        return findBlobSha(owner, repo, path, branch)
                .map(sha -> buildRequest(message, committer, encoded, branch, sha))
                .defaultIfEmpty(buildRequest(message, committer, encoded, branch, null))
                .flatMap(request -> webClient.put()
                        .uri(uri)
                        .contentType(MediaType.APPLICATION_JSON)
                        .bodyValue(request)
                        .retrieve()
                        .onStatus(HttpStatusCode::isError, this::toApiException)
                        .bodyToMono(CreateFileResponse.class))
                .map(response -> FileCommit.builder()
                        .commitSha(response.getCommit() != null ? response.getCommit().getSha() : null)
                        .path(response.getContent() != null ? response.getContent().getPath() : path)
                        .contentSha(response.getContent() != null ? response.getContent().getSha() : null)
                        .build());
    }

    @Override
    public Mono<List<ContentEntry>> getDirectoryContents(String owner, String repo, String path, String ref) {
        return getContents(owner, repo, path, ref)
                .map(this::toEntries);
    }

    /**
     * SHA of the file currently at path on the branch, empty if there is none
     */
    private Mono<String> findBlobSha(String owner, String repo, String path, String branch) {
        return getContents(owner, repo, path, branch)
                .flatMap(node -> node.isObject() && node.hasNonNull("sha")
                        ? Mono.just(node.get("sha").asText())
                        : Mono.<String>empty())
                .onErrorResume(GitHubApiException.class, e -> e.getStatusCode() == 404
                        ? Mono.<String>empty()
                        : Mono.<String>error(e));
    }

    private Mono<JsonNode> getContents(String owner, String repo, String path, String ref) {
        return webClient.get()
                .uri(contentsUri(owner, repo, path, ref))
                .retrieve()
                .onStatus(HttpStatusCode::isError, this::toApiException)
                .bodyToMono(JsonNode.class);
    }

    private List<ContentEntry> toEntries(JsonNode node) {
        List<ContentEntry> entries = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode item : node) {
                entries.add(JsonUtils.mapper().convertValue(item, ContentEntry.class));
            }
        } else if (node.isObject()) {
            // path named a single file
            entries.add(JsonUtils.mapper().convertValue(node, ContentEntry.class));
        }
        return entries;
    }

    private CreateFileRequest buildRequest(String message, Committer committer, String content,
                                           String branch, String sha) {
        return CreateFileRequest.builder()
                .message(message)
                .committer(committer)
                .content(content)
                .branch(branch)
                .sha(sha)
                .build();
    }

    private Mono<? extends Throwable> toApiException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> {
                    log.debug("GitHub API error {}: {}", status, body);
                    return new GitHubApiException(status, body);
                });
    }

    /**
     * {base}/repos/{owner}/{repo}/contents/{path}[?ref=]
     * <p>
     * Every value goes in as a URI variable, so it is encoded strictly: a {@code +} or {@code /}
     * in a branch name reaches GitHub literally.
     */
    URI contentsUri(String owner, String repo, String path, String ref) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("owner", owner);
        variables.put("repo", repo);
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(baseUrl)
                .pathSegment("repos", "{owner}", "{repo}", "contents");
        if (path != null) {
            int index = 0;
            for (String segment : path.split("/")) {
                if (!segment.isEmpty()) {
                    String name = "segment" + index++;
                    builder.pathSegment("{" + name + "}");
                    variables.put(name, segment);
                }
            }
        }
        if (ref != null) {
            builder.queryParam("ref", "{ref}");
            variables.put("ref", ref);
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }
}
