package win.ixuni.hubstore.driver.github.client;

import lombok.Getter;
import win.ixuni.hubstore.core.util.JsonUtils;

/**
 * Non-2xx response from the GitHub API
 */
@Getter
public class GitHubApiException extends RuntimeException {

    private final int statusCode;

    /**
     * Raw response body
     */
    private final String responseBody;

    public GitHubApiException(int statusCode, String responseBody) {
        super("GitHub API returned " + statusCode + ": " + responseBody);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * The {@code message} field GitHub puts in error bodies, or the raw body
     */
    public String getBackendMessage() {
        return JsonUtils.readTextField(responseBody, "message").orElse(responseBody);
    }
}
