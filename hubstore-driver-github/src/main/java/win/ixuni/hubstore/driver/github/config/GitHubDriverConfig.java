package win.ixuni.hubstore.driver.github.config;

import lombok.Builder;
import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.exception.ConfigurationException;
import win.ixuni.hubstore.core.exception.MissingCredentialException;
import win.ixuni.hubstore.core.exception.MissingIdentifierException;
import win.ixuni.hubstore.core.exception.UnsupportedAuthTypeException;

/**
 * GitHub 驱动配置
 * <p>
 * Validated, immutable view of the driver properties:
 * <pre>
 * authtype: token | oauth   (required)
 * token:    credential      (required)
 * baseurl:  API base URL    (default https://api.github.com)
 * owner:    repository owner (required)
 * repo:     repository name  (required)
 * path:     root path prefix used for listings (default "/")
 * ref:      branch written to and read from (default "master")
 * </pre>
 */
@Slf4j
@Value
@Builder
public class GitHubDriverConfig {

    public static final String DEFAULT_BASE_URL = "https://api.github.com";
    public static final String DEFAULT_RAW_URL = "https://raw.githubusercontent.com";
    public static final String DEFAULT_PATH = "/";
    public static final String DEFAULT_REF = "master";

    AuthType authType;

    String token;

    String baseUrl;

    /**
     * Host serving raw file content, the read URLs point here
     */
    String rawUrl;

    String owner;

    String repo;

    String path;

    String ref;

    String commitMessage;

    String committerName;

    String committerEmail;

    String userAgent;

    /**
     * Largest content accepted by a write, in bytes
     */
    long maxContentLength;

    /**
     * Validate driver properties
     *
     * @param config raw driver configuration
     * @return validated configuration
     * @throws ConfigurationException if a required setting is missing or invalid
     */
    public static GitHubDriverConfig from(DriverConfig config) {
        if (config.hasNoProperties()) {
            throw new ConfigurationException("Configuration is missing for GitHub driver");
        }

        AuthType authType = AuthType.fromValue(config.getString("authtype", null));

        String token = config.getString("token", null);
        if (isEmpty(token)) {
            throw new MissingCredentialException(authType.getValue());
        }

        String owner = config.getString("owner", null);
        if (isEmpty(owner)) {
            throw new MissingIdentifierException("owner");
        }
        String repo = config.getString("repo", null);
        if (isEmpty(repo)) {
            throw new MissingIdentifierException("repo");
        }

        String path = config.getString("path", null);
        if (isEmpty(path)) {
            log.info("setting path to {} as its not supplied in GitHub driver configuration", DEFAULT_PATH);
            path = DEFAULT_PATH;
        }
        String ref = config.getString("ref", null);
        if (isEmpty(ref)) {
            log.info("setting ref to \"{}\" as its not supplied in GitHub driver configuration", DEFAULT_REF);
            ref = DEFAULT_REF;
        }

        String baseUrl = config.getString("baseurl", null);

        return GitHubDriverConfig.builder()
                .authType(authType)
                .token(token)
                .baseUrl(isEmpty(baseUrl) ? DEFAULT_BASE_URL : baseUrl)
                .rawUrl(config.getString("raw-url", DEFAULT_RAW_URL))
                .owner(owner)
                .repo(repo)
                .path(path)
                .ref(ref)
                .commitMessage(config.getString("commit-message", "hub storage write"))
                .committerName(config.getString("committer-name", "gaia"))
                .committerEmail(config.getString("committer-email", "someone@somewhere"))
                .userAgent(config.getString("user-agent", "blockstack-gaia-githubdriver"))
                .maxContentLength(config.getLong("max-content-length", 100L * 1024 * 1024))
                .build();
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    /**
     * Supported authentication modes
     */
    @Getter
    public enum AuthType {
        TOKEN("token", "token "),
        OAUTH("oauth", "Bearer ");

        private final String value;
        private final String headerScheme;

        AuthType(String value, String headerScheme) {
            this.value = value;
            this.headerScheme = headerScheme;
        }

        public String authorizationHeader(String token) {
            return headerScheme + token;
        }

        /**
         * @throws UnsupportedAuthTypeException for null or any unknown value
         */
        public static AuthType fromValue(String value) {
            for (AuthType type : values()) {
                if (type.value.equals(value)) {
                    return type;
                }
            }
            throw new UnsupportedAuthTypeException(value, "\"token\" or \"oauth\"");
        }
    }
}
