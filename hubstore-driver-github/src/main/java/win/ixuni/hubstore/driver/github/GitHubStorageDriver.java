package win.ixuni.hubstore.driver.github;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.driver.AbstractStorageDriver;
import win.ixuni.hubstore.core.exception.AuthenticationSetupException;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.hubstore.driver.github.client.GitHubContentsClient;
import win.ixuni.hubstore.driver.github.client.WebClientGitHubContentsClient;
import win.ixuni.hubstore.driver.github.config.GitHubDriverConfig;
import win.ixuni.hubstore.driver.github.context.GitHubDriverContext;
import win.ixuni.hubstore.driver.github.handler.GitHubListFilesHandler;
import win.ixuni.hubstore.driver.github.handler.GitHubWriteFileHandler;
import win.ixuni.hubstore.driver.github.interceptor.GitHubExceptionTranslationInterceptor;

import java.util.function.Function;

/**
 * GitHub storage driver
 * <p>
 * Stores each written file as one commit on a fixed branch of a GitHub repository and serves it
 * back through raw.githubusercontent.com. Last write wins; there is no delete or history access.
 */
@Slf4j
public class GitHubStorageDriver extends AbstractStorageDriver {

    @Getter
    private final DriverConfig config;

    private final GitHubDriverContext driverContext;

    public GitHubStorageDriver(DriverConfig config) {
        this(config, WebClientGitHubContentsClient::create);
    }

    /**
     * @param clientFactory builds the authenticated contents client from validated configuration
     */
    public GitHubStorageDriver(DriverConfig config, Function<GitHubDriverConfig, GitHubContentsClient> clientFactory) {
        this.config = config;

        GitHubDriverConfig gitHubConfig = GitHubDriverConfig.from(config);

        log.info("about to authenticate to GitHub as {} for {}/{}",
                gitHubConfig.getAuthType().getValue(), gitHubConfig.getOwner(), gitHubConfig.getRepo());
        GitHubContentsClient client;
        try {
            client = clientFactory.apply(gitHubConfig);
        } catch (RuntimeException e) {
            throw new AuthenticationSetupException(
                    "Failed to set up GitHub client for driver '" + config.getName() + "': " + e.getMessage(), e);
        }

        this.driverContext = GitHubDriverContext.builder()
                .config(config)
                .gitHubConfig(gitHubConfig)
                .client(client)
                .build();

        registerHandlers();
        registerInterceptors();
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new GitHubWriteFileHandler());
        getHandlerRegistry().register(new GitHubListFilesHandler());

        log.info("Registered {} operation handlers for GitHub driver", getHandlerRegistry().size());
    }

    private void registerInterceptors() {
        getHandlerRegistry().addInterceptor(new LoggingInterceptor());
        getHandlerRegistry().addInterceptor(new GitHubExceptionTranslationInterceptor());
    }

    @Override
    public DriverContext getDriverContext() {
        return driverContext;
    }

    @Override
    public String getReadUrlPrefix() {
        return driverContext.getReadUrlPrefix();
    }

    @Override
    public String getDriverType() {
        return GitHubDriverFactory.DRIVER_TYPE;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        GitHubDriverConfig gh = driverContext.getGitHubConfig();
        log.info("Initializing GitHub driver: {} -> {}/{}@{}",
                config.getName(), gh.getOwner(), gh.getRepo(), gh.getRef());
        return Mono.empty();
    }
}
