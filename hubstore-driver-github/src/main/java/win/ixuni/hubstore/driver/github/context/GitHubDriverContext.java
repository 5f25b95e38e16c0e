package win.ixuni.hubstore.driver.github.context;

import lombok.Builder;
import lombok.Getter;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.util.StoragePathUtils;
import win.ixuni.hubstore.driver.github.GitHubDriverFactory;
import win.ixuni.hubstore.driver.github.client.GitHubContentsClient;
import win.ixuni.hubstore.driver.github.client.model.Committer;
import win.ixuni.hubstore.driver.github.config.GitHubDriverConfig;

/**
 * GitHub 驱动上下文
 * <p>
 * Holds the validated configuration and the authenticated contents client. Both are created once
 * per driver and shared read-only by all operations.
 */
@Getter
@Builder
public class GitHubDriverContext implements DriverContext {

    private final DriverConfig config;

    private final GitHubDriverConfig gitHubConfig;

    private final GitHubContentsClient client;

    @Override
    public DriverConfig getConfig() {
        return config;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public String getDriverType() {
        return GitHubDriverFactory.DRIVER_TYPE;
    }

    // ============ Paths and URLs ============

    /**
     * Raw content URL prefix, e.g. {@code https://raw.githubusercontent.com/acme/site/main/}
     */
    public String getReadUrlPrefix() {
        return StoragePathUtils.withTrailingSlash(gitHubConfig.getRawUrl())
                + gitHubConfig.getOwner() + "/"
                + gitHubConfig.getRepo() + "/"
                + gitHubConfig.getRef() + "/";
    }

    /**
     * Repository path a write goes to: {@code storageTopLevel/path}
     */
    public String contentPath(String storageTopLevel, String path) {
        return StoragePathUtils.join(storageTopLevel, path);
    }

    /**
     * Repository directory a listing reads: {@code rootPath/storageTopLevel}
     */
    public String listingPath(String storageTopLevel) {
        return StoragePathUtils.join(gitHubConfig.getPath(), storageTopLevel);
    }

    public String readUrl(String contentPath) {
        return getReadUrlPrefix() + contentPath;
    }

    public Committer committer() {
        return new Committer(gitHubConfig.getCommitterName(), gitHubConfig.getCommitterEmail());
    }
}
