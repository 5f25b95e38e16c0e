package win.ixuni.hubstore.driver.github;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.driver.DriverFactory;
import win.ixuni.hubstore.core.driver.StorageDriver;

/**
 * GitHub driver factory
 * <p>
 * 创建把文件作为提交存入 GitHub 仓库的驱动实例。
 */
@Slf4j
@Component
public class GitHubDriverFactory implements DriverFactory {

    public static final String DRIVER_TYPE = "github";

    @Override
    public String getDriverType() {
        return DRIVER_TYPE;
    }

    @Override
    public StorageDriver createDriver(DriverConfig config) {
        log.info("Creating GitHub driver instance: {}", config.getName());
        return new GitHubStorageDriver(config);
    }

    @Override
    public String getDescription() {
        return "GitHub driver storing files as commits on a repository branch";
    }
}
