package win.ixuni.hubstore.driver.local.context;

import lombok.Builder;
import lombok.Getter;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.util.StoragePathUtils;
import win.ixuni.hubstore.driver.local.LocalDriverFactory;

import java.nio.file.Path;

/**
 * 本地文件系统驱动上下文
 */
@Getter
@Builder
public class LocalDriverContext implements DriverContext {

    private final DriverConfig config;

    /**
     * 存储根路径
     */
    private final Path basePath;

    private final String readUrlPrefix;

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
        return LocalDriverFactory.DRIVER_TYPE;
    }

    public Path getTopLevelPath(String storageTopLevel) {
        return basePath.resolve(StoragePathUtils.join(storageTopLevel));
    }

    public Path getFilePath(String contentPath) {
        return basePath.resolve(contentPath);
    }
}
