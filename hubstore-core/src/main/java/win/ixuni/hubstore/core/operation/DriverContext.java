package win.ixuni.hubstore.core.operation;

import win.ixuni.hubstore.core.config.DriverConfig;

/**
 * Driver context interface
 * <p>
 * Shared, read-only state handlers need to execute operations: the configuration captured at
 * construction and the backend client. 每个驱动实现自己的上下文类。
 */
public interface DriverContext {

    DriverConfig getConfig();

    String getDriverName();

    /**
     * @return 驱动类型标识，如 "github", "memory"
     */
    String getDriverType();

    /**
     * Bucket served by the driver, used in diagnostics
     */
    default String getBucket() {
        return getConfig().getBucket();
    }
}
