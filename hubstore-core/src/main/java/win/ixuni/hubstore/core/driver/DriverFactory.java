package win.ixuni.hubstore.core.driver;

import win.ixuni.hubstore.core.config.DriverConfig;

/**
 * Driver factory interface
 * <p>
 * Each driver type provides a factory implementation to create driver instances from configuration.
 * Supports creating multiple instances of the same driver type (one per bucket).
 */
public interface DriverFactory {

    /**
     * Get the driver type supported by this factory
     *
     * @return driver type identifier (e.g. "github", "memory", "local")
     */
    String getDriverType();

    /**
     * Create a driver instance from configuration
     * <p>
     * Configuration is validated here; an invalid configuration never yields a driver.
     *
     * @param config driver configuration
     * @return driver instance
     * @throws win.ixuni.hubstore.core.exception.ConfigurationException if the configuration is invalid
     */
    StorageDriver createDriver(DriverConfig config);

    /**
     * Get the driver description
     *
     * @return description text
     */
    default String getDescription() {
        return getDriverType() + " storage driver";
    }
}
