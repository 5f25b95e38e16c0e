package win.ixuni.hubstore.driver.memory;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.driver.AbstractStorageDriver;
import win.ixuni.hubstore.core.exception.ConfigurationException;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.hubstore.core.util.StoragePathUtils;
import win.ixuni.hubstore.driver.memory.context.MemoryDriverContext;
import win.ixuni.hubstore.driver.memory.handler.MemoryListFilesHandler;
import win.ixuni.hubstore.driver.memory.handler.MemoryWriteFileHandler;

/**
 * Memory 存储驱动
 * <p>
 * Keeps written files in a sorted map. Content is lost on shutdown.
 */
@Slf4j
public class MemoryStorageDriver extends AbstractStorageDriver {

    @Getter
    private final DriverConfig config;

    private final MemoryDriverContext driverContext;

    public MemoryStorageDriver(DriverConfig config) {
        this.config = config;

        int pageSize = config.getInt("page-size", 1000);
        if (pageSize <= 0) {
            throw new ConfigurationException("page-size must be positive, got " + pageSize);
        }
        String readUrlPrefix = config.getString("read-url-prefix", "memory://" + config.getName() + "/");

        this.driverContext = MemoryDriverContext.builder()
                .config(config)
                .readUrlPrefix(StoragePathUtils.withTrailingSlash(readUrlPrefix))
                .pageSize(pageSize)
                .build();
        registerHandlers();
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new MemoryWriteFileHandler());
        getHandlerRegistry().register(new MemoryListFilesHandler());
        getHandlerRegistry().addInterceptor(new LoggingInterceptor());

        log.info("Registered {} operation handlers for memory driver", getHandlerRegistry().size());
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
        return MemoryDriverFactory.DRIVER_TYPE;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing memory storage driver: {}", config.getName());
        return Mono.empty();
    }

    @Override
    public Mono<Void> shutdown() {
        log.info("Shutting down memory storage driver: {}", config.getName());
        driverContext.getFiles().clear();
        return Mono.empty();
    }
}
