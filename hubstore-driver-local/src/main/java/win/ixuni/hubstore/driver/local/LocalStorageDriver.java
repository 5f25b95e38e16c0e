package win.ixuni.hubstore.driver.local;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.driver.AbstractStorageDriver;
import win.ixuni.hubstore.core.exception.MissingIdentifierException;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.interceptor.LoggingInterceptor;
import win.ixuni.hubstore.core.util.StoragePathUtils;
import win.ixuni.hubstore.driver.local.context.LocalDriverContext;
import win.ixuni.hubstore.driver.local.handler.LocalListFilesHandler;
import win.ixuni.hubstore.driver.local.handler.LocalWriteFileHandler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 本地文件系统存储驱动
 * <p>
 * Files are stored under {@code base-path/storageTopLevel/path} and served by whatever web server
 * exposes {@code base-path} at {@code read-url-prefix}.
 */
@Slf4j
public class LocalStorageDriver extends AbstractStorageDriver {

    @Getter
    private final DriverConfig config;

    private final LocalDriverContext driverContext;

    public LocalStorageDriver(DriverConfig config) {
        this.config = config;

        String readUrlPrefix = config.getString("read-url-prefix", null);
        if (readUrlPrefix == null || readUrlPrefix.isEmpty()) {
            throw new MissingIdentifierException("read-url-prefix");
        }
        String basePath = config.getString("base-path", "/tmp/hubstore");

        this.driverContext = LocalDriverContext.builder()
                .config(config)
                .basePath(Path.of(basePath).toAbsolutePath().normalize())
                .readUrlPrefix(StoragePathUtils.withTrailingSlash(readUrlPrefix))
                .build();

        registerHandlers();
    }

    private void registerHandlers() {
        getHandlerRegistry().register(new LocalWriteFileHandler());
        getHandlerRegistry().register(new LocalListFilesHandler());
        getHandlerRegistry().addInterceptor(new LoggingInterceptor());

        log.info("Registered {} operation handlers for local driver", getHandlerRegistry().size());
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
        return LocalDriverFactory.DRIVER_TYPE;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public Mono<Void> initialize() {
        log.info("Initializing local filesystem driver: {} at {}",
                config.getName(), driverContext.getBasePath());

        return Mono.<Void>fromRunnable(() -> {
            try {
                Files.createDirectories(driverContext.getBasePath());
            } catch (IOException e) {
                throw new UncheckedIOException(
                        "Failed to initialize local driver at: " + driverContext.getBasePath(), e);
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }
}
