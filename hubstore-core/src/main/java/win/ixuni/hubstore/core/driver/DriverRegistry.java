package win.ixuni.hubstore.core.driver;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.config.HubStoreProperties;
import win.ixuni.hubstore.core.exception.DriverNotFoundException;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 驱动注册表
 * <p>
 * Creates one driver per configured bucket, selecting the factory by the configuration's {@code type}.
 * Invalid driver configuration aborts startup: no partially configured driver is ever registered.
 */
@Slf4j
@Component
public class DriverRegistry {

    private final HubStoreProperties properties;

    /**
     * Driver instance mapping: bucket -> driver
     */
    private final Map<String, StorageDriver> drivers = new ConcurrentHashMap<>();

    /**
     * Driver factory mapping: type -> factory
     */
    private final Map<String, DriverFactory> factoryMap = new ConcurrentHashMap<>();

    /**
     * @param driverFactories factories to choose from; when empty, those found through
     *                        {@link DriverFactoryLoader} are used
     */
    public DriverRegistry(HubStoreProperties properties, List<DriverFactory> driverFactories) {
        this.properties = properties;
        List<DriverFactory> factories = driverFactories == null || driverFactories.isEmpty()
                ? DriverFactoryLoader.load()
                : driverFactories;
        for (DriverFactory factory : factories) {
            factoryMap.put(factory.getDriverType(), factory);
            log.info("Registered driver factory: {} - {}", factory.getDriverType(), factory.getDescription());
        }
    }

    @PostConstruct
    public void initialize() {
        log.info("Initializing driver registry with {} driver factories", factoryMap.size());

        for (DriverConfig config : properties.getDrivers()) {
            if (!config.isEnabled()) {
                log.info("Driver '{}' is disabled, skipping", config.getName());
                continue;
            }
            StorageDriver driver = createDriver(config);
            drivers.put(bucketKey(config), driver);
            log.info("Created driver instance: {} (type: {}, bucket: {})",
                    config.getName(), config.getType(), bucketKey(config));
        }

        log.info("Driver registry initialized with {} drivers", drivers.size());
    }

    /**
     * Create and initialize a driver from configuration
     *
     * @param config driver configuration
     * @return initialized driver
     * @throws DriverNotFoundException if no factory handles the configured type
     */
    public StorageDriver createDriver(DriverConfig config) {
        DriverFactory factory = factoryMap.get(config.getType());
        if (factory == null) {
            log.error("Unknown driver type '{}' for driver '{}'", config.getType(), config.getName());
            throw new DriverNotFoundException(String.valueOf(config.getType()));
        }
        StorageDriver driver = factory.createDriver(config);
        driver.initialize().block();
        return driver;
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down driver registry...");
        Flux.fromIterable(drivers.values())
                .flatMap(driver -> driver.shutdown()
                        .doOnSuccess(v -> log.info("Driver '{}' shutdown complete", driver.getDriverName()))
                        .onErrorResume(e -> {
                            log.error("Error shutting down driver '{}': {}", driver.getDriverName(), e.getMessage());
                            return Mono.empty();
                        }))
                .blockLast();
        drivers.clear();
        log.info("Driver registry shutdown complete");
    }

    /**
     * 获取 bucket 对应的驱动实例
     *
     * @param bucket bucket name
     * @return driver instance
     */
    public StorageDriver getDriver(String bucket) {
        StorageDriver driver = drivers.get(bucket);
        if (driver == null) {
            throw new DriverNotFoundException(bucket);
        }
        return driver;
    }

    public Optional<StorageDriver> findDriver(String bucket) {
        return Optional.ofNullable(drivers.get(bucket));
    }

    public Map<String, StorageDriver> getAllDrivers() {
        return Map.copyOf(drivers);
    }

    public boolean hasDriver(String bucket) {
        return drivers.containsKey(bucket);
    }

    private static String bucketKey(DriverConfig config) {
        return config.getBucket() != null ? config.getBucket() : config.getName();
    }
}
