package win.ixuni.hubstore.core.driver;

import lombok.Getter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.config.HubStoreProperties;
import win.ixuni.hubstore.core.exception.ConfigurationException;
import win.ixuni.hubstore.core.exception.DriverNotFoundException;
import win.ixuni.hubstore.core.exception.MissingIdentifierException;
import win.ixuni.hubstore.core.operation.DriverContext;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class DriverRegistryTest {

    private static DriverConfig config(String name, String type, String bucket) {
        DriverConfig config = new DriverConfig();
        config.setName(name);
        config.setType(type);
        config.setBucket(bucket);
        config.getProperties().put("prefix", "https://cdn.example.com/" + name + "/");
        return config;
    }

    private static HubStoreProperties properties(DriverConfig... configs) {
        HubStoreProperties properties = new HubStoreProperties();
        properties.setDrivers(List.of(configs));
        return properties;
    }

    @Test
    @DisplayName("Enabled drivers are created and keyed by bucket")
    void createsDriversPerBucket() {
        StubDriverFactory factory = new StubDriverFactory();
        DriverConfig disabled = config("off", "stub", "bucket-off");
        disabled.setEnabled(false);
        DriverRegistry registry = new DriverRegistry(
                properties(config("one", "stub", "bucket-1"), config("two", "stub", null), disabled),
                List.of(factory));

        registry.initialize();

        assertEquals(2, registry.getAllDrivers().size());
        assertEquals("one", registry.getDriver("bucket-1").getDriverName());
        // bucket falls back to the driver name
        assertTrue(registry.hasDriver("two"));
        assertFalse(registry.hasDriver("bucket-off"));
        assertTrue(registry.findDriver("bucket-off").isEmpty());
        assertEquals(2, factory.initialized.get());
    }

    @Test
    @DisplayName("Unknown buckets and driver types raise DriverNotFoundException")
    void unknownDriver() {
        DriverRegistry registry = new DriverRegistry(properties(), List.of(new StubDriverFactory()));
        registry.initialize();

        assertThrows(DriverNotFoundException.class, () -> registry.getDriver("missing"));
        assertThrows(DriverNotFoundException.class,
                () -> registry.createDriver(config("x", "nonexistent", "b")));
    }

    @Test
    @DisplayName("Invalid configuration aborts initialization")
    void invalidConfigurationFailsFast() {
        DriverConfig broken = config("broken", "stub", "b");
        broken.getProperties().clear();
        DriverRegistry registry = new DriverRegistry(properties(broken), List.of(new StubDriverFactory()));

        ConfigurationException e = assertThrows(ConfigurationException.class, registry::initialize);

        assertInstanceOf(MissingIdentifierException.class, e);
        assertTrue(registry.getAllDrivers().isEmpty());
    }

    @Test
    @DisplayName("Shutdown releases every driver")
    void shutdown() {
        StubDriverFactory factory = new StubDriverFactory();
        DriverRegistry registry = new DriverRegistry(
                properties(config("one", "stub", "a"), config("two", "stub", "b")), List.of(factory));
        registry.initialize();

        registry.shutdown();

        assertEquals(2, factory.shutdown.get());
        assertTrue(registry.getAllDrivers().isEmpty());
    }

    private static class StubDriverFactory implements DriverFactory {

        final AtomicInteger initialized = new AtomicInteger();
        final AtomicInteger shutdown = new AtomicInteger();

        @Override
        public String getDriverType() {
            return "stub";
        }

        @Override
        public StorageDriver createDriver(DriverConfig config) {
            String prefix = config.getString("prefix", null);
            if (prefix == null) {
                throw new MissingIdentifierException("prefix");
            }
            return new StubDriver(config, prefix, this);
        }
    }

    private static class StubDriver extends AbstractStorageDriver {

        private final StubContext context;
        private final String prefix;
        private final StubDriverFactory factory;

        StubDriver(DriverConfig config, String prefix, StubDriverFactory factory) {
            this.context = new StubContext(config);
            this.prefix = prefix;
            this.factory = factory;
        }

        @Override
        public DriverContext getDriverContext() {
            return context;
        }

        @Override
        public String getReadUrlPrefix() {
            return prefix;
        }

        @Override
        public String getDriverType() {
            return "stub";
        }

        @Override
        public String getDriverName() {
            return context.getConfig().getName();
        }

        @Override
        public Mono<Void> initialize() {
            return Mono.fromRunnable(factory.initialized::incrementAndGet);
        }

        @Override
        public Mono<Void> shutdown() {
            return Mono.fromRunnable(factory.shutdown::incrementAndGet);
        }
    }

    @Getter
    private static class StubContext implements DriverContext {

        private final DriverConfig config;

        StubContext(DriverConfig config) {
            this.config = config;
        }

        @Override
        public String getDriverName() {
            return config.getName();
        }

        @Override
        public String getDriverType() {
            return "stub";
        }
    }
}
