package win.ixuni.hubstore.driver.github;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.config.HubStoreProperties;
import win.ixuni.hubstore.core.driver.DriverFactory;
import win.ixuni.hubstore.core.driver.DriverFactoryLoader;
import win.ixuni.hubstore.core.driver.DriverRegistry;
import win.ixuni.hubstore.core.driver.StorageDriver;
import win.ixuni.hubstore.core.exception.UnsupportedAuthTypeException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GitHubDriverFactoryTest {

    private static DriverConfig config(String authType) {
        DriverConfig config = new DriverConfig();
        config.setName("site");
        config.setType("github");
        config.setBucket("hub-bucket");
        config.getProperties().put("authtype", authType);
        config.getProperties().put("token", "secret");
        config.getProperties().put("owner", "acme");
        config.getProperties().put("repo", "site");
        config.getProperties().put("ref", "main");
        return config;
    }

    @Test
    @DisplayName("Factory is discovered through META-INF/services")
    void discoveredViaSpi() {
        List<DriverFactory> factories = DriverFactoryLoader.load();

        assertTrue(factories.stream().anyMatch(f -> f instanceof GitHubDriverFactory));
    }

    @Test
    @DisplayName("Registry builds a GitHub driver per configured bucket")
    void registryCreatesDriver() {
        HubStoreProperties properties = new HubStoreProperties();
        properties.setDrivers(List.of(config("token")));
        DriverRegistry registry = new DriverRegistry(properties, DriverFactoryLoader.load());

        registry.initialize();

        StorageDriver driver = registry.getDriver("hub-bucket");
        assertInstanceOf(GitHubStorageDriver.class, driver);
        assertEquals("https://raw.githubusercontent.com/acme/site/main/", driver.getReadUrlPrefix());
        registry.shutdown();
    }

    @Test
    @DisplayName("Registry without injected factories uses the ones on the classpath")
    void registryFallsBackToClasspathFactories() {
        HubStoreProperties properties = new HubStoreProperties();
        properties.setDrivers(List.of(config("oauth")));
        DriverRegistry registry = new DriverRegistry(properties, List.of());

        registry.initialize();

        assertInstanceOf(GitHubStorageDriver.class, registry.getDriver("hub-bucket"));
        registry.shutdown();
    }

    @Test
    @DisplayName("Invalid configuration never yields a driver")
    void invalidConfiguration() {
        GitHubDriverFactory factory = new GitHubDriverFactory();

        assertThrows(UnsupportedAuthTypeException.class, () -> factory.createDriver(config("password")));
        assertEquals("github", factory.getDriverType());
    }
}
