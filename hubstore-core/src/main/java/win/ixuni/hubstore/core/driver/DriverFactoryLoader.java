package win.ixuni.hubstore.core.driver;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Finds the driver factories shipped on the classpath
 * <p>
 * Every driver module lists its factory in
 * {@code META-INF/services/win.ixuni.hubstore.core.driver.DriverFactory}. The registry falls back
 * to these when it is built outside a Spring context.
 */
@Slf4j
public final class DriverFactoryLoader {

    private DriverFactoryLoader() {
    }

    public static List<DriverFactory> load() {
        List<DriverFactory> factories = new ArrayList<>();
        for (DriverFactory factory : ServiceLoader.load(DriverFactory.class,
                Thread.currentThread().getContextClassLoader())) {
            factories.add(factory);
        }
        log.info("Found {} hub storage driver factories on the classpath: {}", factories.size(),
                factories.stream().map(DriverFactory::getDriverType).toList());
        return List.copyOf(factories);
    }
}
