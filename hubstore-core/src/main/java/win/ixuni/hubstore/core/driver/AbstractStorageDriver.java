package win.ixuni.hubstore.core.driver;

import lombok.Getter;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;
import win.ixuni.hubstore.core.operation.OperationHandlerRegistry;

import java.util.Set;

/**
 * Abstract base class for storage drivers
 * <p>
 * Provides common implementation; subclasses only need to implement initialization and register handlers.
 * All hub operations are executed via the {@code execute(Operation)} method.
 */
public abstract class AbstractStorageDriver implements StorageDriver {

    @Getter
    protected final OperationHandlerRegistry handlerRegistry = new OperationHandlerRegistry();

    @Override
    public Set<Capability> getCapabilities() {
        // Aggregated from all registered handler-declared capabilities
        return handlerRegistry.getAggregatedCapabilities();
    }
}
