package win.ixuni.hubstore.core.driver;

import java.util.Set;

/**
 * Driver capability descriptor
 * <p>
 * Defines the set of features a driver supports, allowing drivers to declare unsupported operations.
 * The hub can decide whether to accept requests based on driver capabilities.
 */
public interface DriverCapabilities {

    /**
     * Driver capability enumeration
     */
    enum Capability {
        /**
         * Write a file and obtain its read URL
         */
        WRITE,

        /**
         * List the files beneath a top-level namespace
         */
        LIST,

        /**
         * Continuation tokens are honored by list
         */
        LIST_PAGINATION
    }

    /**
     * Get the set of capabilities supported by this driver
     *
     * @return the set of supported capabilities
     */
    Set<Capability> getCapabilities();

    /**
     * Check whether a specific capability is supported
     *
     * @param capability the capability to check
     * @return true if supported
     */
    default boolean supports(Capability capability) {
        return getCapabilities().contains(capability);
    }
}
