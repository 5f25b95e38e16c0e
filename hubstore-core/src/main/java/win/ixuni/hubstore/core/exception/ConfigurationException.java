package win.ixuni.hubstore.core.exception;

/**
 * Invalid driver configuration
 * <p>
 * Fatal at construction time: the driver instance is never created.
 */
public class ConfigurationException extends HubStoreException {

    public ConfigurationException(String message) {
        this("ConfigurationError", message);
    }

    protected ConfigurationException(String errorCode, String message) {
        super(errorCode, message, 500);
    }
}
