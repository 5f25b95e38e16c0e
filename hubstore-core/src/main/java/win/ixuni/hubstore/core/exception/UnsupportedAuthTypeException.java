package win.ixuni.hubstore.core.exception;

/**
 * Authentication mode absent or not one of the supported values
 */
public class UnsupportedAuthTypeException extends ConfigurationException {

    public UnsupportedAuthTypeException(String authType, String supported) {
        super("UnsupportedAuthType", "Using an unsupported auth type '" + authType
                + "'. Only " + supported + " are supported");
    }
}
