package win.ixuni.hubstore.core.exception;

/**
 * Driver not found exception
 */
public class DriverNotFoundException extends HubStoreException {

    public DriverNotFoundException(String driverName) {
        super("DriverNotFound", "The specified driver does not exist: " + driverName, 500);
    }
}
