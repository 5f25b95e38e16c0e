package win.ixuni.hubstore.core.exception;

/**
 * Invalid caller-supplied path, rejected before any backend call
 */
public class BadPathException extends HubStoreException {

    public BadPathException(String path) {
        super("BadPath", "Invalid Path: " + path, 400);
    }
}
