package win.ixuni.hubstore.core.exception;

import lombok.Getter;

/**
 * HubStore base exception
 */
@Getter
public class HubStoreException extends RuntimeException {

    private final String errorCode;
    private final int httpStatus;

    public HubStoreException(String errorCode, String message, int httpStatus) {
        super(message);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }

    public HubStoreException(String errorCode, String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.httpStatus = httpStatus;
    }
}
