package win.ixuni.hubstore.core.exception;

import lombok.Getter;

/**
 * Reading the upload stream failed
 * <p>
 * The write never reached the backend.
 */
@Getter
public class StreamReadException extends HubStoreException {

    private final String contentPath;
    private final String bucket;

    public StreamReadException(String contentPath, String bucket, Throwable cause) {
        super("StreamReadError", "Storage driver failed: failed to write file " + contentPath
                + " in bucket " + bucket + ": " + cause.getMessage(), 400, cause);
        this.contentPath = contentPath;
        this.bucket = bucket;
    }

    public StreamReadException(String contentPath, String bucket, String reason) {
        super("StreamReadError", "Storage driver failed: failed to write file " + contentPath
                + " in bucket " + bucket + ": " + reason, 400);
        this.contentPath = contentPath;
        this.bucket = bucket;
    }
}
