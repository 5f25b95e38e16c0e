package win.ixuni.hubstore.core.operation;

/**
 * Base interface of driver operations
 * <p>
 * Every hub request a driver serves (write a file, list files) is one immutable operation object,
 * dispatched to the handler the driver registered for its class.
 *
 * @param <R> operation result type
 */
public interface Operation<R> {

    /**
     * Get the operation name (for logging)
     *
     * @return 操作名称，如 "WriteFile", "ListFiles"
     */
    default String getOperationName() {
        String className = getClass().getSimpleName();
        if (className.endsWith("Operation")) {
            return className.substring(0, className.length() - 9);
        }
        return className;
    }
}
