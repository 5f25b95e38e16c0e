package win.ixuni.hubstore.core.driver;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.model.ListFilesResult;
import win.ixuni.hubstore.core.model.WriteResult;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.Operation;
import win.ixuni.hubstore.core.operation.OperationHandlerRegistry;
import win.ixuni.hubstore.core.operation.file.ListFilesOperation;
import win.ixuni.hubstore.core.operation.file.WriteFileOperation;

import java.nio.ByteBuffer;

/**
 * Storage driver interface
 * <p>
 * Command-pattern architecture where all hub operations are executed via {@link #execute(Operation)}.
 * Each driver implements its own handlers and registers them with the registry.
 * The hub constructs one instance per bucket; instances are safe to share between concurrent requests.
 */
public interface StorageDriver extends DriverCapabilities {

    // ==================== Core Methods ====================

    /**
     * Get the operation handler registry
     *
     * @return handler registry
     */
    OperationHandlerRegistry getHandlerRegistry();

    /**
     * Get the driver context
     *
     * @return driver context
     */
    DriverContext getDriverContext();

    /**
     * Execute an operation
     * <p>
     * This is the unified entry point for all hub operations, with interceptor chain support.
     *
     * @param operation the operation instance
     * @param <O>       operation type
     * @param <R>       return type
     * @return operation result
     */
    default <O extends Operation<R>, R> Mono<R> execute(O operation) {
        return getHandlerRegistry().execute(operation, getDriverContext());
    }

    // ==================== Hub Operations ====================

    /**
     * Public URL prefix under which written files become readable.
     * <p>
     * Pure function of the driver configuration, stable for the lifetime of the instance.
     *
     * @return read URL prefix, always ending with a slash
     */
    String getReadUrlPrefix();

    /**
     * Write a file
     *
     * @param path            path relative to the top-level namespace
     * @param storageTopLevel bucket-scoped top-level namespace
     * @param stream          file content
     * @param contentLength   declared content length
     * @param contentType     declared content type
     * @return URL at which the content is readable
     */
    default Mono<String> performWrite(String path, String storageTopLevel, Flux<ByteBuffer> stream,
                                      long contentLength, String contentType) {
        return execute(WriteFileOperation.builder()
                .path(path)
                .storageTopLevel(storageTopLevel)
                .content(stream)
                .contentLength(contentLength)
                .contentType(contentType)
                .build())
                .map(WriteResult::getUrl);
    }

    /**
     * List the files beneath a top-level namespace
     *
     * @param storageTopLevel bucket-scoped top-level namespace
     * @param page            continuation token from a previous call, may be null
     * @return entry names and the next continuation token
     */
    default Mono<ListFilesResult> listFiles(String storageTopLevel, String page) {
        return execute(new ListFilesOperation(storageTopLevel, page));
    }

    // ==================== Driver Metadata ====================

    /**
     * Get the driver type identifier
     *
     * @return driver type (e.g. "github", "memory")
     */
    String getDriverType();

    /**
     * Get the driver instance name
     *
     * @return instance name (as specified in configuration)
     */
    String getDriverName();

    // ==================== Lifecycle ====================

    /**
     * Initialize the driver
     *
     * @return completion signal
     */
    default Mono<Void> initialize() {
        return Mono.empty();
    }

    /**
     * Shut down the driver and release resources
     *
     * @return completion signal
     */
    default Mono<Void> shutdown() {
        return Mono.empty();
    }
}
