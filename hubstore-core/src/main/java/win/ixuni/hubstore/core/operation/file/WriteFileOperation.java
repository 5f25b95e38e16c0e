package win.ixuni.hubstore.core.operation.file;

import lombok.Builder;
import lombok.Value;
import reactor.core.publisher.Flux;
import win.ixuni.hubstore.core.model.WriteResult;
import win.ixuni.hubstore.core.operation.Operation;

import java.nio.ByteBuffer;

/**
 * Write file operation
 */
@Value
@Builder
public class WriteFileOperation implements Operation<WriteResult> {

    /**
     * Path relative to the top-level namespace
     */
    String path;

    /**
     * Bucket-scoped top-level namespace
     */
    String storageTopLevel;

    /**
     * 文件内容流
     */
    Flux<ByteBuffer> content;

    /**
     * Declared content length, -1 when unknown
     */
    @Builder.Default
    long contentLength = -1;

    /**
     * Content type
     */
    String contentType;
}
