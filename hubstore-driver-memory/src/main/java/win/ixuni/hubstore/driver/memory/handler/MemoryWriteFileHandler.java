package win.ixuni.hubstore.driver.memory.handler;

import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;
import win.ixuni.hubstore.core.exception.BadPathException;
import win.ixuni.hubstore.core.model.WriteResult;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.OperationHandler;
import win.ixuni.hubstore.core.operation.file.WriteFileOperation;
import win.ixuni.hubstore.core.util.ContentUtils;
import win.ixuni.hubstore.core.util.StoragePathUtils;
import win.ixuni.hubstore.driver.memory.context.MemoryDriverContext;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Memory WriteFile 处理器
 */
public class MemoryWriteFileHandler implements OperationHandler<WriteFileOperation, WriteResult> {

    @Override
    public Mono<WriteResult> handle(WriteFileOperation operation, DriverContext context) {
        MemoryDriverContext ctx = (MemoryDriverContext) context;

        if (!StoragePathUtils.isPathValid(operation.getPath())) {
            return Mono.error(new BadPathException(operation.getPath()));
        }
        String contentPath = StoragePathUtils.join(operation.getStorageTopLevel(), operation.getPath());

        return ContentUtils.collect(operation.getContent(), -1, contentPath, ctx.getBucket())
                .map(data -> {
                    ctx.getFiles().put(contentPath, MemoryDriverContext.FileData.builder()
                            .contentPath(contentPath)
                            .data(data)
                            .contentType(operation.getContentType() != null ? operation.getContentType()
                                    : "application/octet-stream")
                            .lastModified(Instant.now())
                            .build());

                    return WriteResult.builder()
                            .url(ctx.getReadUrlPrefix() + contentPath)
                            .contentPath(contentPath)
                            .size(data.length)
                            .build();
                });
    }

    @Override
    public Class<WriteFileOperation> getOperationType() {
        return WriteFileOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.WRITE);
    }
}
