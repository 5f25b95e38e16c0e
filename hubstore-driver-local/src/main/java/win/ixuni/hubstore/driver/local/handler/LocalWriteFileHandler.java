package win.ixuni.hubstore.driver.local.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;
import win.ixuni.hubstore.core.exception.BadPathException;
import win.ixuni.hubstore.core.exception.StreamReadException;
import win.ixuni.hubstore.core.model.WriteResult;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.OperationHandler;
import win.ixuni.hubstore.core.operation.file.WriteFileOperation;
import win.ixuni.hubstore.core.util.StoragePathUtils;
import win.ixuni.hubstore.driver.local.context.LocalDriverContext;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 本地文件系统写入处理器
 * <p>
 * 流式写入临时文件，完成后原子替换目标文件，失败时目标文件保持不变。
 */
@Slf4j
public class LocalWriteFileHandler implements OperationHandler<WriteFileOperation, WriteResult> {

    @Override
    public Mono<WriteResult> handle(WriteFileOperation operation, DriverContext context) {
        LocalDriverContext ctx = (LocalDriverContext) context;

        if (!StoragePathUtils.isPathValid(operation.getPath())) {
            return Mono.error(new BadPathException(operation.getPath()));
        }
        String contentPath = StoragePathUtils.join(operation.getStorageTopLevel(), operation.getPath());
        Path target = ctx.getFilePath(contentPath);

        return Mono.fromCallable(() -> {
            Files.createDirectories(target.getParent());
            return Files.createTempFile(target.getParent(), ".upload-", ".tmp");
        }).flatMap(temp -> {
            AtomicLong totalSize = new AtomicLong(0);
            OutputStream os;
            try {
                os = Files.newOutputStream(temp);
            } catch (IOException e) {
                return Mono.<WriteResult>error(e);
            }
            Flux<ByteBuffer> content = operation.getContent() != null ? operation.getContent() : Flux.empty();
            return content
                    .onErrorMap(e -> new StreamReadException(contentPath, ctx.getBucket(), e))
                    .doOnNext(buffer -> {
                        byte[] bytes = new byte[buffer.remaining()];
                        buffer.get(bytes);
                        try {
                            os.write(bytes);
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                        totalSize.addAndGet(bytes.length);
                    })
                    .doOnComplete(() -> {
                        try {
                            os.close();
                        } catch (IOException e) {
                            throw new UncheckedIOException(e);
                        }
                    })
                    .doFinally(signal -> closeQuietly(os, temp))
                    .then(Mono.fromCallable(() -> {
                        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
                                StandardCopyOption.ATOMIC_MOVE);
                        log.debug("stored {} ({} bytes)", target, totalSize.get());
                        return WriteResult.builder()
                                .url(ctx.getReadUrlPrefix() + contentPath)
                                .contentPath(contentPath)
                                .size(totalSize.get())
                                .build();
                    }))
                    .doOnError(e -> deleteTemp(temp));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void closeQuietly(OutputStream os, Path temp) {
        try {
            os.close();
        } catch (IOException e) {
            log.warn("Failed to close temporary file {}", temp, e);
        }
    }

    private void deleteTemp(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}", temp, e);
        }
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
