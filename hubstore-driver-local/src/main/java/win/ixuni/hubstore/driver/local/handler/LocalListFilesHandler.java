package win.ixuni.hubstore.driver.local.handler;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;
import win.ixuni.hubstore.core.model.ListFilesResult;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.core.operation.OperationHandler;
import win.ixuni.hubstore.core.operation.file.ListFilesOperation;
import win.ixuni.hubstore.driver.local.context.LocalDriverContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 本地文件系统列出文件处理器
 * <p>
 * Lists every regular file beneath the top-level directory, as relative paths in lexical order.
 * A missing directory lists as empty. Listings are never paged.
 */
public class LocalListFilesHandler implements OperationHandler<ListFilesOperation, ListFilesResult> {

    @Override
    public Mono<ListFilesResult> handle(ListFilesOperation operation, DriverContext context) {
        LocalDriverContext ctx = (LocalDriverContext) context;

        return Mono.fromCallable(() -> {
            Path topLevel = ctx.getTopLevelPath(operation.getStorageTopLevel());
            if (!Files.isDirectory(topLevel)) {
                return ListFilesResult.builder().entries(List.of()).page(null).build();
            }

            try (Stream<Path> walk = Files.walk(topLevel)) {
                List<String> entries = walk
                        .filter(Files::isRegularFile)
                        .map(file -> topLevel.relativize(file).toString().replace('\\', '/'))
                        // in-flight uploads
                        .filter(name -> !isTempFile(name))
                        .sorted()
                        .toList();
                return ListFilesResult.builder().entries(entries).page(null).build();
            }
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private boolean isTempFile(String relativeName) {
        String fileName = relativeName.substring(relativeName.lastIndexOf('/') + 1);
        return fileName.startsWith(".upload-") && fileName.endsWith(".tmp");
    }

    @Override
    public Class<ListFilesOperation> getOperationType() {
        return ListFilesOperation.class;
    }

    @Override
    public Set<Capability> getProvidedCapabilities() {
        return EnumSet.of(Capability.LIST);
    }
}
