package win.ixuni.hubstore.driver.github.handler;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;
import win.ixuni.hubstore.core.exception.BadPathException;
import win.ixuni.hubstore.core.exception.StreamReadException;
import win.ixuni.hubstore.core.model.WriteResult;
import win.ixuni.hubstore.core.operation.file.WriteFileOperation;
import win.ixuni.hubstore.core.util.ContentUtils;
import win.ixuni.hubstore.core.util.StoragePathUtils;
import win.ixuni.hubstore.driver.github.config.GitHubDriverConfig;
import win.ixuni.hubstore.driver.github.context.GitHubDriverContext;

import java.util.EnumSet;
import java.util.Set;

/**
 * GitHub 写入文件处理器
 * <p>
 * A commit needs the whole file, so the stream is buffered in memory up to its end before the
 * single create-or-update call is made. Nothing reaches GitHub if the path is rejected or the
 * stream fails.
 */
@Slf4j
public class GitHubWriteFileHandler extends AbstractGitHubHandler<WriteFileOperation, WriteResult> {

    @Override
    protected Mono<WriteResult> doHandle(WriteFileOperation operation, GitHubDriverContext ctx) {
        if (!StoragePathUtils.isPathValid(operation.getPath())) {
            return Mono.error(new BadPathException(operation.getPath()));
        }

        GitHubDriverConfig gh = ctx.getGitHubConfig();
        String contentPath = ctx.contentPath(operation.getStorageTopLevel(), operation.getPath());
        String readUrl = ctx.readUrl(contentPath);

        log.debug("Writing {} to {}/{}@{} (declared {} bytes, {})", contentPath, gh.getOwner(), gh.getRepo(),
                gh.getRef(), operation.getContentLength(), operation.getContentType());

        return ContentUtils.collect(operation.getContent(), gh.getMaxContentLength(), contentPath, ctx.getBucket())
                .doOnError(StreamReadException.class,
                        e -> log.error("failed to store {} using GitHub driver", contentPath))
                .flatMap(data -> ctx.getClient()
                        .createOrUpdateFile(gh.getOwner(), gh.getRepo(), contentPath, gh.getRef(),
                                gh.getCommitMessage(), ctx.committer(), data)
                        .map(commit -> {
                            log.debug("stored {} with commit {}", contentPath, commit.getCommitSha());
                            return WriteResult.builder()
                                    .url(readUrl)
                                    .contentPath(contentPath)
                                    .size(data.length)
                                    .revision(commit.getCommitSha())
                                    .build();
                        }));
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
