package win.ixuni.hubstore.driver.github.client;

import reactor.core.publisher.Mono;
import win.ixuni.hubstore.driver.github.client.model.Committer;
import win.ixuni.hubstore.driver.github.client.model.ContentEntry;
import win.ixuni.hubstore.driver.github.client.model.FileCommit;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory contents client that records every call
 */
public class FakeGitHubContentsClient implements GitHubContentsClient {

    public final List<String> writtenPaths = new CopyOnWriteArrayList<>();
    public final List<String> listedPaths = new CopyOnWriteArrayList<>();
    public final List<String> refs = new CopyOnWriteArrayList<>();
    public final Map<String, byte[]> files = new ConcurrentHashMap<>();

    private final AtomicInteger commits = new AtomicInteger();

    public Committer lastCommitter;
    public String lastMessage;

    public List<String> listing = new ArrayList<>();
    public RuntimeException failure;

    public int calls() {
        return writtenPaths.size() + listedPaths.size();
    }

    @Override
    public Mono<FileCommit> createOrUpdateFile(String owner, String repo, String path, String branch,
                                               String message, Committer committer, byte[] content) {
        writtenPaths.add(path);
        refs.add(branch);
        lastCommitter = committer;
        lastMessage = message;
        if (failure != null) {
            return Mono.error(failure);
        }
        files.put(path, content);
        return Mono.just(FileCommit.builder()
                .commitSha("commit-" + commits.incrementAndGet())
                .path(path)
                .build());
    }

    @Override
    public Mono<List<ContentEntry>> getDirectoryContents(String owner, String repo, String path, String ref) {
        listedPaths.add(path);
        refs.add(ref);
        if (failure != null) {
            return Mono.error(failure);
        }
        List<ContentEntry> entries = new ArrayList<>();
        for (String name : listing) {
            entries.add(ContentEntry.builder().name(name).path(path + "/" + name).type("file").build());
        }
        return Mono.just(entries);
    }
}
