package win.ixuni.hubstore.driver.github;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.codec.DecodingException;
import org.springframework.core.io.buffer.DataBufferLimitException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.driver.DriverCapabilities.Capability;
import win.ixuni.hubstore.core.exception.AuthenticationSetupException;
import win.ixuni.hubstore.core.exception.BadPathException;
import win.ixuni.hubstore.core.exception.MissingCredentialException;
import win.ixuni.hubstore.core.exception.RemoteListException;
import win.ixuni.hubstore.core.exception.RemoteWriteException;
import win.ixuni.hubstore.core.exception.StreamReadException;
import win.ixuni.hubstore.core.model.ListFilesResult;
import win.ixuni.hubstore.driver.github.client.FakeGitHubContentsClient;
import win.ixuni.hubstore.driver.github.client.GitHubApiException;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GitHubStorageDriverTest {

    private static final String PREFIX = "https://raw.githubusercontent.com/acme/site/main/";

    private FakeGitHubContentsClient client;
    private GitHubStorageDriver driver;

    private static DriverConfig config() {
        DriverConfig config = new DriverConfig();
        config.setName("github-test");
        config.setType(GitHubDriverFactory.DRIVER_TYPE);
        config.setBucket("hub");
        config.getProperties().put("authtype", "token");
        config.getProperties().put("token", "secret");
        config.getProperties().put("owner", "acme");
        config.getProperties().put("repo", "site");
        config.getProperties().put("ref", "main");
        return config;
    }

    private static Flux<ByteBuffer> content(String text) {
        return Flux.just(ByteBuffer.wrap(text.getBytes(StandardCharsets.UTF_8)));
    }

    @BeforeEach
    void setUp() {
        client = new FakeGitHubContentsClient();
        driver = new GitHubStorageDriver(config(), gh -> client);
    }

    @Test
    @DisplayName("Read URL prefix is the raw content URL of owner, repo and ref")
    void readUrlPrefix() {
        assertEquals(PREFIX, driver.getReadUrlPrefix());
        assertEquals(driver.getReadUrlPrefix(), driver.getReadUrlPrefix());
        assertEquals(0, client.calls());
    }

    @Test
    @DisplayName("Default ref is used in the prefix when none is configured")
    void readUrlPrefixDefaultRef() {
        DriverConfig config = config();
        config.getProperties().remove("ref");

        GitHubStorageDriver masterDriver = new GitHubStorageDriver(config, gh -> client);

        assertEquals("https://raw.githubusercontent.com/acme/site/master/", masterDriver.getReadUrlPrefix());
    }

    @Test
    @DisplayName("Write commits the whole content once and returns prefix + top/path")
    void write() {
        String url = driver.performWrite("foo.txt", "store1",
                Flux.just(ByteBuffer.wrap("hello ".getBytes(StandardCharsets.UTF_8)),
                        ByteBuffer.wrap("world".getBytes(StandardCharsets.UTF_8))),
                11, "text/plain").block();

        assertEquals(PREFIX + "store1/foo.txt", url);
        assertEquals(List.of("store1/foo.txt"), client.writtenPaths);
        assertEquals(List.of("main"), client.refs);
        assertEquals("hello world", new String(client.files.get("store1/foo.txt"), StandardCharsets.UTF_8));
        assertEquals("gaia", client.lastCommitter.getName());
        assertEquals("someone@somewhere", client.lastCommitter.getEmail());
        assertEquals("hub storage write", client.lastMessage);
    }

    @Test
    @DisplayName("Nested paths and empty content are written as-is")
    void writeNestedEmpty() {
        String url = driver.performWrite("a/b/c.json", "store1", Flux.empty(), 0, "application/json").block();

        assertEquals(PREFIX + "store1/a/b/c.json", url);
        assertEquals(0, client.files.get("store1/a/b/c.json").length);
    }

    @Test
    @DisplayName("Writes ignore the configured root path")
    void writeIgnoresRootPath() {
        DriverConfig config = config();
        config.getProperties().put("path", "/hub-data/");
        GitHubStorageDriver rooted = new GitHubStorageDriver(config, gh -> client);

        String url = rooted.performWrite("foo.txt", "store1", content("x"), 1, "text/plain").block();

        assertEquals(PREFIX + "store1/foo.txt", url);
        assertEquals(List.of("store1/foo.txt"), client.writtenPaths);
    }

    @Test
    @DisplayName("Paths containing '..' fail before any backend call")
    void badPath() {
        Mono<String> write = driver.performWrite("../etc/passwd", "store1", content("x"), 1, "text/plain");

        BadPathException e = assertThrows(BadPathException.class, write::block);

        assertEquals("BadPath", e.getErrorCode());
        assertEquals(0, client.calls());
    }

    @Test
    @DisplayName("Stream failures fail the write before any backend call")
    void streamError() {
        Flux<ByteBuffer> broken = Flux.concat(content("partial"), Flux.error(new IOException("client went away")));

        StreamReadException e = assertThrows(StreamReadException.class,
                () -> driver.performWrite("foo.txt", "store1", broken, 100, "text/plain").block());

        assertEquals("store1/foo.txt", e.getContentPath());
        assertEquals("hub", e.getBucket());
        assertEquals(0, client.calls());
    }

    @Test
    @DisplayName("Backend rejection of a write becomes RemoteWriteException with the backend message")
    void remoteWriteFailure() {
        client.failure = new GitHubApiException(409, "{\"message\":\"is at abc but expected def\"}");

        RemoteWriteException e = assertThrows(RemoteWriteException.class,
                () -> driver.performWrite("foo.txt", "store1", content("x"), 1, "text/plain").block());

        assertEquals(409, e.getHttpStatus());
        assertEquals("is at abc but expected def", e.getDiagnostic());
        assertTrue(e.getMessage().contains("store1/foo.txt"));
        assertEquals(1, client.writtenPaths.size());
    }

    @Test
    @DisplayName("Rejected credentials surface as AuthenticationSetupException")
    void unauthorized() {
        client.failure = new GitHubApiException(401, "{\"message\":\"Bad credentials\"}");

        AuthenticationSetupException e = assertThrows(AuthenticationSetupException.class,
                () -> driver.listFiles("store1", null).block());

        assertTrue(e.getMessage().contains("Bad credentials"));
    }

    @Test
    @DisplayName("List returns entry names and never a continuation token")
    void list() {
        client.listing = List.of("a.txt", "b.txt");

        ListFilesResult result = driver.listFiles("store1", null).block();

        assertEquals(List.of("a.txt", "b.txt"), result.getEntries());
        assertNull(result.getPage());
        assertEquals(List.of("store1"), client.listedPaths);
        assertEquals(List.of("main"), client.refs);
    }

    @Test
    @DisplayName("Continuation tokens are ignored")
    void listIgnoresPage() {
        client.listing = List.of("a.txt");

        ListFilesResult result = driver.listFiles("store1", "some-token").block();

        assertEquals(List.of("a.txt"), result.getEntries());
        assertNull(result.getPage());
    }

    @Test
    @DisplayName("Listing path is the configured root path joined with the top level")
    void listUnderRootPath() {
        DriverConfig config = config();
        config.getProperties().put("path", "/hub-data/");
        GitHubStorageDriver rooted = new GitHubStorageDriver(config, gh -> client);

        rooted.listFiles("store1", null).block();

        assertEquals(List.of("hub-data/store1"), client.listedPaths);
    }

    @Test
    @DisplayName("An empty directory lists as no entries")
    void listEmpty() {
        ListFilesResult result = driver.listFiles("store1", null).block();

        assertTrue(result.getEntries().isEmpty());
        assertNull(result.getPage());
    }

    @Test
    @DisplayName("Backend failure of a listing becomes RemoteListException")
    void remoteListFailure() {
        client.failure = new GitHubApiException(404, "{\"message\":\"Not Found\"}");

        RemoteListException e = assertThrows(RemoteListException.class,
                () -> driver.listFiles("store1", null).block());

        assertEquals(404, e.getHttpStatus());
        assertEquals("Not Found", e.getDiagnostic());
    }

    @Test
    @DisplayName("A success response that cannot be decoded fails the listing as RemoteListException")
    void undecodableListing() {
        client.failure = new DecodingException("JSON decoding error: Unexpected character ('<')");

        RemoteListException e = assertThrows(RemoteListException.class,
                () -> driver.listFiles("store1", null).block());

        assertEquals(502, e.getHttpStatus());
        assertInstanceOf(DecodingException.class, e.getCause());
    }

    @Test
    @DisplayName("A response over the buffer limit fails the write as RemoteWriteException")
    void oversizedWriteResponse() {
        client.failure = new DataBufferLimitException("Exceeded limit on max bytes to buffer : 262144");

        RemoteWriteException e = assertThrows(RemoteWriteException.class,
                () -> driver.performWrite("foo.txt", "store1", content("x"), 1, "text/plain").block());

        assertEquals(502, e.getHttpStatus());
        assertTrue(e.getMessage().contains("store1/foo.txt"));
    }

    @Test
    @DisplayName("Client construction failures become AuthenticationSetupException")
    void clientSetupFailure() {
        AuthenticationSetupException e = assertThrows(AuthenticationSetupException.class,
                () -> new GitHubStorageDriver(config(), gh -> {
                    throw new IllegalStateException("no route");
                }));

        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    @DisplayName("Malformed base URL fails while building the real client")
    void malformedBaseUrl() {
        DriverConfig config = config();
        config.getProperties().put("baseurl", "ht tp://bad");

        assertThrows(AuthenticationSetupException.class, () -> new GitHubStorageDriver(config));
    }

    @Test
    @DisplayName("Configuration errors abort construction before the client is built")
    void configurationErrors() {
        DriverConfig config = config();
        config.getProperties().put("token", "");

        assertThrows(MissingCredentialException.class, () -> new GitHubStorageDriver(config, gh -> {
            throw new AssertionError("client must not be built");
        }));
    }

    @Test
    void capabilities() {
        assertEquals(Set.of(Capability.WRITE, Capability.LIST), driver.getCapabilities());
        assertFalse(driver.supports(Capability.LIST_PAGINATION));
        assertEquals("github", driver.getDriverType());
        assertEquals("github-test", driver.getDriverName());
    }
}
