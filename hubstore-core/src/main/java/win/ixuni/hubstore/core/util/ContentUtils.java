package win.ixuni.hubstore.core.util;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import win.ixuni.hubstore.core.exception.StreamReadException;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * Upload content helpers
 */
public final class ContentUtils {

    private ContentUtils() {
    }

    /**
     * Drain a content stream into memory
     * <p>
     * Buffers are requested one at a time, so a slow producer is never overrun. The resulting Mono
     * only emits once the stream completed; any upstream error, or more than {@code maxBytes}
     * of content, is signalled as {@link StreamReadException}.
     *
     * @param content     content stream, null is treated as empty
     * @param maxBytes    upper bound of the buffered size, non-positive for no limit
     * @param contentPath content path, for diagnostics
     * @param bucket      bucket, for diagnostics
     * @return the full content
     */
    public static Mono<byte[]> collect(Flux<ByteBuffer> content, long maxBytes, String contentPath, String bucket) {
        Flux<ByteBuffer> source = content != null ? content : Flux.empty();
        return source
                .limitRate(1)
                .onErrorMap(e -> !(e instanceof StreamReadException),
                        e -> new StreamReadException(contentPath, bucket, e))
                .reduceWith(ByteArrayOutputStream::new, (baos, buffer) -> {
                    byte[] bytes = new byte[buffer.remaining()];
                    buffer.get(bytes);
                    baos.write(bytes, 0, bytes.length);
                    if (maxBytes > 0 && baos.size() > maxBytes) {
                        throw new StreamReadException(contentPath, bucket,
                                "content exceeds the maximum size of " + maxBytes + " bytes");
                    }
                    return baos;
                })
                .map(ByteArrayOutputStream::toByteArray);
    }
}
