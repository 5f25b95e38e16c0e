package win.ixuni.hubstore.driver.memory.context;

import lombok.Builder;
import lombok.Getter;
import win.ixuni.hubstore.core.config.DriverConfig;
import win.ixuni.hubstore.core.operation.DriverContext;
import win.ixuni.hubstore.driver.memory.MemoryDriverFactory;

import java.time.Instant;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Memory 驱动上下文
 * <p>
 * 提供内存存储的共享数据结构
 */
@Getter
@Builder
public class MemoryDriverContext implements DriverContext {

    private final DriverConfig config;

    private final String readUrlPrefix;

    /**
     * Largest number of entries returned by one listing
     */
    private final int pageSize;

    /**
     * 文件存储：contentPath -> FileData, sorted by path
     */
    @Builder.Default
    private final NavigableMap<String, FileData> files = new ConcurrentSkipListMap<>();

    @Override
    public DriverConfig getConfig() {
        return config;
    }

    @Override
    public String getDriverName() {
        return config.getName();
    }

    @Override
    public String getDriverType() {
        return MemoryDriverFactory.DRIVER_TYPE;
    }

    // ============ Data Structure Definitions ============

    @Getter
    @Builder
    public static class FileData {
        private final String contentPath;
        private final byte[] data;
        private final String contentType;
        private final Instant lastModified;
    }
}
