package win.ixuni.hubstore.core.util;

import java.util.StringJoiner;

/**
 * Storage path utility class
 */
public final class StoragePathUtils {

    private StoragePathUtils() {
    }

    /**
     * Check a caller-supplied relative path
     * <p>
     * Only rejects the substring {@code ".."} anywhere in the path; no normalization is done.
     * This is the sole guard against escaping the top-level namespace.
     *
     * @param path relative path, null is invalid
     * @return false if the path contains "..", true otherwise
     */
    public static boolean isPathValid(String path) {
        return path != null && !path.contains("..");
    }

    /**
     * Join path segments with "/"
     * <p>
     * Empty segments and repeated slashes are dropped, so the result never starts with,
     * ends with, or contains a double slash. 例如 join("/", "store1") 返回 "store1"。
     */
    public static String join(String... segments) {
        StringJoiner joiner = new StringJoiner("/");
        for (String segment : segments) {
            if (segment == null) {
                continue;
            }
            for (String part : segment.split("/")) {
                if (!part.isEmpty()) {
                    joiner.add(part);
                }
            }
        }
        return joiner.toString();
    }

    /**
     * Append a slash unless the value already ends with one
     */
    public static String withTrailingSlash(String value) {
        return value.endsWith("/") ? value : value + "/";
    }
}
