package win.ixuni.hubstore.core.config;

import lombok.Data;

import java.util.HashMap;
import java.util.Map;

/**
 * Driver configuration
 * <p>
 * Generic driver configuration structure. One instance describes the driver of one bucket;
 * driver-specific settings live in properties.
 */
@Data
public class DriverConfig {

    /**
     * Driver instance name (unique identifier)
     */
    private String name;

    /**
     * Driver type, used to select the factory (github, memory, local)
     */
    private String type;

    /**
     * Bucket served by this driver instance
     */
    private String bucket;

    /**
     * Whether enabled
     */
    private boolean enabled = true;

    /**
     * Driver-specific configuration
     */
    private Map<String, Object> properties = new HashMap<>();

    /**
     * Get a string configuration value
     */
    public String getString(String key, String defaultValue) {
        Object value = properties.get(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * Get an integer configuration value
     */
    public Integer getInt(String key, Integer defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return Integer.parseInt(value.toString());
    }

    /**
     * Get a long integer configuration value
     */
    public Long getLong(String key, Long defaultValue) {
        Object value = properties.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString());
    }

    /**
     * Whether no driver-specific settings were supplied
     */
    public boolean hasNoProperties() {
        return properties == null || properties.isEmpty();
    }
}
