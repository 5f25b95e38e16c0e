package win.ixuni.hubstore.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * HubStore main configuration
 * <p>
 * 每个 bucket 对应一个驱动配置，由 hub 启动时加载。
 */
@Data
@ConfigurationProperties(prefix = "hubstore")
public class HubStoreProperties {

    /**
     * Driver configurations, one per bucket
     */
    private List<DriverConfig> drivers = new ArrayList<>();
}
