package fieldbus.monitor;

import fieldbus.monitor.configuration.DevicesConfiguration;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.cache.annotation.EnableCaching;

@SpringBootApplication
@EnableCaching
@EnableConfigurationProperties(DevicesConfiguration.class)
public class FieldbusMonitor {
    public static void main(String[] args) {
        SpringApplication.run(FieldbusMonitor.class, args);
    }
}
