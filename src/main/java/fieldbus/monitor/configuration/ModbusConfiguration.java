package fieldbus.monitor.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

/**
 * Политика таймаутов и повторов по умолчанию для устройств, у которых она не задана явно
 */
@Configuration
public class ModbusConfiguration {
    @Value("${modbus.timeout:5000}")
    private Long timeout;

    @Value("${modbus.connectTimeout:10000}")
    private Long connectTimeout;

    @Value("${modbus.retries:0}")
    private Integer retries;

    @Value("${modbus.retryDelay:500}")
    private Long retryDelay;

    @Value("${modbus.tcpKeepAlive:true}")
    private Boolean tcpKeepAlive;

    public Long getTimeout() {
        return timeout;
    }

    public Long getConnectTimeout() {
        return connectTimeout;
    }

    public Integer getRetries() {
        return retries;
    }

    public Long getRetryDelay() {
        return retryDelay;
    }

    public Boolean isTcpKeepAlive() {
        return tcpKeepAlive;
    }
}
