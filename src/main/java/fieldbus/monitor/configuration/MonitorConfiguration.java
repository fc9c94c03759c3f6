package fieldbus.monitor.configuration;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MonitorConfiguration {
    @Value("${monitor.autoStart:true}")
    private Boolean autoStart;

    @Value("${monitor.maxCacheAge:5000}")
    private Long maxCacheAge;

    /* порог изменения для параметров без заданной точности */
    @Value("${monitor.changeEpsilon:0.01}")
    private Double changeEpsilon;

    @Value("${monitor.joinTimeout:30000}")
    private Long joinTimeout;

    @Value("${monitor.quietPollsBeforeSlowdown:3}")
    private Integer quietPollsBeforeSlowdown;

    @Value("${monitor.schedulerPoolSize:2}")
    private Integer schedulerPoolSize;

    public Boolean isAutoStart() {
        return autoStart;
    }

    public Long getMaxCacheAge() {
        return maxCacheAge;
    }

    public Double getChangeEpsilon() {
        return changeEpsilon;
    }

    public Long getJoinTimeout() {
        return joinTimeout;
    }

    public Integer getQuietPollsBeforeSlowdown() {
        return quietPollsBeforeSlowdown;
    }

    public Integer getSchedulerPoolSize() {
        return schedulerPoolSize;
    }
}
