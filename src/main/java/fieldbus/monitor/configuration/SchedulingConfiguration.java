package fieldbus.monitor.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Планировщик только запускает опросы по таймерам, сами опросы идут в отдельном пуле,
 * а операции ввода-вывода с таймаутом - в третьем.
 */
@Configuration
@EnableScheduling
public class SchedulingConfiguration {
    @Bean
    public ThreadPoolTaskScheduler pollScheduler(MonitorConfiguration monitorConfiguration) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(monitorConfiguration.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("poll-scheduler-");
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pollExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("device-poll-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService modbusExecutor() {
        return Executors.newCachedThreadPool(daemonThreadFactory("modbus-io-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
