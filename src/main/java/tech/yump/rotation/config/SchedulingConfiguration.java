package tech.yump.rotation.config;

import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.spring.annotation.EnableSchedulerLock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import tech.yump.rotation.engine.StaggerPlanner;
import tech.yump.rotation.storage.StorageBackend;
import tech.yump.rotation.storage.StorageLockProvider;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * Clock, worker pools and the leader lock used by the scheduled engine tasks.
 */
@Configuration
@Slf4j
public class SchedulingConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StaggerPlanner staggerPlanner() {
        return new StaggerPlanner(new SecureRandom());
    }

    @Bean(name = "rotationExecutor")
    public ThreadPoolTaskExecutor rotationExecutor(RotationProperties properties) {
        int workers = properties.engine().maxConcurrentRotations();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("rotation-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        log.info("Rotation worker pool configured with {} worker(s)", workers);
        return executor;
    }

    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("notify-");
        return executor;
    }

    /**
     * ShedLock records live in the engine's storage backend, so a restarted or second instance
     * sees the same lock.
     */
    @Bean
    public LockProvider lockProvider(StorageBackend storage) {
        return new StorageLockProvider(storage);
    }

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @EnableSchedulerLock(defaultLockAtMostFor = "PT5M")
    @ConditionalOnProperty(name = "rotation.scheduler.enabled", havingValue = "true", matchIfMissing = true)
    static class ScheduledTasksConfiguration {
    }
}
