package com.company.podwatch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Threads and shared infrastructure beans of the poll loop
 */
@Configuration
@Slf4j
public class SchedulingConfig {

    /**
     * Runs the poll trigger and the retention cron
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("podwatch-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    /**
     * {@code @Async} event listeners (cache eviction)
     */
    @Bean
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("podwatch-async-");
        return executor;
    }

    @Bean(name = "deliveryExecutor", destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor(@Value("${podwatch.channels.delivery-threads:4}") int threads) {
        return Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("podwatch-delivery-"));
    }

    @Bean(name = "inventoryExecutor", destroyMethod = "shutdown")
    public ExecutorService inventoryExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("podwatch-inventory-"));
    }

    /**
     * Alerting windows are evaluated in this zone
     */
    @Bean
    public Clock clock(@Value("${podwatch.time-zone:UTC}") String timeZone) {
        ZoneId zone = ZoneId.of(timeZone);
        log.info("Alerting windows evaluated in time zone {}", zone);
        return Clock.system(zone);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
