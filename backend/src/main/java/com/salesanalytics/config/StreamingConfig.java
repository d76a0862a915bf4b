package com.salesanalytics.config;

import com.salesanalytics.streaming.StreamingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler and clock shared by the sentiment streams and the corpus refresh.
 *
 * One small pool drives the sampling loops of all calls; a tick only holds a
 * thread while it samples and broadcasts.
 */
@Configuration
@EnableScheduling
@EnableConfigurationProperties(StreamingProperties.class)
@Slf4j
public class StreamingConfig {

    @Bean(name = "streamScheduler")
    public ThreadPoolTaskScheduler streamScheduler(StreamingProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("sentiment-stream-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        log.info("Configured stream scheduler: poolSize={}, tickInterval={}",
                properties.getSchedulerPoolSize(), properties.getTickInterval());
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
