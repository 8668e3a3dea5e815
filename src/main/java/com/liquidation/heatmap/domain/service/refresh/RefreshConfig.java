package com.liquidation.heatmap.domain.service.refresh;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
public class RefreshConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenBucketRateLimiter upstreamRateLimiter(RefreshProperties properties) {
        log.info("[Refresh] 업스트림 rate limit 설정: {}/s, burst={}",
                properties.getRateLimitPerSecond(), properties.getRateLimitBurst());
        return new TokenBucketRateLimiter(properties.getRateLimitPerSecond(), properties.getRateLimitBurst());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService upstreamCallExecutor(RefreshProperties properties) {
        return Executors.newFixedThreadPool(properties.getIoThreads(), namedThreadFactory("heatmap-io"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService batchSignalExecutor(RefreshProperties properties) {
        return Executors.newFixedThreadPool(properties.getBatchThreads(), namedThreadFactory("heatmap-batch"));
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
