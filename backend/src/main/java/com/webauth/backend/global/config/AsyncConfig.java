package com.webauth.backend.global.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncConfig {

    public static final String EVENT_STREAM_EXECUTOR = "eventStreamExecutor";

    private static final int CORE_STREAM_THREADS = 2;

    /**
     * One thread per open event stream, each draining its subscriber queue into the response.
     * Streams beyond {@code webauth.sse.max-streams} are rejected.
     */
    @Bean(name = EVENT_STREAM_EXECUTOR)
    public ThreadPoolTaskExecutor eventStreamExecutor(WebAuthProperties properties) {
        int maxStreams = properties.sse().maxStreams();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setThreadNamePrefix("event-stream-");
        executor.setCorePoolSize(Math.min(CORE_STREAM_THREADS, maxStreams));
        executor.setMaxPoolSize(maxStreams);
        executor.setQueueCapacity(0);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
