package com.example.sessionrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class RelayConfig {

    @Bean
    public HttpClient upstreamHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /**
     * Fires delegated-call deadlines. Expiry work is a map removal plus a future completion, so one thread is enough.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService deadlineScheduler() {
        AtomicInteger n = new AtomicInteger();
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "relay-deadline-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Runs {@code @Scheduled} work such as the liveness sweep, which may block on a slow socket. Kept apart from
     * {@link #deadlineScheduler()} so such a stall never delays deadline expiry.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("relay-sweep-");
        scheduler.setDaemon(true);
        return scheduler;
    }
}
