package com.example.chat.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class TaskConfig {

    /**
     * Runs inbound command processing. Each connection's frames are serialized with
     * concatMap, so this pool only bounds how many connections make progress at once.
     * Commands touch JDBC, hence a bounded elastic pool instead of the event loop.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler routerScheduler() {
        int threadCap = Math.max(10, Runtime.getRuntime().availableProcessors() * 4);
        int queuedTaskCap = 100000;
        return Schedulers.newBoundedElastic(threadCap, queuedTaskCap, "chat-router-");
    }

    /**
     * Read-side history queries issued from the HTTP controllers.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler jdbcScheduler() {
        int parallelism = 10;
        return Schedulers.newParallel("jdbc-io-", parallelism);
    }
}
