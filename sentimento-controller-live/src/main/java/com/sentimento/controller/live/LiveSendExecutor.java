package com.sentimento.controller.live;

import com.sentimento.service.core.config.SentimentoProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

/**
 * Shared worker pool that starts asynchronous frame writes. Tasks only hand a frame to the container
 * and return, so a stalled subscriber never occupies a worker.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LiveSendExecutor implements Executor {

    private final SentimentoProperties properties;

    private ExecutorService executor;

    @PostConstruct
    void start() {
        init(properties.getHub().getSendWorkers());
    }

    void init(int workers) {
        CustomizableThreadFactory threads = new CustomizableThreadFactory("live-send-");
        threads.setDaemon(true);
        executor = Executors.newFixedThreadPool(workers, threads);
        log.info("Live send executor started workers={}", workers);
    }

    @PreDestroy
    void stop() {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Live send executor did not drain in time; forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    /** @throws java.util.concurrent.RejectedExecutionException once the executor is shut down */
    @Override
    public void execute(Runnable task) {
        executor.execute(task);
    }
}
