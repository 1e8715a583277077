package com.modelgateway.service;

import com.modelgateway.config.GatewayProperties;
import com.modelgateway.service.queue.QueuedRequest;
import com.modelgateway.service.queue.RequestQueue;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of worker threads draining the request queue. Each worker serves
 * one request at a time and blocks only on the provider call.
 */
@Slf4j
@Component
public class GatewayWorkerPool {

    private static final long TERMINATION_TIMEOUT_SECONDS = 10;

    private final RequestQueue queue;
    private final ModelGateway gateway;
    private final GatewayProperties.WorkerConfig config;

    private final AtomicBoolean running = new AtomicBoolean();
    private ExecutorService workers;

    public GatewayWorkerPool(RequestQueue queue, ModelGateway gateway, GatewayProperties properties) {
        this.queue = queue;
        this.gateway = gateway;
        this.config = properties.getWorkers();
    }

    @PostConstruct
    void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger counter = new AtomicInteger();
        workers = Executors.newFixedThreadPool(config.getPoolSize(), r -> {
            Thread t = new Thread(r, "gateway-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < config.getPoolSize(); i++) {
            workers.submit(this::runWorker);
        }
        log.info("Started {} gateway workers", config.getPoolSize());
    }

    @PreDestroy
    void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Gateway workers did not stop within {}s", TERMINATION_TIMEOUT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Stopped gateway workers");
    }

    public boolean isRunning() {
        return running.get();
    }

    private void runWorker() {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                QueuedRequest item = queue.poll(config.getPollTimeout());
                if (item != null) {
                    gateway.process(item);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("Unexpected error in gateway worker", e);
            }
        }
    }
}
