package com.libragraph.attest.core.manifest;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Named;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@ApplicationScoped
public class FingerprintExecutorProducer {

    @ConfigProperty(name = "attest.fingerprint.worker-count", defaultValue = "4")
    int workerCount;

    private ExecutorService executor;

    @Produces
    @ApplicationScoped
    @Named("fingerprintExecutor")
    public ExecutorService fingerprintExecutor() {
        if (workerCount < 1) {
            throw new IllegalArgumentException("attest.fingerprint.worker-count must be positive: " + workerCount);
        }
        executor = Executors.newFixedThreadPool(workerCount, threadFactory());
        return executor;
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) executor.shutdown();
    }

    static ThreadFactory threadFactory() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "attest-fingerprint-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
