package org.epistula.backup.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Threads that pump the standard streams of the PostgreSQL client processes.
 * Every running tool needs up to three of them, so the pool grows on demand instead of queueing.
 */
@ApplicationScoped
public class AsyncOperations {

    @ConfigProperty(name = "epistula.backups.tool-io.max-threads", defaultValue = "32")
    int toolIoMaxThreads = 32;

    private ThreadPoolExecutor toolIoExecutor;

    @PostConstruct
    void initPools() {
        toolIoExecutor = new ThreadPoolExecutor(
                0,
                toolIoMaxThreads,
                60L, TimeUnit.SECONDS,
                new SynchronousQueue<>(), new NamedThreadFactory("pg-tool-io-"));
    }

    @PreDestroy
    void shutdown() {
        if (toolIoExecutor != null) {
            toolIoExecutor.shutdownNow();
        }
    }

    public ExecutorService getToolIoPool() {
        return toolIoExecutor;
    }

    static class NamedThreadFactory implements ThreadFactory {
        private final ThreadFactory defaultWrapped = Executors.defaultThreadFactory();
        private final String namePrefix;

        NamedThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable run) {
            Thread thread = defaultWrapped.newThread(run);
            thread.setName(namePrefix + thread.getName());
            thread.setDaemon(true);
            return thread;
        }
    }
}
