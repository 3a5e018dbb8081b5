package com.example.tagsync.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool for batch sync tasks.
 *
 * Shared by all running batches. A batch only submits an item once it holds one of its slots,
 * so each batch occupies at most its maxConcurrent threads here and the pool is sized for
 * several batches side by side. Tasks block on the adaptive delay and provider I/O.
 * MDC (traceId, batchId) is copied into every task.
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Value("${app.executor.sync-pool-size:16}")
    private int syncPoolSize;

    @Bean(name = "syncTaskExecutor", destroyMethod = "shutdown")
    public ExecutorService syncTaskExecutor() {
        int size = Math.max(1, syncPoolSize);
        log.info("Creating sync task executor with {} threads and MDC propagation", size);
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
                size,
                size,
                60L,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("sync-worker-"));
        pool.allowCoreThreadTimeOut(true);
        return new MdcPropagatingExecutorService(pool);
    }

    /**
     * Copies the submitting thread's MDC into each task and clears it afterwards.
     */
    static final class MdcPropagatingExecutorService extends AbstractExecutorService {

        private final ExecutorService delegate;

        MdcPropagatingExecutorService(ExecutorService delegate) {
            this.delegate = delegate;
        }

        static Runnable wrap(Runnable task) {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    task.run();
                } finally {
                    MDC.clear();
                }
            };
        }

        static <T> Callable<T> wrap(Callable<T> task) {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    return task.call();
                } finally {
                    MDC.clear();
                }
            };
        }

        private static <T> List<Callable<T>> wrapAll(Collection<? extends Callable<T>> tasks) {
            return tasks.stream().<Callable<T>>map(MdcPropagatingExecutorService::wrap).toList();
        }

        @Override
        public void execute(Runnable command) {
            delegate.execute(wrap(command));
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public Future<?> submit(Runnable task) {
            return delegate.submit(wrap(task));
        }

        @Override
        public <T> Future<T> submit(Runnable task, T result) {
            return delegate.submit(wrap(task), result);
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks) throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks));
        }

        @Override
        public <T> List<Future<T>> invokeAll(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                throws InterruptedException {
            return delegate.invokeAll(wrapAll(tasks), timeout, unit);
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks)
                throws InterruptedException, ExecutionException {
            return delegate.invokeAny(wrapAll(tasks));
        }

        @Override
        public <T> T invokeAny(Collection<? extends Callable<T>> tasks, long timeout, TimeUnit unit)
                throws InterruptedException, ExecutionException, TimeoutException {
            return delegate.invokeAny(wrapAll(tasks), timeout, unit);
        }

        @Override
        public void shutdown() { delegate.shutdown(); }
        @Override
        public List<Runnable> shutdownNow() { return delegate.shutdownNow(); }
        @Override
        public boolean isShutdown() { return delegate.isShutdown(); }
        @Override
        public boolean isTerminated() { return delegate.isTerminated(); }
        @Override
        public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
            return delegate.awaitTermination(timeout, unit);
        }
    }

    private static final class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger index = new AtomicInteger(1);
        private final String prefix;

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, prefix + index.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }
    }
}
