package com.demoBank.ussdPay.engine.loop;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Event loop backed by a single-threaded scheduled executor.
 */
@Slf4j
public class ScheduledEventLoop implements EventLoop {

    private static final long WAIT_TIMEOUT_SECONDS = 10;

    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public ScheduledEventLoop(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public void executeAndWait(Runnable task) {
        if (Thread.currentThread() == loopThread) {
            task.run();
            return;
        }
        Future<?> future = executor.submit(task);
        try {
            future.get(WAIT_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventLoopException("Interrupted while waiting for event loop", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new EventLoopException("Event loop task failed", e.getCause());
        } catch (TimeoutException e) {
            throw new EventLoopException("Timed out waiting for event loop", e);
        }
    }

    @Override
    public TimerHandle schedule(Runnable task, Duration delay) {
        AtomicBoolean cancelled = new AtomicBoolean();
        ScheduledFuture<?> future = executor.schedule(() -> {
            if (!cancelled.get()) {
                guarded(task).run();
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
        return new TimerHandle() {
            @Override
            public void cancel() {
                cancelled.set(true);
                future.cancel(false);
            }

            @Override
            public boolean isCancelled() {
                return cancelled.get();
            }
        };
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    public void shutdown() {
        log.info("Shutting down USSD event loop");
        executor.shutdownNow();
    }

    private Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                // The executor would otherwise bury this in a future nobody reads.
                log.error("Unhandled error on USSD event loop", e);
            }
        };
    }
}
