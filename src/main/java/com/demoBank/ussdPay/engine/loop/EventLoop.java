package com.demoBank.ussdPay.engine.loop;

import java.time.Duration;

/**
 * Single logical thread on which all engine work runs.
 *
 * Snapshot events and timer callbacks are serialized onto the loop, so engine
 * state is only ever written from one thread. Waiting is expressed as a
 * delayed callback, never as a blocking call.
 */
public interface EventLoop {

    /**
     * Queues a task to run on the loop.
     */
    void execute(Runnable task);

    /**
     * Runs a task on the loop and returns once it has completed.
     * Runs inline when already called from the loop.
     *
     * Runtime exceptions thrown by the task reach the caller unchanged.
     *
     * @throws EventLoopException if the loop could not run the task
     */
    void executeAndWait(Runnable task);

    /**
     * Schedules a task to run on the loop after the given delay.
     *
     * @return handle that turns the task into a no-op when cancelled
     */
    TimerHandle schedule(Runnable task, Duration delay);

    /**
     * Current time of the loop's clock in epoch milliseconds.
     */
    long currentTimeMillis();
}
