package com.demoBank.ussdPay.engine.loop;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Pending callbacks keyed by category.
 *
 * Scheduling into a category cancels whatever was pending there, so a superseded
 * callback can never act on newer state. Only used from the loop thread.
 */
public class TimerSlots {

    private final EventLoop loop;
    private final Map<TimerCategory, TimerHandle> pending = new EnumMap<>(TimerCategory.class);

    public TimerSlots(EventLoop loop) {
        this.loop = loop;
    }

    /**
     * Replaces the pending callback of a category.
     *
     * @param category slot to fill
     * @param task callback to run
     * @param delay delay before the callback runs
     */
    public void replace(TimerCategory category, Runnable task, Duration delay) {
        cancel(category);
        TimerHandle[] self = new TimerHandle[1];
        TimerHandle handle = loop.schedule(() -> {
            // Free the slot before running so the task may schedule into it again.
            if (pending.get(category) == self[0]) {
                pending.remove(category);
            }
            task.run();
        }, delay);
        self[0] = handle;
        pending.put(category, handle);
    }

    public void cancel(TimerCategory category) {
        TimerHandle handle = pending.remove(category);
        if (handle != null) {
            handle.cancel();
        }
    }

    public void cancelAll() {
        pending.values().forEach(TimerHandle::cancel);
        pending.clear();
    }

    public boolean isPending(TimerCategory category) {
        TimerHandle handle = pending.get(category);
        return handle != null && !handle.isCancelled();
    }
}
