package com.demoBank.ussdPay.engine;

import com.demoBank.ussdPay.engine.loop.EventLoop;
import com.demoBank.ussdPay.engine.loop.TimerSlots;
import com.demoBank.ussdPay.engine.session.UssdSession;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

/**
 * Dedup and timing state of one engine instance.
 *
 * Written only from the engine loop. The active session and the last answered
 * fingerprint are volatile because other threads read them.
 */
@Getter
@Setter
public class EngineState {

    private volatile UssdSession activeSession;
    private volatile Integer lastRespondedFingerprint;
    private Integer currentFingerprint;
    private long lastEventTimestamp;
    private long lastSubmitTimestamp;
    private boolean submitting;
    private boolean stabilized;

    @Setter(AccessLevel.NONE)
    private final TimerSlots timers;

    public EngineState(EventLoop loop) {
        this.timers = new TimerSlots(loop);
    }

    /**
     * Cancels every pending timer and returns dedup and timing state to its initial values.
     * The active session is left to the caller.
     */
    public void reset() {
        timers.cancelAll();
        lastRespondedFingerprint = null;
        currentFingerprint = null;
        lastEventTimestamp = 0L;
        lastSubmitTimestamp = 0L;
        submitting = false;
        stabilized = false;
    }

    public boolean hasSubmitted() {
        return lastSubmitTimestamp > 0L;
    }
}
