package com.demoBank.ussdPay.engine;

import java.time.Duration;

/**
 * Delays used by the automation engine.
 *
 * @param eventDebounce     events closer than this to the previous accepted event are dropped
 * @param dialogStabilize   settle time before a new turn is acted on
 * @param textInjectionDelay wait between injecting text and pressing the submit control
 * @param postSendCooldown  submission lock hold time after pressing submit
 * @param minSendInterval   minimum spacing between two submissions
 * @param focusRetry        wait after requesting input focus before injecting
 * @param dismissDelay      wait before closing the dialog of a successful session
 * @param sessionTimeout    idle time without a new turn after which the session fails
 */
public record EngineTimings(
        Duration eventDebounce,
        Duration dialogStabilize,
        Duration textInjectionDelay,
        Duration postSendCooldown,
        Duration minSendInterval,
        Duration focusRetry,
        Duration dismissDelay,
        Duration sessionTimeout
) {

    public static EngineTimings defaults() {
        return new EngineTimings(
                Duration.ofMillis(100),
                Duration.ofMillis(200),
                Duration.ofMillis(300),
                Duration.ofMillis(300),
                Duration.ofMillis(300),
                Duration.ofMillis(200),
                Duration.ofMillis(500),
                Duration.ofSeconds(120));
    }
}
