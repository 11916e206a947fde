package com.demoBank.ussdPay.engine.injection;

import com.demoBank.ussdPay.device.InputActuator;
import com.demoBank.ussdPay.device.SnapshotSource;
import com.demoBank.ussdPay.device.model.ScreenNode;
import com.demoBank.ussdPay.engine.EngineState;
import com.demoBank.ussdPay.engine.EngineTimings;
import com.demoBank.ussdPay.engine.loop.EventLoop;
import com.demoBank.ussdPay.engine.loop.TimerCategory;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Response injector - types a decided answer into the dialog and submits it.
 *
 * The submission lock ({@link EngineState#isSubmitting()}) is taken by the caller and
 * held until the post-send cooldown ends. Every failure path releases it and leaves
 * the session running so the next turn can still be answered.
 *
 * Timeline for a focused input field: inject text, wait the injection delay, press
 * the submit control, wait the cooldown, release the lock.
 */
@Slf4j
public class ResponseInjector {

    public static final List<String> SUBMIT_LABELS = List.of("Send", "Reply", "OK", "Submit", "Confirm");

    public static final List<String> ACKNOWLEDGE_LABELS = List.of("OK", "Dismiss", "Close");

    public static final List<String> DISMISS_LABELS = List.of("Cancel", "OK", "Close", "Dismiss", "Done");

    private final SnapshotSource snapshotSource;
    private final InputActuator actuator;
    private final EventLoop loop;
    private final EngineTimings timings;

    public ResponseInjector(SnapshotSource snapshotSource, InputActuator actuator, EventLoop loop, EngineTimings timings) {
        this.snapshotSource = snapshotSource;
        this.actuator = actuator;
        this.loop = loop;
        this.timings = timings;
    }

    /**
     * Starts answering a turn. Must run on the loop with the submission lock held.
     *
     * @param state       engine state
     * @param response    text to send
     * @param fingerprint fingerprint of the turn being answered
     */
    public void inject(EngineState state, String response, int fingerprint) {
        try {
            ScreenNode snapshot = snapshotSource.currentSnapshot();
            if (snapshot == null) {
                log.warn("No snapshot available, dropping response");
                release(state);
                return;
            }
            Optional<ScreenNode> inputField = actuator.findInputField(snapshot);
            if (inputField.isEmpty()) {
                acknowledge(state, snapshot);
                return;
            }
            if (!inputField.get().isFocused()) {
                log.debug("Input field not focused, requesting focus");
                actuator.requestFocus(inputField.get());
                state.getTimers().replace(TimerCategory.FOCUS_RETRY,
                        () -> injectText(state, response, fingerprint), timings.focusRetry());
                return;
            }
            injectText(state, response, fingerprint);
        } catch (RuntimeException e) {
            log.error("Failed to inject response", e);
            release(state);
        }
    }

    /**
     * Closes the dialog of a finished session. Best effort; failures are only logged.
     */
    public void dismissDialog() {
        try {
            ScreenNode snapshot = snapshotSource.currentSnapshot();
            if (snapshot == null) {
                log.debug("No dialog to dismiss");
                return;
            }
            Optional<ScreenNode> button = actuator.findControlByLabel(snapshot, DISMISS_LABELS);
            if (button.isPresent()) {
                log.debug("Dismissing USSD dialog");
                actuator.activate(button.get());
            } else {
                log.debug("No dismiss button found");
            }
        } catch (RuntimeException e) {
            log.error("Failed to dismiss dialog", e);
        }
    }

    private void injectText(EngineState state, String response, int fingerprint) {
        try {
            ScreenNode snapshot = snapshotSource.currentSnapshot();
            Optional<ScreenNode> inputField = actuator.findInputField(snapshot);
            if (inputField.isEmpty()) {
                log.warn("Input field not found for text injection");
                release(state);
                return;
            }
            actuator.setText(inputField.get(), response);
            // Marked here rather than at submit so a slow submit never looks like an unanswered turn.
            state.setLastRespondedFingerprint(fingerprint);
            state.getTimers().replace(TimerCategory.SUBMIT_CLICK, () -> clickSubmit(state), timings.textInjectionDelay());
        } catch (RuntimeException e) {
            log.error("Failed to inject text", e);
            release(state);
        }
    }

    private void clickSubmit(EngineState state) {
        try {
            ScreenNode snapshot = snapshotSource.currentSnapshot();
            Optional<ScreenNode> sendButton = actuator.findControlByLabel(snapshot, SUBMIT_LABELS);
            if (sendButton.isPresent()) {
                actuator.activate(sendButton.get());
                state.setLastSubmitTimestamp(loop.currentTimeMillis());
                log.debug("Submitted response");
            } else {
                log.warn("Submit control not found");
            }
        } catch (RuntimeException e) {
            log.error("Failed to press submit", e);
        }
        startCooldown(state);
    }

    private void acknowledge(EngineState state, ScreenNode snapshot) {
        Optional<ScreenNode> okButton = actuator.findControlByLabel(snapshot, ACKNOWLEDGE_LABELS);
        if (okButton.isPresent()) {
            log.debug("No input field, acknowledging dialog");
            actuator.activate(okButton.get());
            state.setLastSubmitTimestamp(loop.currentTimeMillis());
        }
        startCooldown(state);
    }

    private void startCooldown(EngineState state) {
        state.getTimers().replace(TimerCategory.SUBMIT_COOLDOWN, () -> release(state), timings.postSendCooldown());
    }

    private void release(EngineState state) {
        state.setSubmitting(false);
        log.debug("Submission lock released");
    }
}
