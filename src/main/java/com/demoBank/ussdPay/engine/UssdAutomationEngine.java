package com.demoBank.ussdPay.engine;

import com.demoBank.ussdPay.device.InputActuator;
import com.demoBank.ussdPay.device.SnapshotListener;
import com.demoBank.ussdPay.device.SnapshotSource;
import com.demoBank.ussdPay.engine.cascade.ResponseDecider;
import com.demoBank.ussdPay.engine.cascade.ResponseDecision;
import com.demoBank.ussdPay.engine.classifier.ClassifiedSnapshot;
import com.demoBank.ussdPay.engine.classifier.SnapshotClassifier;
import com.demoBank.ussdPay.engine.exception.SessionBusyException;
import com.demoBank.ussdPay.engine.injection.ResponseInjector;
import com.demoBank.ussdPay.engine.loop.EventLoop;
import com.demoBank.ussdPay.engine.loop.TimerCategory;
import com.demoBank.ussdPay.engine.outcome.Outcome;
import com.demoBank.ussdPay.engine.outcome.OutcomeExtractor;
import com.demoBank.ussdPay.engine.outcome.TerminalMessageClassifier;
import com.demoBank.ussdPay.engine.session.UssdSession;
import com.demoBank.ussdPay.engine.turn.ScreenTurn;
import com.demoBank.ussdPay.engine.turn.TurnClassification;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * USSD automation engine - drives one USSD session at a time by watching the dialog
 * and answering its prompts.
 *
 * Flow per snapshot event:
 * 1. Debounce and classify the snapshot; drop anything that is not USSD content
 * 2. Fingerprint the text to tell a new turn from a repeated one
 * 3. End the session at once on an error turn; otherwise let the turn settle
 * 4. Once settled, end the session on a success turn or decide and inject an answer
 *
 * All state changes happen on the {@link EventLoop}. Public methods may be called
 * from any thread.
 */
@Slf4j
public class UssdAutomationEngine implements SnapshotListener {

    private static final int LOG_PREVIEW_LENGTH = 80;
    private static final long DEFER_PADDING_MS = 100L;

    private final EventLoop loop;
    private final SnapshotSource snapshotSource;
    private final SnapshotClassifier snapshotClassifier;
    private final TerminalMessageClassifier terminalClassifier;
    private final ResponseDecider responseDecider;
    private final OutcomeExtractor outcomeExtractor;
    private final ResponseInjector injector;
    private final EngineTimings timings;
    private final Set<String> sourcePackages;
    private final EngineState state;
    private final List<SessionEventListener> listeners = new CopyOnWriteArrayList<>();

    public UssdAutomationEngine(EventLoop loop,
                                SnapshotSource snapshotSource,
                                InputActuator actuator,
                                SnapshotClassifier snapshotClassifier,
                                TerminalMessageClassifier terminalClassifier,
                                ResponseDecider responseDecider,
                                OutcomeExtractor outcomeExtractor,
                                EngineTimings timings,
                                Set<String> sourcePackages) {
        this.loop = loop;
        this.snapshotSource = snapshotSource;
        this.snapshotClassifier = snapshotClassifier;
        this.terminalClassifier = terminalClassifier;
        this.responseDecider = responseDecider;
        this.outcomeExtractor = outcomeExtractor;
        this.timings = timings;
        this.sourcePackages = Set.copyOf(sourcePackages);
        this.state = new EngineState(loop);
        this.injector = new ResponseInjector(snapshotSource, actuator, loop, timings);
    }

    public void addListener(SessionEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Makes a session the active one. Dedup and timing state start fresh.
     *
     * @throws SessionBusyException if another session is still active
     */
    public void startSession(UssdSession session) {
        loop.executeAndWait(() -> {
            UssdSession active = state.getActiveSession();
            if (active != null) {
                throw new SessionBusyException(active.getSessionId());
            }
            state.reset();
            state.setActiveSession(session);
            armSessionTimeout(session.getSessionId());
            log.info("USSD session started - sessionId: {}, kind: {}", session.getSessionId(), session.getKind());
        });
    }

    /**
     * Cancels a session. Returns once all of its timers are cancelled and state is reset.
     *
     * @return false if the session is not the active one
     */
    public boolean cancel(String sessionId) {
        boolean[] cancelled = new boolean[1];
        loop.executeAndWait(() -> {
            UssdSession active = state.getActiveSession();
            if (active == null || !active.getSessionId().equals(sessionId)) {
                return;
            }
            state.setActiveSession(null);
            state.reset();
            cancelled[0] = true;
            log.info("USSD session cancelled - sessionId: {}, step: {}", sessionId, active.getStep());
        });
        return cancelled[0];
    }

    /**
     * Ends the active session with a failure outcome, e.g. when dialing failed.
     *
     * @return false if the session is not the active one
     */
    public boolean fail(String sessionId, String message) {
        boolean[] failed = new boolean[1];
        loop.executeAndWait(() -> {
            UssdSession active = state.getActiveSession();
            if (active == null || !active.getSessionId().equals(sessionId)) {
                return;
            }
            finish(Outcome.failure(sessionId, active.getKind(), message));
            failed[0] = true;
        });
        return failed[0];
    }

    public Optional<UssdSession> getActiveSession() {
        return Optional.ofNullable(state.getActiveSession());
    }

    @Override
    public void onSnapshotChanged(String sourceId) {
        loop.execute(() -> handleSnapshotEvent(sourceId));
    }

    EngineState state() {
        return state;
    }

    private void handleSnapshotEvent(String sourceId) {
        UssdSession session = state.getActiveSession();
        if (session == null || !isUssdSource(sourceId)) {
            return;
        }
        long now = loop.currentTimeMillis();
        if (now - state.getLastEventTimestamp() < timings.eventDebounce().toMillis()) {
            return;
        }
        state.setLastEventTimestamp(now);

        ClassifiedSnapshot snapshot;
        try {
            snapshot = snapshotClassifier.classify(snapshotSource.currentSnapshot());
        } catch (RuntimeException e) {
            log.warn("Failed to read snapshot, dropping event - sessionId: {}", session.getSessionId(), e);
            return;
        }

        ScreenTurn turn = ScreenTurn.of(snapshot.rawText(), now);
        switch (classifyTurn(snapshot, turn)) {
            case IGNORED -> {
                if (!snapshot.rawText().isEmpty()) {
                    log.debug("Skipping non-USSD content: {}", turn.preview(LOG_PREVIEW_LENGTH));
                }
            }
            case NEW_ERROR_TERMINAL -> {
                acceptNewTurn(session, turn);
                log.warn("Error turn, ending session - sessionId: {}, message: {}",
                        session.getSessionId(), turn.preview(LOG_PREVIEW_LENGTH));
                complete(session, false, turn.text());
            }
            case NEW_NON_TERMINAL -> {
                acceptNewTurn(session, turn);
                state.getTimers().replace(TimerCategory.STABILIZE, () -> onStabilized(turn), timings.dialogStabilize());
            }
            case REPEAT_NON_TERMINAL -> log.trace("Repeated turn ignored - fingerprint: {}", turn.fingerprint());
        }
    }

    private TurnClassification classifyTurn(ClassifiedSnapshot snapshot, ScreenTurn turn) {
        if (!snapshot.isActionable()) {
            return TurnClassification.IGNORED;
        }
        if (Objects.equals(turn.fingerprint(), state.getCurrentFingerprint())) {
            return TurnClassification.REPEAT_NON_TERMINAL;
        }
        return terminalClassifier.isError(turn.text())
                ? TurnClassification.NEW_ERROR_TERMINAL
                : TurnClassification.NEW_NON_TERMINAL;
    }

    private void acceptNewTurn(UssdSession session, ScreenTurn turn) {
        state.getTimers().cancel(TimerCategory.STABILIZE);
        state.setCurrentFingerprint(turn.fingerprint());
        state.setStabilized(false);
        log.debug("New turn - sessionId: {}, text: {}", session.getSessionId(), turn.preview(LOG_PREVIEW_LENGTH));
        armSessionTimeout(session.getSessionId());
        for (SessionEventListener listener : listeners) {
            try {
                listener.onTurn(session.getSessionId(), turn.text());
            } catch (RuntimeException e) {
                log.error("Turn listener failed - sessionId: {}", session.getSessionId(), e);
            }
        }
    }

    private void onStabilized(ScreenTurn turn) {
        state.setStabilized(true);
        processTurn(turn);
    }

    private void processTurn(ScreenTurn turn) {
        UssdSession session = state.getActiveSession();
        if (session == null || !Objects.equals(turn.fingerprint(), state.getCurrentFingerprint())) {
            return;
        }
        if (state.isSubmitting()) {
            log.debug("Submission in flight, deferring turn - sessionId: {}", session.getSessionId());
            deferTurn(turn, timings.minSendInterval().toMillis());
            return;
        }
        if (Objects.equals(turn.fingerprint(), state.getLastRespondedFingerprint())) {
            log.debug("Turn already answered - sessionId: {}", session.getSessionId());
            return;
        }
        long sinceLastSubmit = loop.currentTimeMillis() - state.getLastSubmitTimestamp();
        long minInterval = timings.minSendInterval().toMillis();
        if (state.hasSubmitted() && sinceLastSubmit < minInterval) {
            log.debug("Too soon since last submit ({} ms), deferring - sessionId: {}",
                    sinceLastSubmit, session.getSessionId());
            deferTurn(turn, minInterval - sinceLastSubmit + DEFER_PADDING_MS);
            return;
        }

        if (terminalClassifier.isSuccess(turn.text())) {
            complete(session, true, turn.text());
            state.getTimers().replace(TimerCategory.DISMISS, injector::dismissDialog, timings.dismissDelay());
            return;
        }

        Optional<ResponseDecision> decision = responseDecider.decide(session, turn.text());
        if (decision.isEmpty()) {
            log.debug("No answer for turn, waiting - sessionId: {}, text: {}",
                    session.getSessionId(), turn.preview(LOG_PREVIEW_LENGTH));
            return;
        }
        state.setSubmitting(true);
        injector.inject(state, decision.get().value(), turn.fingerprint());
    }

    private void deferTurn(ScreenTurn turn, long delayMillis) {
        state.getTimers().replace(TimerCategory.DEFERRED_RESPONSE,
                () -> processTurn(turn), Duration.ofMillis(delayMillis));
    }

    private void armSessionTimeout(String sessionId) {
        state.getTimers().replace(TimerCategory.SESSION_TIMEOUT, () -> onSessionTimeout(sessionId), timings.sessionTimeout());
    }

    private void onSessionTimeout(String sessionId) {
        UssdSession session = state.getActiveSession();
        if (session == null || !session.getSessionId().equals(sessionId)) {
            return;
        }
        log.warn("USSD session timed out - sessionId: {}, step: {}", sessionId, session.getStep());
        finish(Outcome.failure(sessionId, session.getKind(), "USSD session timed out"));
    }

    private void complete(UssdSession session, boolean success, String message) {
        finish(outcomeExtractor.extract(session, success, message));
    }

    private void finish(Outcome outcome) {
        state.setActiveSession(null);
        state.reset();
        log.info("USSD session finished - sessionId: {}, success: {}, referenceId: {}",
                outcome.sessionId(), outcome.success(), outcome.referenceId());
        for (SessionEventListener listener : listeners) {
            try {
                listener.onOutcome(outcome);
            } catch (RuntimeException e) {
                log.error("Outcome listener failed - sessionId: {}", outcome.sessionId(), e);
            }
        }
    }

    private boolean isUssdSource(String sourceId) {
        return sourcePackages.isEmpty() || (sourceId != null && sourcePackages.contains(sourceId));
    }
}
