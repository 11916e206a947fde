package com.demoBank.ussdPay.engine.session;

import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Live automation context for one user-initiated operation.
 *
 * Progress is a set of one-way flags plus a step counter for diagnostics.
 * Mutated only on the engine loop.
 */
@Getter
public class UssdSession {

    private final String sessionId;
    private final SessionKind kind;
    private final SessionSecrets secrets;
    private final TransferParams transfer;
    private final Instant startedAt;
    private final Set<ProgressFlag> progress = EnumSet.noneOf(ProgressFlag.class);
    private int step;

    private UssdSession(String sessionId, SessionKind kind, SessionSecrets secrets, TransferParams transfer) {
        this.sessionId = sessionId;
        this.kind = kind;
        this.secrets = secrets;
        this.transfer = transfer;
        this.startedAt = Instant.now();
    }

    public static UssdSession balanceCheck(String sessionId, SessionSecrets secrets) {
        return new UssdSession(sessionId, SessionKind.BALANCE_CHECK, secrets, null);
    }

    public static UssdSession sendMoney(String sessionId, SessionSecrets secrets, TransferParams transfer) {
        if (transfer == null) {
            throw new IllegalArgumentException("Send money session requires transfer parameters");
        }
        return new UssdSession(sessionId, SessionKind.SEND_MONEY, secrets, transfer);
    }

    public static UssdSession linkBank(String sessionId, SessionSecrets secrets) {
        return new UssdSession(sessionId, SessionKind.LINK_BANK, secrets, null);
    }

    public boolean isDone(ProgressFlag flag) {
        return progress.contains(flag);
    }

    /**
     * Marks a field as answered and advances the step counter.
     *
     * @throws IllegalStateException if the field was already answered
     */
    public void markDone(ProgressFlag flag) {
        if (!progress.add(flag)) {
            throw new IllegalStateException(flag + " already answered in session " + sessionId);
        }
        step++;
    }

    public Set<ProgressFlag> getProgress() {
        return Collections.unmodifiableSet(progress);
    }

    @Override
    public String toString() {
        return "UssdSession[" + sessionId + ", " + kind + ", step=" + step + ", progress=" + progress + "]";
    }
}
