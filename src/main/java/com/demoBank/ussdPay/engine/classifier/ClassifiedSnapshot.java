package com.demoBank.ussdPay.engine.classifier;

/**
 * Text extracted from one snapshot.
 *
 * @param rawText         filtered text fragments joined by newlines, empty if none survived
 * @param protocolContent whether the text looks like USSD banking content
 */
public record ClassifiedSnapshot(String rawText, boolean protocolContent) {

    public static final ClassifiedSnapshot EMPTY = new ClassifiedSnapshot("", false);

    public boolean isActionable() {
        return protocolContent && !rawText.isEmpty();
    }
}
