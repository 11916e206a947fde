package com.demoBank.ussdPay.device;

@FunctionalInterface
public interface SnapshotListener {

    /**
     * Called when the screen of the given source application changed.
     *
     * @param sourceId opaque source identifier (package name of the foreground app)
     */
    void onSnapshotChanged(String sourceId);
}
