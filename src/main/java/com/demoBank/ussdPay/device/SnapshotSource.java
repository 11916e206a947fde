package com.demoBank.ussdPay.device;

import com.demoBank.ussdPay.device.model.ScreenNode;

/**
 * Supplies screen snapshots of the device hosting the USSD dialog.
 */
public interface SnapshotSource {

    /**
     * Returns the snapshot of the currently active window.
     *
     * @return root node, or null if no window content is available
     */
    ScreenNode currentSnapshot();

    /**
     * Registers a listener notified whenever screen content changes.
     *
     * @param listener listener to notify
     */
    void addListener(SnapshotListener listener);

    void removeListener(SnapshotListener listener);
}
