package com.demoBank.ussdPay.device;

import com.demoBank.ussdPay.device.model.ScreenNode;
import com.demoBank.ussdPay.device.util.ScreenTraversal;

import java.util.List;
import java.util.Optional;

/**
 * Injects synthetic input into the device screen.
 *
 * Lookups default to depth-first traversal of the snapshot; implementations only
 * have to deliver the actions.
 */
public interface InputActuator {

    default Optional<ScreenNode> findInputField(ScreenNode snapshot) {
        return ScreenTraversal.findInputField(snapshot);
    }

    default Optional<ScreenNode> findControlByLabel(ScreenNode snapshot, List<String> labels) {
        return ScreenTraversal.findClickableByLabel(snapshot, labels);
    }

    void setText(ScreenNode control, String text);

    void activate(ScreenNode control);

    void requestFocus(ScreenNode control);
}
