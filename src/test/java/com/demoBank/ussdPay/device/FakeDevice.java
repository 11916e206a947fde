package com.demoBank.ussdPay.device;

import com.demoBank.ussdPay.device.model.ScreenNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Scriptable device: shows screens set by the test and records every action
 * as "text:&lt;value&gt;", "click:&lt;label&gt;", "focus" or "dial:&lt;code&gt;".
 */
public class FakeDevice implements SnapshotSource, InputActuator, Dialer {

    public static final String DIALER_PACKAGE = "com.android.phone";

    private final List<SnapshotListener> listeners = new ArrayList<>();
    private final List<String> actions = new ArrayList<>();
    private ScreenNode screen;
    private RuntimeException setTextFailure;
    private RuntimeException dialFailure;

    /**
     * USSD dialog with a message, a focused input field and Cancel/Send buttons.
     */
    public static ScreenNode promptScreen(String message) {
        return dialog(message, true, "Cancel", "Send");
    }

    /**
     * USSD dialog with a message and an OK button only.
     */
    public static ScreenNode infoScreen(String message) {
        return dialog(message, false, "OK");
    }

    public static ScreenNode dialog(String message, boolean withInput, String... buttons) {
        List<ScreenNode> children = new ArrayList<>();
        children.add(ScreenNode.builder().id("message").className("android.widget.TextView").text(message).build());
        if (withInput) {
            children.add(ScreenNode.builder().id("input").className("android.widget.EditText")
                    .editable(true).focused(true).build());
        }
        for (String button : buttons) {
            children.add(ScreenNode.builder().id("button-" + button.toLowerCase())
                    .className("android.widget.Button").text(button).clickable(true).build());
        }
        return ScreenNode.builder().id("root").className("android.widget.FrameLayout").children(children).build();
    }

    public void show(ScreenNode root) {
        this.screen = root;
    }

    /**
     * Shows a screen and fires a change event from the dialer package.
     */
    public void showAndNotify(ScreenNode root) {
        show(root);
        List.copyOf(listeners).forEach(listener -> listener.onSnapshotChanged(DIALER_PACKAGE));
    }

    public List<String> actions() {
        return actions;
    }

    public void failSetTextWith(RuntimeException failure) {
        this.setTextFailure = failure;
    }

    public void failDialWith(RuntimeException failure) {
        this.dialFailure = failure;
    }

    @Override
    public ScreenNode currentSnapshot() {
        return screen;
    }

    @Override
    public void addListener(SnapshotListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(SnapshotListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void setText(ScreenNode control, String text) {
        if (setTextFailure != null) {
            throw setTextFailure;
        }
        actions.add("text:" + text);
    }

    @Override
    public void activate(ScreenNode control) {
        actions.add("click:" + control.getText());
    }

    @Override
    public void requestFocus(ScreenNode control) {
        actions.add("focus");
        control.setFocused(true);
    }

    @Override
    public void dial(String shortCode) {
        if (dialFailure != null) {
            throw dialFailure;
        }
        actions.add("dial:" + shortCode);
    }
}
