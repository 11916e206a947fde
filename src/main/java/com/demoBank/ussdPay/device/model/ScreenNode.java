package com.demoBank.ussdPay.device.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One node of a screen snapshot as exposed by the device's UI-introspection layer.
 *
 * A snapshot is the root node; children are kept in on-screen traversal order.
 * Nodes are plain values: a node reported by the device may already be gone from
 * the live screen, so anything acting on it must tolerate the device ignoring it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScreenNode {

    /**
     * Device-assigned node identifier (view id or traversal path).
     * Used by the device agent to resolve actuation commands.
     */
    private String id;

    /**
     * Widget class name, e.g. "android.widget.EditText".
     */
    private String className;

    /**
     * Visible text of the node. Null when the node carries no text.
     */
    private String text;

    /**
     * Accessible description of the node. Null when absent.
     */
    private String contentDescription;

    private boolean editable;

    private boolean clickable;

    private boolean focused;

    @Builder.Default
    private List<ScreenNode> children = new ArrayList<>();

    /**
     * Checks whether this node accepts free text input.
     *
     * @return true for editable nodes and EditText widgets
     */
    @JsonIgnore
    public boolean isInputField() {
        return editable || (className != null && className.contains("EditText"));
    }
}
