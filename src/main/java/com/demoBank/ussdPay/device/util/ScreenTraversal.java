package com.demoBank.ussdPay.device.util;

import com.demoBank.ussdPay.device.model.ScreenNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Depth-first lookups over screen snapshots.
 * All methods accept a null root and treat it as an empty screen.
 */
public final class ScreenTraversal {

    private ScreenTraversal() {
    }

    /**
     * Collects every non-blank text value in traversal order.
     * Text held by input fields is skipped: it is what we typed, not what the remote side said.
     *
     * @param root snapshot root
     * @return text values, possibly empty
     */
    public static List<String> collectTexts(ScreenNode root) {
        List<String> texts = new ArrayList<>();
        collectTexts(root, texts);
        return texts;
    }

    /**
     * Finds the first node accepting free text input.
     *
     * @param root snapshot root
     * @return the input field, or empty if the screen has none
     */
    public static Optional<ScreenNode> findInputField(ScreenNode root) {
        if (root == null) {
            return Optional.empty();
        }
        if (root.isInputField()) {
            return Optional.of(root);
        }
        for (ScreenNode child : childrenOf(root)) {
            Optional<ScreenNode> result = findInputField(child);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the first clickable node whose text or accessible description equals
     * one of the labels, ignoring case.
     *
     * @param root snapshot root
     * @param labels candidate labels
     * @return matching control, or empty
     */
    public static Optional<ScreenNode> findClickableByLabel(ScreenNode root, List<String> labels) {
        if (root == null || labels == null || labels.isEmpty()) {
            return Optional.empty();
        }
        if (root.isClickable()) {
            for (String label : labels) {
                if (label.equalsIgnoreCase(nullToEmpty(root.getText()))
                        || label.equalsIgnoreCase(nullToEmpty(root.getContentDescription()))) {
                    return Optional.of(root);
                }
            }
        }
        for (ScreenNode child : childrenOf(root)) {
            Optional<ScreenNode> result = findClickableByLabel(child, labels);
            if (result.isPresent()) {
                return result;
            }
        }
        return Optional.empty();
    }

    private static void collectTexts(ScreenNode node, List<String> texts) {
        if (node == null) {
            return;
        }
        String text = node.getText();
        if (!node.isInputField() && text != null && !text.isBlank()) {
            texts.add(text);
        }
        for (ScreenNode child : childrenOf(node)) {
            collectTexts(child, texts);
        }
    }

    private static List<ScreenNode> childrenOf(ScreenNode node) {
        return node.getChildren() != null ? node.getChildren() : List.of();
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
