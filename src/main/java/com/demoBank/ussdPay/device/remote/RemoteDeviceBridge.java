package com.demoBank.ussdPay.device.remote;

import com.demoBank.ussdPay.device.Dialer;
import com.demoBank.ussdPay.device.InputActuator;
import com.demoBank.ussdPay.device.SnapshotListener;
import com.demoBank.ussdPay.device.SnapshotSource;
import com.demoBank.ussdPay.device.model.ScreenNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Device bridge for a companion agent running on the phone.
 *
 * The agent pushes screen snapshots in and polls for queued commands. Commands are
 * kept in a bounded buffer; the oldest ones are dropped once it is full, so an agent
 * that falls too far behind misses them.
 */
@Slf4j
public class RemoteDeviceBridge implements SnapshotSource, InputActuator, Dialer {

    private final int maxBufferSize;
    private final AtomicLong sequence = new AtomicLong();
    private final List<DeviceCommand> buffer = new ArrayList<>();
    private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();
    private volatile ScreenNode currentSnapshot;

    public RemoteDeviceBridge(int maxBufferSize) {
        if (maxBufferSize < 1) {
            throw new IllegalArgumentException("Command buffer size must be positive: " + maxBufferSize);
        }
        this.maxBufferSize = maxBufferSize;
    }

    /**
     * Stores the latest snapshot pushed by the agent and notifies listeners.
     *
     * @param sourceId package name of the app in the foreground
     * @param root     snapshot root
     */
    public void publishSnapshot(String sourceId, ScreenNode root) {
        currentSnapshot = root;
        for (SnapshotListener listener : listeners) {
            listener.onSnapshotChanged(sourceId);
        }
    }

    @Override
    public ScreenNode currentSnapshot() {
        return currentSnapshot;
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
        enqueue(DeviceCommandType.SET_TEXT, targetOf(control), text);
    }

    @Override
    public void activate(ScreenNode control) {
        enqueue(DeviceCommandType.ACTIVATE, targetOf(control), null);
    }

    @Override
    public void requestFocus(ScreenNode control) {
        enqueue(DeviceCommandType.REQUEST_FOCUS, targetOf(control), null);
    }

    @Override
    public void dial(String shortCode) {
        enqueue(DeviceCommandType.DIAL, null, shortCode);
    }

    /**
     * Returns the buffered commands newer than the given id, oldest first.
     */
    public synchronized List<DeviceCommand> commandsSince(long sinceId) {
        return buffer.stream()
                .filter(command -> command.id() > sinceId)
                .toList();
    }

    public long latestCommandId() {
        return sequence.get();
    }

    private synchronized void enqueue(DeviceCommandType type, String targetNodeId, String argument) {
        DeviceCommand command = new DeviceCommand(sequence.incrementAndGet(), type, targetNodeId, argument, Instant.now());
        buffer.add(command);
        if (buffer.size() > maxBufferSize) {
            buffer.remove(0);
        }
        log.debug("Queued device command: {}", command);
    }

    private static String targetOf(ScreenNode control) {
        if (control == null || control.getId() == null) {
            throw new IllegalArgumentException("Control has no node id");
        }
        return control.getId();
    }
}
