package com.demoBank.ussdPay.device.remote;

import com.demoBank.ussdPay.device.FakeDevice;
import com.demoBank.ussdPay.device.SnapshotListener;
import com.demoBank.ussdPay.device.model.ScreenNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RemoteDeviceBridgeTest {

    @Test
    void testPublishSnapshotNotifiesListeners() {
        RemoteDeviceBridge bridge = new RemoteDeviceBridge(10);
        SnapshotListener listener = mock(SnapshotListener.class);
        bridge.addListener(listener);
        ScreenNode root = FakeDevice.promptScreen("Enter UPI PIN");

        bridge.publishSnapshot("com.android.phone", root);

        assertSame(root, bridge.currentSnapshot());
        verify(listener).onSnapshotChanged("com.android.phone");
    }

    @Test
    void testActionsAreQueuedInOrder() {
        RemoteDeviceBridge bridge = new RemoteDeviceBridge(10);
        ScreenNode screen = FakeDevice.promptScreen("Enter UPI PIN");
        ScreenNode input = bridge.findInputField(screen).orElseThrow();
        ScreenNode send = bridge.findControlByLabel(screen, List.of("Send")).orElseThrow();

        bridge.dial("*99#");
        bridge.requestFocus(input);
        bridge.setText(input, "1234");
        bridge.activate(send);

        List<DeviceCommand> commands = bridge.commandsSince(0);
        assertEquals(4, commands.size());
        assertEquals(DeviceCommandType.DIAL, commands.get(0).type());
        assertEquals("*99#", commands.get(0).argument());
        assertNull(commands.get(0).targetNodeId());
        assertEquals(DeviceCommandType.REQUEST_FOCUS, commands.get(1).type());
        assertEquals(DeviceCommandType.SET_TEXT, commands.get(2).type());
        assertEquals("input", commands.get(2).targetNodeId());
        assertEquals("1234", commands.get(2).argument());
        assertEquals(DeviceCommandType.ACTIVATE, commands.get(3).type());
        assertEquals("button-send", commands.get(3).targetNodeId());
        assertEquals(4, bridge.latestCommandId());
    }

    @Test
    void testCommandsSinceSkipsSeenCommands() {
        RemoteDeviceBridge bridge = new RemoteDeviceBridge(10);
        bridge.dial("*99#");
        bridge.dial("*99*1#");

        List<DeviceCommand> commands = bridge.commandsSince(1);

        assertEquals(1, commands.size());
        assertEquals(2, commands.get(0).id());
        assertTrue(bridge.commandsSince(2).isEmpty());
    }

    @Test
    void testFullBufferDropsOldest() {
        RemoteDeviceBridge bridge = new RemoteDeviceBridge(2);
        bridge.dial("a");
        bridge.dial("b");
        bridge.dial("c");

        List<DeviceCommand> commands = bridge.commandsSince(0);

        assertEquals(List.of("b", "c"), commands.stream().map(DeviceCommand::argument).toList());
        assertEquals(3, bridge.latestCommandId());
    }

    @Test
    void testControlWithoutIdIsRejected() {
        RemoteDeviceBridge bridge = new RemoteDeviceBridge(10);
        ScreenNode anonymous = ScreenNode.builder().text("OK").clickable(true).build();

        assertThrows(IllegalArgumentException.class, () -> bridge.activate(anonymous));
        assertTrue(bridge.commandsSince(0).isEmpty());
    }

    @Test
    void testArgumentIsHiddenFromToString() {
        RemoteDeviceBridge bridge = new RemoteDeviceBridge(10);
        ScreenNode input = ScreenNode.builder().id("input").editable(true).build();
        bridge.setText(input, "1234");

        assertFalse(bridge.commandsSince(0).get(0).toString().contains("1234"));
    }

    @Test
    void testInvalidBufferSize() {
        assertThrows(IllegalArgumentException.class, () -> new RemoteDeviceBridge(0));
    }
}
