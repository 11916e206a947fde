package com.demoBank.ussdPay.device.remote;

import java.time.Instant;

/**
 * Action the device agent has to perform.
 *
 * @param id           sequence number, increasing per bridge
 * @param type         action type
 * @param targetNodeId id of the node to act on, null for DIAL
 * @param argument     text to set or short code to dial, null otherwise
 * @param createdAt    when the command was queued
 */
public record DeviceCommand(long id, DeviceCommandType type, String targetNodeId, String argument, Instant createdAt) {

    @Override
    public String toString() {
        return "DeviceCommand[" + id + ", " + type + ", target=" + targetNodeId + "]";
    }
}
