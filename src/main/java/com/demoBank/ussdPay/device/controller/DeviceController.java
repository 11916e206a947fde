package com.demoBank.ussdPay.device.controller;

import com.demoBank.ussdPay.device.dto.DeviceCommandsResponse;
import com.demoBank.ussdPay.device.dto.SnapshotRequest;
import com.demoBank.ussdPay.device.remote.DeviceCommand;
import com.demoBank.ussdPay.device.remote.RemoteDeviceBridge;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Device REST controller - endpoint pair used by the agent on the phone.
 */
@RestController
@RequestMapping("/api/v1/device")
@RequiredArgsConstructor
public class DeviceController {

    private final RemoteDeviceBridge deviceBridge;

    @PostMapping("/snapshots")
    public ResponseEntity<Void> publishSnapshot(@Valid @RequestBody SnapshotRequest request) {
        deviceBridge.publishSnapshot(request.getSourceId(), request.getRoot());
        return ResponseEntity.accepted().build();
    }

    /**
     * Returns commands queued after the given id.
     *
     * @param since last command id the agent has already executed
     */
    @GetMapping("/commands")
    public ResponseEntity<DeviceCommandsResponse> commands(@RequestParam(defaultValue = "0") long since) {
        List<DeviceCommand> commands = deviceBridge.commandsSince(since);
        // With nothing pending the agent resyncs to our sequence, which restarts with the server.
        long latestId = commands.isEmpty()
                ? deviceBridge.latestCommandId()
                : commands.get(commands.size() - 1).id();
        DeviceCommandsResponse response = DeviceCommandsResponse.builder()
                .latestId(latestId)
                .commands(commands)
                .build();
        return ResponseEntity.ok(response);
    }
}
