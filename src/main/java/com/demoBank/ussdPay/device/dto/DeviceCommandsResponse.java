package com.demoBank.ussdPay.device.dto;

import com.demoBank.ussdPay.device.remote.DeviceCommand;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Commands queued for the device agent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DeviceCommandsResponse {

    private List<DeviceCommand> commands;

    /** Id to pass as "since" on the next poll. */
    private long latestId;
}
