package com.demoBank.ussdPay.device.dto;

import com.demoBank.ussdPay.device.model.ScreenNode;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Screen snapshot pushed by the device agent.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotRequest {

    @NotBlank(message = "sourceId cannot be blank")
    private String sourceId;

    @NotNull(message = "root cannot be null")
    private ScreenNode root;
}
