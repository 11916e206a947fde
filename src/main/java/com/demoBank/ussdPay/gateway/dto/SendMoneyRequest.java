package com.demoBank.ussdPay.gateway.dto;

import com.demoBank.ussdPay.credentials.model.BankCredentials;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Request DTO for payments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SendMoneyRequest {

    @NotNull(message = "credentials are required")
    private BankCredentials credentials;

    @NotBlank(message = "recipient cannot be blank")
    private String recipient;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "1", message = "amount must be at least 1")
    private BigDecimal amount;

    @Size(max = 50, message = "remarks must be at most 50 characters")
    private String remarks;
}
