package com.demoBank.ussdPay.gateway.dto;

import com.demoBank.ussdPay.credentials.model.BankCredentials;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for balance checks and bank linking.
 * Customer ID comes from the HTTP header.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CredentialsRequest {

    @NotNull(message = "credentials are required")
    private BankCredentials credentials;
}
