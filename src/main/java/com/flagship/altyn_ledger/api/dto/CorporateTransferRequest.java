package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * COIN payment out of an organization's wallet. The recipient is a user, by
 * id or email, or another organization.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CorporateTransferRequest {

    @NotBlank(message = "Organization ID is required")
    @JsonProperty("organization_id")
    private String organizationId;

    @JsonProperty("to_user_id")
    private String toUserId;

    @JsonProperty("to_user_email")
    private String toUserEmail;

    @JsonProperty("to_organization_id")
    private String toOrganizationId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;

    @Size(max = 500, message = "Description must be at most 500 characters")
    @JsonProperty("description")
    private String description;

    @JsonIgnore
    @AssertTrue(message = "Exactly one of to_user_id, to_user_email or to_organization_id is required")
    public boolean isRecipientGiven() {
        int given = 0;
        for (String recipient : new String[] {toUserId, toUserEmail, toOrganizationId}) {
            if (!isBlank(recipient)) {
                given++;
            }
        }
        return given == 1;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
