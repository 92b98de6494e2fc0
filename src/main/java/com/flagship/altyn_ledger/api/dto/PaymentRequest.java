package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Payment for a marketplace product or a service booking. The listing id
 * is opaque to the ledger and only echoed on the receipt.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PaymentRequest {

    @NotBlank(message = "Listing id is required")
    @JsonProperty("listing_id")
    @JsonAlias({"product_id", "service_id"})
    private String listingId;

    @NotBlank(message = "Seller id is required")
    @JsonProperty("seller_id")
    private String sellerId;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount;
}
