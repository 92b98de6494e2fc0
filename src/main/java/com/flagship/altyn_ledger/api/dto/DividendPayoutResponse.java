package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.dividend.DividendPayout;
import com.flagship.altyn_ledger.dividend.DividendShare;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class DividendPayoutResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("total_distributed")
    BigDecimal totalDistributed;

    @JsonProperty("holders_count")
    int holdersCount;

    @JsonProperty("token_supply")
    BigDecimal tokenSupply;

    @JsonProperty("distributed_by")
    String distributedBy;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("distribution_details")
    List<Detail> distributionDetails;

    @Value
    public static class Detail {
        @JsonProperty("user_id")
        String userId;

        @JsonProperty("token_balance")
        BigDecimal tokenBalance;

        @JsonProperty("token_percentage")
        BigDecimal tokenPercentage;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("transaction_id")
        UUID transactionId;

        static Detail from(DividendShare share) {
            return new Detail(share.getUserId(), share.getTokenBalance(), share.getTokenPercentage(),
                share.getAmount(), share.getTransactionId());
        }
    }

    public static DividendPayoutResponse from(DividendPayout payout) {
        return DividendPayoutResponse.builder()
            .id(payout.getId())
            .totalDistributed(payout.getTotalDistributed())
            .holdersCount(payout.getHoldersCount())
            .tokenSupply(payout.getTokenSupply())
            .distributedBy(payout.getDistributedBy())
            .createdAt(payout.getCreatedAt())
            .distributionDetails(payout.getDistributionDetails().stream().map(Detail::from).toList())
            .build();
    }
}
