package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.altyn_ledger.corporate.CorporateTransaction;
import com.flagship.altyn_ledger.corporate.CorporateTransactionPage;
import com.flagship.altyn_ledger.transaction.LedgerTransaction;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

@Value
public class CorporateTransactionPageResponse {

    @JsonProperty("organization_id")
    String organizationId;

    @JsonProperty("transactions")
    List<Entry> transactions;

    @JsonProperty("total")
    long total;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("offset")
    int offset;

    public static CorporateTransactionPageResponse from(CorporateTransactionPage page) {
        return new CorporateTransactionPageResponse(
            page.getOrganizationId(),
            page.getTransactions().stream().map(Entry::from).toList(),
            page.getTotal(),
            page.getLimit(),
            page.getOffset());
    }

    @Value
    public static class Entry {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("type")
        String type;

        @JsonProperty("direction")
        String direction;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("fee")
        BigDecimal fee;

        @JsonProperty("net_amount")
        BigDecimal netAmount;

        @JsonProperty("counterparty_id")
        String counterpartyId;

        @JsonProperty("counterparty_name")
        String counterpartyName;

        @JsonProperty("counterparty_type")
        String counterpartyType;

        @JsonProperty("description")
        String description;

        @JsonProperty("created_at")
        Instant createdAt;

        static Entry from(CorporateTransaction entry) {
            LedgerTransaction tx = entry.getTransaction();
            return new Entry(
                tx.getId(),
                tx.getType().name(),
                entry.getDirection().name().toLowerCase(Locale.ROOT),
                tx.getAmount(),
                tx.getFee(),
                tx.getNetAmount(),
                entry.getCounterpartyId(),
                entry.getCounterpartyName(),
                entry.getCounterpartyType().name().toLowerCase(Locale.ROOT),
                tx.getDescription(),
                tx.getCreatedAt());
        }
    }
}
