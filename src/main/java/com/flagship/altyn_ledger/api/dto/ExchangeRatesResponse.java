package com.flagship.altyn_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

@Value
public class ExchangeRatesResponse {

    // COIN is pegged 1:1 to this currency.
    @JsonProperty("base")
    String base;

    @JsonProperty("rates")
    Map<String, BigDecimal> rates;
}
