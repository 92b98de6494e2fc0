package com.flagship.altyn_ledger.exchange;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Display-currency rates per 1 COIN, bound from {@code altyn.exchange.rates}.
 * USD is fixed by the peg and never read from here.
 */
@ConfigurationProperties(prefix = "altyn.exchange")
public class ExchangeRateProperties {

    private Map<String, BigDecimal> rates = new LinkedHashMap<>();

    public Map<String, BigDecimal> getRates() {
        return rates;
    }

    public void setRates(Map<String, BigDecimal> rates) {
        this.rates = rates;
    }
}
