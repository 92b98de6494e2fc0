package com.flagship.altyn_ledger.exchange;

import com.flagship.altyn_ledger.error.NotFoundException;
import com.flagship.altyn_ledger.ledger.AssetType;
import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Conversion rates from COIN to display currencies.
 *
 * COIN is pegged to USD, so USD is always exactly 1.0. Other rates come from
 * configuration and may be replaced out of band with {@link #updateRates};
 * readers always see one complete rate table, never a partial update.
 */
@Component
@Slf4j
public class ExchangeRateProvider {

    public static final String BASE_CURRENCY = "USD";

    private volatile Map<String, BigDecimal> rates;

    public ExchangeRateProvider(ExchangeRateProperties properties) {
        this.rates = buildTable(properties.getRates());
    }

    /**
     * Every supported currency with its rate per 1 COIN, USD first.
     */
    public Map<String, BigDecimal> getRates() {
        return rates;
    }

    /**
     * coinAmount * rate[currency], rounded HALF_UP to 2 places.
     *
     * @throws NotFoundException if the currency is not supported
     */
    public BigDecimal convert(BigDecimal coinAmount, String currency) {
        if (coinAmount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        BigDecimal rate = rateFor(currency);
        return coinAmount.multiply(rate).setScale(AssetType.COIN.getScale(), LedgerAmounts.ROUNDING);
    }

    public BigDecimal rateFor(String currency) {
        String code = currency == null ? "" : currency.trim().toUpperCase(Locale.ROOT);
        BigDecimal rate = rates.get(code);
        if (rate == null) {
            throw new NotFoundException("Unsupported currency: " + currency);
        }
        return rate;
    }

    /**
     * Replaces the configured rates. USD cannot be overridden.
     */
    public void updateRates(Map<String, BigDecimal> newRates) {
        this.rates = buildTable(newRates);
        log.info("Exchange rates updated: currencies={}", rates.keySet());
    }

    private static Map<String, BigDecimal> buildTable(Map<String, BigDecimal> configured) {
        Map<String, BigDecimal> table = new LinkedHashMap<>();
        table.put(BASE_CURRENCY, BigDecimal.ONE.setScale(1));
        configured.forEach((currency, rate) -> {
            String code = currency.trim().toUpperCase(Locale.ROOT);
            if (BASE_CURRENCY.equals(code)) {
                return;
            }
            if (rate == null || rate.signum() <= 0) {
                throw new IllegalArgumentException("Exchange rate must be positive: " + code + "=" + rate);
            }
            table.put(code, rate);
        });
        return Collections.unmodifiableMap(table);
    }
}
