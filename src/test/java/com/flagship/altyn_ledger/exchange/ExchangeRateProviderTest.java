package com.flagship.altyn_ledger.exchange;

import com.flagship.altyn_ledger.error.NotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExchangeRateProviderTest {

    private ExchangeRateProvider provider;

    @BeforeEach
    void setUp() {
        ExchangeRateProperties properties = new ExchangeRateProperties();
        Map<String, BigDecimal> rates = new LinkedHashMap<>();
        rates.put("RUB", new BigDecimal("92.50"));
        rates.put("kzt", new BigDecimal("485.00"));
        properties.setRates(rates);
        provider = new ExchangeRateProvider(properties);
    }

    @Test
    @DisplayName("USD is pegged at 1.0 and listed first")
    void usdIsPegged() {
        Map<String, BigDecimal> rates = provider.getRates();

        assertEquals(List.of("USD", "RUB", "KZT"), List.copyOf(rates.keySet()));
        assertEquals(0, BigDecimal.ONE.compareTo(rates.get("USD")));
    }

    @Test
    @DisplayName("Conversion rounds half-up to two places")
    void convertsCoinAmounts() {
        assertEquals(new BigDecimal("4625.00"), provider.convert(new BigDecimal("50.00"), "RUB"));
        assertEquals(new BigDecimal("0.05"), provider.convert(new BigDecimal("0.05"), "usd"));
        assertEquals(new BigDecimal("4.85"), provider.convert(new BigDecimal("0.01"), "KZT"));
    }

    @Test
    @DisplayName("Unknown currencies are reported as not found")
    void unknownCurrency() {
        assertThrows(NotFoundException.class, () -> provider.convert(BigDecimal.TEN, "GBP"));
        assertThrows(NotFoundException.class, () -> provider.rateFor(null));
    }

    @Test
    @DisplayName("Rate updates replace the table but keep the USD peg")
    void updateKeepsPeg() {
        provider.updateRates(Map.of("USD", new BigDecimal("2.0"), "EUR", new BigDecimal("0.92")));

        assertEquals(0, BigDecimal.ONE.compareTo(provider.rateFor("USD")));
        assertEquals(new BigDecimal("0.92"), provider.rateFor("EUR"));
        assertThrows(NotFoundException.class, () -> provider.rateFor("RUB"));
    }

    @Test
    @DisplayName("Non-positive rates are refused and the old table stays in place")
    void rejectsNonPositiveRate() {
        assertThrows(IllegalArgumentException.class,
                () -> provider.updateRates(Map.of("EUR", BigDecimal.ZERO)));

        assertEquals(new BigDecimal("92.50"), provider.rateFor("RUB"));
    }
}
