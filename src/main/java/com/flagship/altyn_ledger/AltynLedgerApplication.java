package com.flagship.altyn_ledger;

import com.flagship.altyn_ledger.exchange.ExchangeRateProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(ExchangeRateProperties.class)
public class AltynLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(AltynLedgerApplication.class, args);
    }
}
