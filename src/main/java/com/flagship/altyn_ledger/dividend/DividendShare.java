package com.flagship.altyn_ledger.dividend;

import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * One holder's line in a dividend run. {@code transactionId} is null when the
 * rounded payout was 0.00 and no DIVIDEND transaction was written.
 */
@Value
public class DividendShare {
    String userId;
    BigDecimal tokenBalance;
    BigDecimal tokenPercentage;
    BigDecimal amount;
    UUID transactionId;

    public boolean isPaid() {
        return amount.signum() > 0;
    }

    DividendShare withTransactionId(UUID id) {
        return new DividendShare(userId, tokenBalance, tokenPercentage, amount, id);
    }

    DividendShare withAmount(BigDecimal newAmount) {
        return new DividendShare(userId, tokenBalance, tokenPercentage, newAmount, transactionId);
    }
}
