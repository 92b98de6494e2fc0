package com.flagship.altyn_ledger.ledger;

import com.flagship.altyn_ledger.error.InvalidAmountException;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-point arithmetic rules shared by every ledger flow.
 *
 * All rounding is HALF_UP. COIN values carry 2 fraction digits, TOKEN values 4.
 */
public final class LedgerAmounts {

    /**
     * Fee withheld from the recipient's share of every COIN transfer or payment (0.1%).
     */
    public static final BigDecimal FEE_RATE = new BigDecimal("0.001");

    public static final RoundingMode ROUNDING = RoundingMode.HALF_UP;

    private static final int PERCENTAGE_SCALE = 4;
    private static final BigDecimal ONE_HUNDRED = BigDecimal.valueOf(100);

    private LedgerAmounts() {
    }

    /**
     * Validates a caller-supplied amount and normalizes it to the asset scale.
     *
     * @throws InvalidAmountException if the amount is null, not positive, or more precise than the asset allows
     */
    public static BigDecimal requirePositive(BigDecimal amount, AssetType assetType) {
        if (amount == null) {
            throw new InvalidAmountException("Amount is required");
        }
        if (amount.signum() <= 0) {
            throw new InvalidAmountException("Amount must be positive: " + amount.toPlainString());
        }
        if (amount.stripTrailingZeros().scale() > assetType.getScale()) {
            throw new InvalidAmountException(String.format(
                    "%s amounts support at most %d fraction digits: %s",
                    assetType, assetType.getScale(), amount.toPlainString()));
        }
        return amount.setScale(assetType.getScale(), ROUNDING);
    }

    /**
     * fee = round(amount * FEE_RATE, 2)
     */
    public static BigDecimal feeFor(BigDecimal amount) {
        return amount.multiply(FEE_RATE).setScale(AssetType.COIN.getScale(), ROUNDING);
    }

    public static BigDecimal zero(AssetType assetType) {
        return BigDecimal.ZERO.setScale(assetType.getScale());
    }

    public static BigDecimal coins(BigDecimal value) {
        return value.setScale(AssetType.COIN.getScale(), ROUNDING);
    }

    /**
     * Share of {@code part} in {@code total}, expressed in percent with 4 fraction digits.
     * Returns zero when the total is zero.
     */
    public static BigDecimal percentage(BigDecimal part, BigDecimal total) {
        if (total == null || total.signum() == 0) {
            return BigDecimal.ZERO.setScale(PERCENTAGE_SCALE);
        }
        return part.multiply(ONE_HUNDRED).divide(total, PERCENTAGE_SCALE, ROUNDING);
    }

    /**
     * round(pool * part / total, 2). Multiplies before dividing so exact shares stay exact.
     */
    public static BigDecimal proRata(BigDecimal pool, BigDecimal part, BigDecimal total) {
        if (total.signum() == 0) {
            return zero(AssetType.COIN);
        }
        return pool.multiply(part).divide(total, AssetType.COIN.getScale(), ROUNDING);
    }
}
