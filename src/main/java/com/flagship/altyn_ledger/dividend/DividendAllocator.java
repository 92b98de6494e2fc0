package com.flagship.altyn_ledger.dividend;

import com.flagship.altyn_ledger.ledger.LedgerAmounts;
import com.flagship.altyn_ledger.ledger.Wallet;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Splits a COIN pool across TOKEN holders pro rata, to the cent, with no
 * remainder left over and none created.
 *
 * Rules:
 * - each payout is round(pool * balance / supply, 2), HALF_UP, computed in user id order
 * - the difference between the pool and the sum of rounded payouts goes to the
 *   largest holder (ties: lowest user id)
 * - when that difference is negative and larger than the largest holder's
 *   payout, the excess comes from the next-largest holders; no payout goes below zero
 */
public final class DividendAllocator {

    private static final Comparator<DividendShare> LARGEST_FIRST =
            Comparator.comparing(DividendShare::getTokenBalance).reversed()
                    .thenComparing(DividendShare::getUserId);

    private DividendAllocator() {
    }

    /**
     * @param pool    amount to distribute, scale 2, positive
     * @param holders wallets with a positive TOKEN balance, ordered by user id
     * @param supply  total TOKEN supply the shares are measured against
     * @return one share per holder, in the order given
     */
    public static List<DividendShare> allocate(BigDecimal pool, List<Wallet> holders, BigDecimal supply) {
        if (holders.isEmpty()) {
            throw new IllegalArgumentException("No holders to allocate to");
        }
        if (supply.signum() <= 0) {
            throw new IllegalArgumentException("Token supply must be positive: " + supply.toPlainString());
        }

        List<DividendShare> shares = new ArrayList<>(holders.size());
        BigDecimal allocated = BigDecimal.ZERO;
        for (Wallet holder : holders) {
            BigDecimal payout = LedgerAmounts.proRata(pool, holder.getTokenBalance(), supply);
            shares.add(new DividendShare(
                    holder.getUserId(),
                    holder.getTokenBalance(),
                    LedgerAmounts.percentage(holder.getTokenBalance(), supply),
                    payout,
                    null));
            allocated = allocated.add(payout);
        }

        BigDecimal residual = pool.subtract(allocated);
        if (residual.signum() != 0) {
            assignResidual(shares, residual);
        }
        return shares;
    }

    private static void assignResidual(List<DividendShare> shares, BigDecimal residual) {
        List<DividendShare> ranked = new ArrayList<>(shares);
        ranked.sort(LARGEST_FIRST);

        if (residual.signum() > 0) {
            DividendShare largest = ranked.get(0);
            replace(shares, largest, largest.getAmount().add(residual));
            return;
        }

        BigDecimal remaining = residual.negate();
        for (DividendShare share : ranked) {
            if (remaining.signum() == 0) {
                break;
            }
            BigDecimal taken = share.getAmount().min(remaining);
            replace(shares, share, share.getAmount().subtract(taken));
            remaining = remaining.subtract(taken);
        }
        if (remaining.signum() != 0) {
            throw new IllegalStateException("Rounding residual exceeds allocated payouts: " + remaining.toPlainString());
        }
    }

    private static void replace(List<DividendShare> shares, DividendShare share, BigDecimal amount) {
        shares.set(shares.indexOf(share), share.withAmount(amount));
    }
}
